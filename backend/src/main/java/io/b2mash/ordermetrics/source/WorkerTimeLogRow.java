package io.b2mash.ordermetrics.source;

/** Manual labor entry recorded against an order outside the procurement flow. */
public record WorkerTimeLogRow(
    long id, String orderId, Double qty, Double actTimePerUnit, String worker, String workDate) {}
