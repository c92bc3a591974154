package io.b2mash.ordermetrics.kpi;

import io.b2mash.ordermetrics.exception.ResourceNotFoundException;
import jakarta.validation.constraints.Min;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/kpi/orders")
public class OrderKpiController {

  private final OrderKpiService orderKpiService;

  public OrderKpiController(OrderKpiService orderKpiService) {
    this.orderKpiService = orderKpiService;
  }

  @GetMapping("/{orderId}")
  public ResponseEntity<OrderKpiResponse> getOrderKpi(@PathVariable String orderId) {
    return orderKpiService
        .getOrderKpi(orderId)
        .map(OrderKpiResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
  }

  @GetMapping
  public ResponseEntity<OrderKpiPageResponse> listOrderKpis(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
      @RequestParam(required = false) String q,
      @RequestParam(required = false) @Min(1) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    var result =
        orderKpiService.listOrderKpis(new OrderKpiFilter(from, to, q, page, pageSize));
    return ResponseEntity.ok(OrderKpiPageResponse.from(result));
  }

  // --- DTOs ---

  public record OrderKpiResponse(
      String orderId,
      String productName,
      double qty,
      String dueDate,
      double sales,
      double estimatedMaterialCost,
      double stdTimePerUnit,
      String status,
      String customerName,
      double materialCost,
      double laborCost,
      double grossProfit,
      double actualTimePerUnit,
      double variancePct) {

    public static OrderKpiResponse from(OrderKpi kpi) {
      return new OrderKpiResponse(
          kpi.orderId(),
          kpi.productName(),
          kpi.qty(),
          kpi.dueDate(),
          kpi.sales(),
          kpi.estimatedMaterialCost(),
          kpi.stdTimePerUnit(),
          kpi.status(),
          kpi.customerName(),
          kpi.materialCost(),
          kpi.laborCost(),
          kpi.grossProfit(),
          kpi.actualTimePerUnit(),
          kpi.reportedVariancePct());
    }
  }

  public record OrderKpiPageResponse(
      List<OrderKpiResponse> items, long total, int page, int pageSize) {

    static OrderKpiPageResponse from(OrderKpiPage page) {
      return new OrderKpiPageResponse(
          page.items().stream().map(OrderKpiResponse::from).toList(),
          page.total(),
          page.page(),
          page.pageSize());
    }
  }
}
