package io.b2mash.ordermetrics.export;

import io.b2mash.ordermetrics.kpi.OrderKpiFilter;
import io.b2mash.ordermetrics.kpi.OrderKpiService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ExportController {

  private static final Logger log = LoggerFactory.getLogger(ExportController.class);

  static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
  static final String FILENAME = "order-kpis.csv";

  private final OrderKpiService orderKpiService;
  private final KpiCsvWriter csvWriter;

  public ExportController(OrderKpiService orderKpiService, KpiCsvWriter csvWriter) {
    this.orderKpiService = orderKpiService;
    this.csvWriter = csvWriter;
  }

  /** Every order KPI matching the filter, unpaged, as a CSV attachment. */
  @GetMapping("/api/export/csv")
  public ResponseEntity<byte[]> exportCsv(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
      @RequestParam(required = false) String q)
      throws IOException {
    var kpis = orderKpiService.exportOrderKpis(OrderKpiFilter.unpaged(from, to, q));

    var out = new ByteArrayOutputStream();
    csvWriter.write(kpis, out);
    log.debug("Exported {} order KPI row(s) as CSV", kpis.size());

    return ResponseEntity.ok()
        .contentType(TEXT_CSV)
        .header("Content-Disposition", "attachment; filename=\"" + FILENAME + "\"")
        .body(out.toByteArray());
  }
}
