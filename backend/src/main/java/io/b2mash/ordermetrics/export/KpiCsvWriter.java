package io.b2mash.ordermetrics.export;

import io.b2mash.ordermetrics.kpi.OrderKpi;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/** Writes order KPIs as UTF-8 CSV: one header row, then one row per order. */
@Component
public class KpiCsvWriter {

  static final List<String> HEADERS =
      List.of(
          "orderId",
          "productName",
          "customerName",
          "dueDate",
          "status",
          "qty",
          "sales",
          "estimatedMaterialCost",
          "stdTimePerUnit",
          "materialCost",
          "laborCost",
          "grossProfit",
          "actualTimePerUnit",
          "variancePct");

  public void write(List<OrderKpi> kpis, OutputStream outputStream) throws IOException {
    var writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));

    writer.write(HEADERS.stream().map(KpiCsvWriter::escapeCsv).collect(Collectors.joining(",")));
    writer.newLine();

    for (OrderKpi kpi : kpis) {
      var text =
          Stream.of(
                  kpi.orderId(), kpi.productName(), kpi.customerName(), kpi.dueDate(), kpi.status())
              .map(KpiCsvWriter::escapeCsv);
      var numbers =
          Stream.of(
                  kpi.qty(),
                  kpi.sales(),
                  kpi.estimatedMaterialCost(),
                  kpi.stdTimePerUnit(),
                  kpi.materialCost(),
                  kpi.laborCost(),
                  kpi.grossProfit(),
                  kpi.actualTimePerUnit(),
                  kpi.reportedVariancePct())
              .map(KpiCsvWriter::formatNumber);
      writer.write(Stream.concat(text, numbers).collect(Collectors.joining(",")));
      writer.newLine();
    }

    writer.flush();
  }

  static String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    // Defuse CSV formula injection (OWASP recommendation)
    if (!value.isEmpty() && "=+-@\t\r".indexOf(value.charAt(0)) >= 0) {
      value = "'" + value;
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  // Numbers are never text cells, so a leading minus is left alone
  static String formatNumber(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return "";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
