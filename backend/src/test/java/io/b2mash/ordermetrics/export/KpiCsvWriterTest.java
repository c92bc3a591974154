package io.b2mash.ordermetrics.export;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.ordermetrics.kpi.OrderKpi;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class KpiCsvWriterTest {

  private final KpiCsvWriter writer = new KpiCsvWriter();

  @Test
  void writesHeaderAndOneRowPerKpi() throws Exception {
    var kpi =
        new OrderKpi(
            "O1", "Gear housing", 10, "2025-03-01", 100_000, 500, 2, "in_progress", "Acme", 5_500,
            36_000, 58_500, 1.8, -10.0);

    var lines = write(List.of(kpi));

    assertThat(lines).hasSize(2);
    assertThat(lines[0]).isEqualTo(String.join(",", KpiCsvWriter.HEADERS));
    assertThat(lines[1])
        .isEqualTo(
            "O1,Gear housing,Acme,2025-03-01,in_progress,"
                + "10,100000,500,2,5500,36000,58500,1.8,-10");
  }

  @Test
  void undefinedVarianceIsWrittenAsZero() throws Exception {
    var kpi =
        new OrderKpi(
            "O2", "Bracket", 5, "2025-03-15", 20_000, 1_000, 0, "pending", null, 5_000, 20_000,
            -5_000, 2, null);

    var lines = write(List.of(kpi));

    assertThat(lines[1]).endsWith(",-5000,2,0");
    assertThat(lines[1]).startsWith("O2,Bracket,,2025-03-15,");
  }

  @Test
  void escapeCsv_quotesDelimitersAndDefusesFormulas() {
    assertThat(KpiCsvWriter.escapeCsv("Bolt, M8")).isEqualTo("\"Bolt, M8\"");
    assertThat(KpiCsvWriter.escapeCsv("5\" pipe")).isEqualTo("\"5\"\" pipe\"");
    assertThat(KpiCsvWriter.escapeCsv("line\nbreak")).isEqualTo("\"line\nbreak\"");
    assertThat(KpiCsvWriter.escapeCsv("=SUM(A1)")).isEqualTo("'=SUM(A1)");
    assertThat(KpiCsvWriter.escapeCsv("@cmd")).isEqualTo("'@cmd");
    assertThat(KpiCsvWriter.escapeCsv(null)).isEmpty();
  }

  @Test
  void formatNumber_dropsTrailingZerosWithoutExponent() {
    assertThat(KpiCsvWriter.formatNumber(58_500.0)).isEqualTo("58500");
    assertThat(KpiCsvWriter.formatNumber(1e7)).isEqualTo("10000000");
    assertThat(KpiCsvWriter.formatNumber(0.0)).isEqualTo("0");
    assertThat(KpiCsvWriter.formatNumber(-28.333333333333332)).isEqualTo("-28.333333333333332");
  }

  private String[] write(List<OrderKpi> kpis) throws Exception {
    var out = new ByteArrayOutputStream();
    writer.write(kpis, out);
    return out.toString(StandardCharsets.UTF_8).split("\\R");
  }
}
