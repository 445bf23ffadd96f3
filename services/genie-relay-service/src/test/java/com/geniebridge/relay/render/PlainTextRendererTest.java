package com.geniebridge.relay.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.geniebridge.relay.domain.AnswerPayload;
import com.geniebridge.relay.domain.ColumnSchema;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PlainTextRendererTest {

  private final PlainTextRenderer renderer = new PlainTextRenderer();

  private static AnswerPayload.Tabular orders(String description) {
    return new AnswerPayload.Tabular(
        List.of(new ColumnSchema("region", "STRING"), new ColumnSchema("revenue", "DOUBLE")),
        List.of(
            List.<Object>of("EMEA", "1234567.5"),
            List.<Object>of("APAC", "10"),
            Arrays.<Object>asList("LATAM", null)),
        description);
  }

  @Test
  void tabular_rendersMarkdownTableWithOneLinePerRow() {
    String out = renderer.render(orders("Revenue by region"));

    assertThat(out)
        .isEqualTo(
            "## Query Description\n\nRevenue by region\n\n"
                + "## Query Results\n\n"
                + "| region | revenue |\n"
                + "|---|---|\n"
                + "| EMEA | 1,234,567.50 |\n"
                + "| APAC | 10.00 |\n"
                + "| LATAM | NULL |\n");
  }

  @Test
  void tabular_rowAndColumnCountsMatchPayload() {
    AnswerPayload.Tabular table = orders(null);

    List<String> tableLines =
        Arrays.stream(renderer.render(table).split("\n")).filter(l -> l.startsWith("|")).toList();

    // header + separator + data rows
    assertThat(tableLines).hasSize(2 + table.rows().size());
    String header = tableLines.get(0);
    assertThat(header.split(" \\| ")).hasSize(table.columns().size());
  }

  @Test
  void tabular_withoutDescription_skipsDescriptionHeader() {
    assertThat(renderer.render(orders("  "))).startsWith("## Query Results\n\n");
  }

  @Test
  void message_isTextFollowedByBlankLine() {
    assertThat(renderer.render(new AnswerPayload.Message("There were 42 orders today.")))
        .isEqualTo("There were 42 orders today.\n\n");
  }

  @Test
  void error_fallsBackToPlaceholder() {
    assertThat(renderer.render(new AnswerPayload.Error("boom")))
        .isEqualTo("No data available.\n\n");
    assertThat(renderer.render(null)).isEqualTo("No data available.\n\n");
  }

  @Test
  void render_isIdempotent() {
    AnswerPayload.Tabular table = orders("desc");
    assertThat(renderer.render(table)).isEqualTo(renderer.render(table));
  }
}
