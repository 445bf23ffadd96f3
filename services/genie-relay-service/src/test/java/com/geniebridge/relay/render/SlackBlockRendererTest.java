package com.geniebridge.relay.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geniebridge.relay.domain.AnswerPayload;
import com.geniebridge.relay.domain.ColumnSchema;
import com.geniebridge.relay.render.block.Block;
import com.geniebridge.relay.render.block.DividerBlock;
import com.geniebridge.relay.render.block.SectionBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SlackBlockRendererTest {

  private final SlackBlockRenderer renderer = new SlackBlockRenderer();

  private static AnswerPayload.Tabular ordersByRegion() {
    return new AnswerPayload.Tabular(
        List.of(new ColumnSchema("region", "STRING"), new ColumnSchema("order_count", "BIGINT")),
        List.of(List.<Object>of("EMEA", "1234"), List.<Object>of("North America", "7")),
        "Orders placed today grouped by region");
  }

  private static String text(Block block) {
    return ((SectionBlock) block).text().text();
  }

  @Test
  void tabular_startsWithDescriptionAndDivider_thenPaddedTable() {
    List<Block> blocks = renderer.render(ordersByRegion());

    assertThat(blocks).hasSize(4);
    assertThat(text(blocks.get(0)))
        .isEqualTo("*Query Description:*\nOrders placed today grouped by region");
    assertThat(blocks.get(1)).isInstanceOf(DividerBlock.class);
    assertThat(text(blocks.get(2))).isEqualTo("*Query Results:*");
    assertThat(text(blocks.get(3)))
        .isEqualTo(
            "```"
                + "region        | order_count\n"
                + "--------------+------------\n"
                + "EMEA          | 1,234      \n"
                + "North America | 7          \n"
                + "```");
  }

  @Test
  void tabular_withoutDescription_hasNoDivider() {
    AnswerPayload.Tabular table =
        new AnswerPayload.Tabular(
            List.of(new ColumnSchema("n", "INT")), List.of(List.<Object>of("1")), null);

    List<Block> blocks = renderer.render(table);

    assertThat(blocks).hasSize(2);
    assertThat(blocks).noneMatch(b -> b instanceof DividerBlock);
  }

  @Test
  void longTable_isCutToLimitAndMarked() {
    List<List<Object>> rows = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      rows.add(List.of("row-" + i + "-padding-padding"));
    }
    AnswerPayload.Tabular table =
        new AnswerPayload.Tabular(List.of(new ColumnSchema("value", "STRING")), rows, null);
    String full = SlackBlockRenderer.renderTable(table);
    assertThat(full.length()).isGreaterThan(SlackBlockRenderer.MAX_TABLE_CHARS);

    String section = text(renderer.render(table).get(1));

    String body = section.substring(3, section.length() - 3);
    assertThat(body).hasSize(SlackBlockRenderer.MAX_TABLE_CHARS + 3).endsWith("...");
    assertThat(body.substring(0, SlackBlockRenderer.MAX_TABLE_CHARS))
        .isEqualTo(full.substring(0, SlackBlockRenderer.MAX_TABLE_CHARS));
  }

  @Test
  void shortTable_isNotMarked() {
    String out = SlackBlockRenderer.truncate("a\nb\n");
    assertThat(out).isEqualTo("a\nb\n");
    String exact = "x".repeat(SlackBlockRenderer.MAX_TABLE_CHARS);
    assertThat(SlackBlockRenderer.truncate(exact)).isEqualTo(exact);
  }

  @Test
  void message_isSingleSectionWithRawText() {
    List<Block> blocks = renderer.render(new AnswerPayload.Message("*bold* answer"));

    assertThat(blocks).hasSize(1);
    assertThat(text(blocks.get(0))).isEqualTo("*bold* answer");
  }

  @Test
  void error_fallsBackToPlaceholderSection() {
    List<Block> blocks = renderer.render(new AnswerPayload.Error("hidden"));

    assertThat(blocks).hasSize(1);
    assertThat(text(blocks.get(0))).isEqualTo("No data available.");
  }

  @Test
  void render_isIdempotent() {
    AnswerPayload.Tabular table = ordersByRegion();
    assertThat(renderer.render(table)).isEqualTo(renderer.render(table));
  }

  @Test
  void blocks_serializeToSlackBlockKitJson() {
    ObjectMapper mapper = new ObjectMapper();

    JsonNode json = mapper.valueToTree(Map.of("blocks", renderer.render(ordersByRegion())));

    JsonNode blocks = json.path("blocks");
    assertThat(blocks.get(0).path("type").asText()).isEqualTo("section");
    assertThat(blocks.get(0).path("text").path("type").asText()).isEqualTo("mrkdwn");
    assertThat(blocks.get(1).path("type").asText()).isEqualTo("divider");
    assertThat(blocks.get(1).size()).isEqualTo(1);
  }
}
