package com.geniebridge.relay.render;

import com.geniebridge.relay.domain.AnswerPayload;
import com.geniebridge.relay.render.block.Block;
import com.geniebridge.relay.render.block.DividerBlock;
import com.geniebridge.relay.render.block.SectionBlock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Slack Block Kit layout. Tables are rendered fixed-width inside a code span; Slack rejects section
 * text over 3000 chars, so the table text is cut at {@link #MAX_TABLE_CHARS}.
 */
@Component
public class SlackBlockRenderer {

  public static final int MAX_TABLE_CHARS = 2950;
  public static final String TRUNCATION_MARKER = "...";

  public List<Block> render(AnswerPayload payload) {
    List<Block> blocks = new ArrayList<>();
    if (payload instanceof AnswerPayload.Tabular table) {
      if (table.hasDescription()) {
        blocks.add(SectionBlock.markdown("*Query Description:*\n" + table.description()));
        blocks.add(DividerBlock.INSTANCE);
      }
      blocks.add(SectionBlock.markdown("*Query Results:*"));
      blocks.add(SectionBlock.markdown("```" + truncate(renderTable(table)) + "```"));
    } else if (payload instanceof AnswerPayload.Message message) {
      blocks.add(SectionBlock.markdown(message.text()));
    } else {
      blocks.add(SectionBlock.markdown(PlainTextRenderer.NO_DATA_TEXT));
    }
    return List.copyOf(blocks);
  }

  static String renderTable(AnswerPayload.Tabular table) {
    FormattedTable formatted = FormattedTable.of(table);
    int[] widths = formatted.widths();

    StringBuilder sb = new StringBuilder();
    sb.append(renderRow(formatted.headers(), widths)).append("\n");
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) sb.append("-+-");
      sb.append("-".repeat(widths[i]));
    }
    sb.append("\n");
    for (List<String> row : formatted.rows()) {
      sb.append(renderRow(row, widths)).append("\n");
    }
    return sb.toString();
  }

  static String truncate(String tableText) {
    if (tableText.length() <= MAX_TABLE_CHARS) {
      return tableText;
    }
    return tableText.substring(0, MAX_TABLE_CHARS) + TRUNCATION_MARKER;
  }

  private static String renderRow(List<String> row, int[] widths) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) sb.append(" | ");
      sb.append(padRight(row.get(i), widths[i]));
    }
    return sb.toString();
  }

  private static String padRight(String s, int width) {
    if (s.length() >= width) return s;
    return s + " ".repeat(width - s.length());
  }
}
