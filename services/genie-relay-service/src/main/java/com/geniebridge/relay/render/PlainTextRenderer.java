package com.geniebridge.relay.render;

import com.geniebridge.relay.domain.AnswerPayload;
import java.util.List;
import org.springframework.stereotype.Component;

/** Markdown-like text for channels without rich layouts. Tables are never truncated. */
@Component
public class PlainTextRenderer {

  public static final String NO_DATA_TEXT = "No data available.";

  public String render(AnswerPayload payload) {
    if (payload instanceof AnswerPayload.Tabular table) {
      return renderTable(table);
    }
    if (payload instanceof AnswerPayload.Message message) {
      return message.text() + "\n\n";
    }
    return NO_DATA_TEXT + "\n\n";
  }

  private static String renderTable(AnswerPayload.Tabular table) {
    StringBuilder sb = new StringBuilder();
    if (table.hasDescription()) {
      sb.append("## Query Description\n\n").append(table.description()).append("\n\n");
    }
    sb.append("## Query Results\n\n");

    FormattedTable formatted = FormattedTable.of(table);
    sb.append(row(formatted.headers())).append("\n");
    sb.append("|");
    for (int i = 0; i < formatted.headers().size(); i++) {
      if (i > 0) sb.append("|");
      sb.append("---");
    }
    sb.append("|\n");
    for (List<String> row : formatted.rows()) {
      sb.append(row(row)).append("\n");
    }
    return sb.toString();
  }

  private static String row(List<String> cells) {
    return "| " + String.join(" | ", cells) + " |";
  }
}
