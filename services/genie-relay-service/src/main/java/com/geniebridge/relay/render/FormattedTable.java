package com.geniebridge.relay.render;

import com.geniebridge.relay.domain.AnswerPayload;
import com.geniebridge.relay.domain.ColumnSchema;
import java.util.ArrayList;
import java.util.List;

/** Header names and cell strings of a {@link AnswerPayload.Tabular}, formatted once. */
record FormattedTable(List<String> headers, List<List<String>> rows) {

  static FormattedTable of(AnswerPayload.Tabular table) {
    List<String> headers = new ArrayList<>();
    for (ColumnSchema column : table.columns()) {
      headers.add(column.name() == null ? "" : column.name());
    }
    List<List<String>> rows = new ArrayList<>();
    for (List<Object> row : table.rows()) {
      List<String> out = new ArrayList<>(row.size());
      for (int i = 0; i < row.size(); i++) {
        out.add(CellFormatter.format(row.get(i), table.columns().get(i).typeName()));
      }
      rows.add(out);
    }
    return new FormattedTable(List.copyOf(headers), List.copyOf(rows));
  }

  /** Display width per column: the widest of the header and every cell. */
  int[] widths() {
    int[] widths = new int[headers.size()];
    for (int i = 0; i < headers.size(); i++) {
      widths[i] = headers.get(i).length();
    }
    for (List<String> row : rows) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }
    return widths;
  }
}
