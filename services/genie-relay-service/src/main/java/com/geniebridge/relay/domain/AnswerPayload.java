package com.geniebridge.relay.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized answer for one chat turn.
 *
 * <p>Exactly one of three shapes: a statement result ({@link Tabular}), narrative text ({@link
 * Message}) or a failed turn ({@link Error}). Renderers treat any other implementation as "no
 * data".
 */
public sealed interface AnswerPayload
    permits AnswerPayload.Tabular, AnswerPayload.Message, AnswerPayload.Error {

  /**
   * Statement output. Every row has one cell per column; cells are {@code null}, a {@link Number}
   * or a {@link String}.
   */
  record Tabular(List<ColumnSchema> columns, List<List<Object>> rows, String description)
      implements AnswerPayload {

    public Tabular {
      columns = columns == null ? List.of() : List.copyOf(columns);
      List<List<Object>> copy = new ArrayList<>();
      if (rows != null) {
        for (int i = 0; i < rows.size(); i++) {
          List<Object> row = rows.get(i);
          int size = row == null ? 0 : row.size();
          if (size != columns.size()) {
            throw new IllegalArgumentException(
                "Row " + i + " has " + size + " cells, expected " + columns.size());
          }
          // List.copyOf rejects null cells
          List<Object> cells = row == null ? new ArrayList<>() : new ArrayList<>(row);
          copy.add(Collections.unmodifiableList(cells));
        }
      }
      rows = Collections.unmodifiableList(copy);
    }

    public boolean hasDescription() {
      return description != null && !description.isBlank();
    }
  }

  record Message(String text) implements AnswerPayload {
    public Message {
      text = text == null ? "" : text;
    }
  }

  /** Failed turn. {@code detail} is already safe to show to the user. */
  record Error(String detail) implements AnswerPayload {}
}
