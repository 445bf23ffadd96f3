package com.geniebridge.relay.client.dto;

import com.geniebridge.relay.domain.ColumnSchema;
import java.util.List;

/** Result of {@code GET /api/2.0/sql/statements/{id}}, first chunk only. */
public record StatementResult(
    String statementId, String state, List<ColumnSchema> columns, List<List<Object>> rows) {

  public StatementResult {
    columns = columns == null ? List.of() : List.copyOf(columns);
    rows = rows == null ? List.of() : rows;
  }
}
