package com.geniebridge.relay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.geniebridge.relay.client.dto.StatementResult;
import com.geniebridge.relay.domain.ColumnSchema;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** SQL statement execution API: fetches the schema and first result chunk of a statement. */
@Component
public class StatementExecutionClient {

  private final WorkspaceApi api;

  public StatementExecutionClient(WorkspaceApi api) {
    this.api = api;
  }

  public StatementResult getStatement(String statementId) {
    JsonNode root = api.get("/api/2.0/sql/statements/{statementId}", statementId);
    JsonNode columnsNode = root.path("manifest").path("schema").path("columns");
    if (!columnsNode.isArray()) {
      throw new GenieClientException("Statement " + statementId + " has no result schema");
    }
    List<ColumnSchema> columns = new ArrayList<>();
    for (JsonNode c : columnsNode) {
      columns.add(new ColumnSchema(c.path("name").asText(""), c.path("type_name").asText("")));
    }
    List<List<Object>> rows = new ArrayList<>();
    for (JsonNode r : root.path("result").path("data_array")) {
      List<Object> row = new ArrayList<>();
      for (JsonNode cell : r) {
        row.add(toScalar(cell));
      }
      rows.add(row);
    }
    return new StatementResult(
        root.path("statement_id").asText(statementId),
        root.path("status").path("state").asText(null),
        columns,
        rows);
  }

  static Object toScalar(JsonNode cell) {
    if (cell == null || cell.isNull() || cell.isMissingNode()) {
      return null;
    }
    if (cell.isIntegralNumber()) {
      return cell.bigIntegerValue();
    }
    if (cell.isNumber()) {
      return cell.decimalValue();
    }
    if (cell.isContainerNode()) {
      return cell.toString();
    }
    return cell.asText();
  }
}
