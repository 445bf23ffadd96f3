package com.geniebridge.relay.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.geniebridge.relay.client.GenieClient;
import com.geniebridge.relay.client.GenieClientException;
import com.geniebridge.relay.client.StatementExecutionClient;
import com.geniebridge.relay.client.dto.GenieAttachment;
import com.geniebridge.relay.client.dto.GenieMessage;
import com.geniebridge.relay.client.dto.StatementResult;
import com.geniebridge.relay.config.GenieProperties;
import com.geniebridge.relay.domain.AnswerPayload;
import com.geniebridge.relay.domain.ColumnSchema;
import com.geniebridge.relay.render.ReplyTemplates;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GenieConversationOrchestratorTest {

  private static final String SPACE = "space-1";

  private GenieClient genie;
  private StatementExecutionClient statements;
  private GenieConversationOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    genie = mock(GenieClient.class);
    statements = mock(StatementExecutionClient.class);
    GenieProperties properties =
        new GenieProperties("https://host", "token", SPACE, null, null, null, null);
    orchestrator =
        new GenieConversationOrchestrator(genie, statements, new ReplyTemplates(), properties);
  }

  private static GenieMessage completed(
      String conversationId, String content, boolean queryResult, GenieAttachment... attachments) {
    return new GenieMessage(
        "M1", conversationId, content, "COMPLETED", List.of(attachments), queryResult, null);
  }

  @Test
  void firstTurn_withQueryResult_buildsTabularWithDescription() {
    GenieMessage message =
        completed(
            "C1",
            "how many orders today?",
            true,
            new GenieAttachment(null, "SELECT 1", "  "),
            new GenieAttachment(null, "SELECT region", "Orders by region"));
    when(genie.startConversationAndWait(SPACE, "how many orders today?")).thenReturn(message);
    when(genie.getMessageQueryResultStatementId(SPACE, "C1", "M1")).thenReturn(Optional.of("S1"));
    when(genie.getMessage(SPACE, "C1", "M1")).thenReturn(message);
    when(statements.getStatement("S1"))
        .thenReturn(
            new StatementResult(
                "S1",
                "SUCCEEDED",
                List.of(new ColumnSchema("region", "STRING"), new ColumnSchema("n", "BIGINT")),
                List.of(List.<Object>of("EMEA", "3"))));

    ConversationTurn turn = orchestrator.resolve("how many orders today?", null);

    assertThat(turn.threadId()).isEqualTo("C1");
    assertThat(turn.payload()).isInstanceOf(AnswerPayload.Tabular.class);
    AnswerPayload.Tabular table = (AnswerPayload.Tabular) turn.payload();
    assertThat(table.description()).isEqualTo("Orders by region");
    assertThat(table.columns()).extracting(ColumnSchema::name).containsExactly("region", "n");
    assertThat(table.rows()).hasSize(1);
  }

  @Test
  void followUp_usesExistingThread_andReturnsFirstTextAttachment() {
    GenieMessage message =
        completed(
            "C1",
            "raw",
            false,
            new GenieAttachment(null, "SELECT 1", null),
            new GenieAttachment("There were 42 orders.", null, null),
            new GenieAttachment("second", null, null));
    when(genie.createMessageAndWait(SPACE, "C1", "and yesterday?")).thenReturn(message);
    when(genie.getMessage(SPACE, "C1", "M1")).thenReturn(message);

    ConversationTurn turn = orchestrator.resolve("and yesterday?", "C1");

    verify(genie, never()).startConversationAndWait(anyString(), anyString());
    verify(genie, never()).getMessageQueryResultStatementId(anyString(), anyString(), anyString());
    assertThat(turn.threadId()).isEqualTo("C1");
    assertThat(turn.payload()).isEqualTo(new AnswerPayload.Message("There were 42 orders."));
  }

  @Test
  void noAttachments_fallsBackToRawContent() {
    GenieMessage message = completed("C2", "I can only answer questions about orders.", false);
    when(genie.startConversationAndWait(SPACE, "hi")).thenReturn(message);
    when(genie.getMessage(SPACE, "C2", "M1")).thenReturn(message);

    ConversationTurn turn = orchestrator.resolve("hi", null);

    assertThat(turn.payload())
        .isEqualTo(new AnswerPayload.Message("I can only answer questions about orders."));
    assertThat(turn.threadId()).isEqualTo("C2");
  }

  @Test
  void queryResultWithoutStatement_fallsThroughToText() {
    GenieMessage message =
        completed("C1", "raw", true, new GenieAttachment("Nothing matched.", null, null));
    when(genie.startConversationAndWait(SPACE, "q")).thenReturn(message);
    when(genie.getMessageQueryResultStatementId(SPACE, "C1", "M1")).thenReturn(Optional.empty());
    when(genie.getMessage(SPACE, "C1", "M1")).thenReturn(message);

    ConversationTurn turn = orchestrator.resolve("q", null);

    assertThat(turn.payload()).isEqualTo(new AnswerPayload.Message("Nothing matched."));
  }

  @Test
  void statementFetchFailure_keepsNewThreadId() {
    GenieMessage message = completed("C7", "raw", true);
    when(genie.startConversationAndWait(SPACE, "q")).thenReturn(message);
    when(genie.getMessageQueryResultStatementId(SPACE, "C7", "M1")).thenReturn(Optional.of("S1"));
    when(genie.getMessage(SPACE, "C7", "M1")).thenReturn(message);
    when(statements.getStatement("S1")).thenThrow(new GenieClientException("503"));

    ConversationTurn turn = orchestrator.resolve("q", null);

    assertThat(turn.threadId()).isEqualTo("C7");
    assertThat(turn.payload()).isInstanceOf(AnswerPayload.Error.class);
    assertThat(((AnswerPayload.Error) turn.payload()).detail())
        .isEqualTo("An error occurred while processing your request.")
        .doesNotContain("503");
  }

  @Test
  void failureBeforeAnyThread_returnsInputThreadId() {
    when(genie.startConversationAndWait(SPACE, "q"))
        .thenThrow(new GenieClientException("connection refused"));
    when(genie.createMessageAndWait(SPACE, "C1", "q"))
        .thenThrow(new GenieClientException("connection refused"));

    assertThat(orchestrator.resolve("q", null).threadId()).isNull();
    assertThat(orchestrator.resolve("q", "C1").threadId()).isEqualTo("C1");
  }

  @Test
  void rowWidthMismatch_isReportedAsError() {
    GenieMessage message = completed("C1", "raw", true);
    when(genie.startConversationAndWait(SPACE, "q")).thenReturn(message);
    when(genie.getMessageQueryResultStatementId(SPACE, "C1", "M1")).thenReturn(Optional.of("S1"));
    when(genie.getMessage(SPACE, "C1", "M1")).thenReturn(message);
    when(statements.getStatement("S1"))
        .thenReturn(
            new StatementResult(
                "S1",
                "SUCCEEDED",
                List.of(new ColumnSchema("a", "STRING")),
                List.of(List.<Object>of("x", "y"))));

    ConversationTurn turn = orchestrator.resolve("q", null);

    assertThat(turn.payload()).isInstanceOf(AnswerPayload.Error.class);
    assertThat(turn.threadId()).isEqualTo("C1");
  }
}
