package com.geniebridge.relay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.geniebridge.relay.bot.TurnContext;
import com.geniebridge.relay.bot.model.Activity;
import com.geniebridge.relay.handler.MessageHandler;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DevRelayControllerTest {

  @Test
  void message_returnsCollectedReplies() {
    MessageHandler handler = mock(MessageHandler.class);
    when(handler.onTurn(any()))
        .thenAnswer(
            invocation -> {
              TurnContext turn = invocation.getArgument(0);
              assertThat(turn.activity().channelId()).isEqualTo("emulator");
              assertThat(turn.activity().fromId()).isEqualTo("U1");
              turn.sendText("echo: " + turn.activity().text());
              return Optional.empty();
            });

    List<Activity> replies =
        new DevRelayController(handler)
            .message(new DevRelayController.DevMessageRequest("U1", null, "hello"));

    assertThat(replies).extracting(Activity::text).containsExactly("echo: hello");
  }
}
