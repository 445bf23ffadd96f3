package com.geniebridge.relay.render.block;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Slack Block Kit element. Each block writes its own {@code "type"} so the JSON is the same whether
 * it is serialized as a {@code Block} or through an untyped container such as {@code channelData}.
 */
public sealed interface Block permits SectionBlock, DividerBlock {
  @JsonProperty("type")
  BlockType type();
}
