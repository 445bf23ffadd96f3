package com.geniebridge.relay.render.block;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "text"})
public record SectionBlock(MarkdownText text) implements Block {

  public static SectionBlock markdown(String text) {
    return new SectionBlock(MarkdownText.of(text));
  }

  @Override
  @JsonProperty("type")
  public BlockType type() {
    return BlockType.SECTION;
  }
}
