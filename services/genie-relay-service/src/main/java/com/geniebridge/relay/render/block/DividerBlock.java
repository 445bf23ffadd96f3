package com.geniebridge.relay.render.block;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DividerBlock() implements Block {

  public static final DividerBlock INSTANCE = new DividerBlock();

  @Override
  @JsonProperty("type")
  public BlockType type() {
    return BlockType.DIVIDER;
  }
}
