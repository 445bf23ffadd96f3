package com.geniebridge.relay.render.block;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockType {
  SECTION("section"),
  DIVIDER("divider");

  private final String wireName;

  BlockType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
