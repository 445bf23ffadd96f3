package com.geniebridge.relay.render;

import com.geniebridge.relay.render.block.Block;
import java.util.List;

/** Channel-ready reply: flat text or a block layout. */
public sealed interface RenderedReply permits RenderedReply.PlainText, RenderedReply.Blocks {

  record PlainText(String text) implements RenderedReply {}

  record Blocks(List<Block> blocks) implements RenderedReply {
    public Blocks {
      blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
  }
}
