package com.flowdesk.chatbotcore.flow.response;

import java.util.ArrayList;
import java.util.List;

public record BotResponse(List<ResponseBlock> blocks) {

  public BotResponse {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }

  public static BotResponse of(ResponseBlock... blocks) {
    return new BotResponse(List.of(blocks));
  }

  public static BotResponse text(String text) {
    return of(new TextBlock(text));
  }

  public BotResponse append(BotResponse other) {
    List<ResponseBlock> merged = new ArrayList<>(blocks);
    merged.addAll(other.blocks());
    return new BotResponse(merged);
  }

  /** The blocks that follow the first {@code count}. */
  public BotResponse remainingAfter(int count) {
    if (count <= 0) {
      return this;
    }
    return new BotResponse(count >= blocks.size() ? List.of() : blocks.subList(count, blocks.size()));
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }
}
