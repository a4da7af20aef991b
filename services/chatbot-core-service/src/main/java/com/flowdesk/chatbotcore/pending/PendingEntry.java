package com.flowdesk.chatbotcore.pending;

import java.time.Instant;

public record PendingEntry(
    Long id,
    String tenantId,
    String conversationId,
    String contactAddress,
    Long fromNodeId,
    String input,
    int deliveredBlocks,
    PendingStatus status,
    int attempts,
    String lastError,
    Instant enqueuedAt) {

  /** Replays the greeting rather than a contact input. */
  public boolean isGreeting() {
    return input == null;
  }
}
