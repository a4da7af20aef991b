package com.flowdesk.chatbotcore.conversation.domain;

import java.time.Instant;

/** Detached view of a conversation row. */
public record Conversation(
    String id,
    String tenantId,
    String contactAddress,
    Long graphId,
    Long currentNodeId,
    ConversationStatus status,
    Instant lastActivityAt,
    Instant createdAt,
    Instant finishedAt,
    CloseReason closeReason) {

  public String lockKey() {
    return lockKey(tenantId, contactAddress);
  }

  public static String lockKey(String tenantId, String contactAddress) {
    return tenantId + "|" + contactAddress;
  }
}
