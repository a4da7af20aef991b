package com.flowdesk.chatbotcore.conversation.domain;

public enum ConversationStatus {
  ACTIVE,
  PAUSED,
  FINISHED,
  ESCALATED;

  /** Bot answers only in ACTIVE; PAUSED and ESCALATED belong to a human operator. */
  public boolean botSuppressed() {
    return this == PAUSED || this == ESCALATED;
  }
}
