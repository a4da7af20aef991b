package com.flowdesk.chatbotcore.inbound;

public enum InboundResult {
  /** Sender is not an individual contact. */
  IGNORED,
  /** Tenant has no active graph with a start node. */
  NO_FLOW,
  /** Conversation is handled by a human; activity refreshed only. */
  SUPPRESSED,
  /** Response queued until the channel is live. */
  QUEUED,
  REJECTED,
  RESPONDED
}
