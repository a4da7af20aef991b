package com.flowdesk.chatbotcore.pending;

public enum PendingStatus {
  PENDING,
  SENDING,
  DEAD
}
