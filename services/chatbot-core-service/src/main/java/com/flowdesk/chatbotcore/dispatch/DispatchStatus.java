package com.flowdesk.chatbotcore.dispatch;

public enum DispatchStatus {
  SENT,
  NOT_LIVE,
  FAILED,
  REJECTED
}
