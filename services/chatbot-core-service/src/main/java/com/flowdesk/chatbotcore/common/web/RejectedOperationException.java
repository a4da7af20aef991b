package com.flowdesk.chatbotcore.common.web;

/** Operation refused by channel policy (group/broadcast address, terminal state, ...). */
public class RejectedOperationException extends RuntimeException {

  private final String reason;

  public RejectedOperationException(String reason, String message) {
    super(message);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }
}
