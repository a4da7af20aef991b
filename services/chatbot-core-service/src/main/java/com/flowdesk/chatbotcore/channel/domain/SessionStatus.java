package com.flowdesk.chatbotcore.channel.domain;

public enum SessionStatus {
  DISCONNECTED,
  CONNECTING,
  QR_PENDING,
  CONNECTED,
  ERROR;

  /** States in which a connection attempt is in progress or established. */
  public boolean holdsConnection() {
    return this == CONNECTING || this == QR_PENDING || this == CONNECTED;
  }
}
