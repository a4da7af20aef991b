package com.flowdesk.chatbotcore.conversation.domain;

public enum CloseReason {
  INACTIVITY,
  MANUAL
}
