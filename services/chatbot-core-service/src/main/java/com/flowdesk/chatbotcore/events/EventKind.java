package com.flowdesk.chatbotcore.events;

public enum EventKind {
  SESSION_STATUS,
  PAIRING_TOKEN,
  CONNECTION_SUCCESS,
  CONNECTION_ERROR,
  CONVERSATION_CLOSED
}
