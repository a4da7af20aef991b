package com.flowdesk.chatbotcore.conversation.service;

import com.flowdesk.chatbotcore.common.lock.KeyedLocks;
import org.springframework.stereotype.Component;

/** Serializes all work on one conversation, keyed by {@code tenantId|contactAddress}. */
@Component
public class ConversationLocks extends KeyedLocks {

  public ConversationLocks() {
    super(256);
  }
}
