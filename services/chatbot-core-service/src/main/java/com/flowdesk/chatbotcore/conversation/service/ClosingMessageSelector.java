package com.flowdesk.chatbotcore.conversation.service;

import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

@Component
public class ClosingMessageSelector {

  static final List<String> DEFAULT_MESSAGES =
      List.of(
          "We are closing this conversation due to inactivity. Message us again any time!",
          "It looks like you stepped away, so we have closed this chat. Write to us whenever you need help.",
          "This conversation was closed after a period of inactivity. Thank you for contacting us!");

  private final Random random;

  public ClosingMessageSelector() {
    this(new Random());
  }

  ClosingMessageSelector(Random random) {
    this.random = random;
  }

  /** The tenant message when configured, else one of the defaults. */
  public String select(String tenantMessage) {
    if (tenantMessage != null && !tenantMessage.isBlank()) {
      return tenantMessage;
    }
    return DEFAULT_MESSAGES.get(random.nextInt(DEFAULT_MESSAGES.size()));
  }
}
