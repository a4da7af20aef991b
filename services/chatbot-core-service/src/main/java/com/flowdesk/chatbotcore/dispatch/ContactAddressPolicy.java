package com.flowdesk.chatbotcore.dispatch;

import java.util.Locale;
import org.springframework.stereotype.Component;

/** The bot only talks to individual contacts, never to groups or broadcast lists. */
@Component
public class ContactAddressPolicy {

  static final String GROUP_SUFFIX = "@g.us";
  static final String BROADCAST_SUFFIX = "@broadcast";

  public boolean isIndividual(String contactAddress) {
    if (contactAddress == null || contactAddress.isBlank()) {
      return false;
    }
    String a = contactAddress.trim().toLowerCase(Locale.ROOT);
    return !a.endsWith(GROUP_SUFFIX) && !a.endsWith(BROADCAST_SUFFIX);
  }
}
