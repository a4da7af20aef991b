package com.flowdesk.chatbotcore.flow;

import java.util.Optional;

/**
 * Button payload format {@code option_<optionId>_<n>}. Only the option id is significant when
 * parsing; the trailing position is informational.
 */
public final class SelectionPayload {

  static final String PREFIX = "option_";

  private SelectionPayload() {}

  public static String encode(Long optionId, int index) {
    return PREFIX + optionId + "_" + index;
  }

  public static boolean looksLikePayload(String raw) {
    return raw != null && raw.trim().startsWith(PREFIX);
  }

  public static Optional<Long> parseOptionId(String raw) {
    if (!looksLikePayload(raw)) {
      return Optional.empty();
    }
    String body = raw.trim().substring(PREFIX.length());
    int sep = body.lastIndexOf('_');
    if (sep <= 0) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(body.substring(0, sep)));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
