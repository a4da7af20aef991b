package com.flowdesk.chatbotcore.flow;

import com.flowdesk.chatbotcore.graph.model.NodeOption;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps raw contact input onto one of a node's options. Order of precedence: button payload,
 * 1-based number, exact text, then text containment in either direction. Options are expected
 * in display order.
 */
@Component
public class OptionResolver {

  public Optional<NodeOption> resolve(List<NodeOption> options, String rawInput) {
    if (options == null || options.isEmpty() || rawInput == null) {
      return Optional.empty();
    }
    String input = rawInput.trim();

    if (SelectionPayload.looksLikePayload(input)) {
      // an unknown id is a no-match, not a text candidate
      return SelectionPayload.parseOptionId(input)
          .flatMap(id -> options.stream().filter(o -> id.equals(o.id())).findFirst());
    }

    Optional<NodeOption> byNumber = byNumber(options, input);
    if (byNumber.isPresent()) {
      return byNumber;
    }

    if (input.isEmpty()) {
      return Optional.empty();
    }
    String needle = input.toLowerCase(Locale.ROOT);
    for (NodeOption o : options) {
      if (normalized(o).equals(needle)) {
        return Optional.of(o);
      }
    }
    for (NodeOption o : options) {
      String text = normalized(o);
      if (!text.isEmpty() && (text.contains(needle) || needle.contains(text))) {
        return Optional.of(o);
      }
    }
    return Optional.empty();
  }

  private static Optional<NodeOption> byNumber(List<NodeOption> options, String input) {
    int n;
    try {
      n = Integer.parseInt(input);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    if (n < 1 || n > options.size()) {
      return Optional.empty();
    }
    return Optional.of(options.get(n - 1));
  }

  private static String normalized(NodeOption o) {
    return o.text() == null ? "" : o.text().trim().toLowerCase(Locale.ROOT);
  }
}
