package com.flowdesk.chatbotcore.flow;

import java.util.Locale;
import org.springframework.stereotype.Component;

/** Evaluates INPUT connection predicates: {@code contains:<kw>} and {@code equals:<val>}. */
@Component
public class ConditionEvaluator {

  static final String CONTAINS = "contains:";
  static final String EQUALS = "equals:";

  public boolean matches(String condition, String rawInput) {
    if (condition == null || condition.isBlank()) {
      return false;
    }
    String input = rawInput == null ? "" : rawInput.trim().toLowerCase(Locale.ROOT);
    String expr = condition.trim();
    String lowered = expr.toLowerCase(Locale.ROOT);
    if (lowered.startsWith(CONTAINS)) {
      String kw = lowered.substring(CONTAINS.length()).trim();
      return !kw.isEmpty() && input.contains(kw);
    }
    if (lowered.startsWith(EQUALS)) {
      return input.equals(lowered.substring(EQUALS.length()).trim());
    }
    return false;
  }
}
