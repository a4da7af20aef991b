package com.flowdesk.chatbotcore.flow;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {

  private final ConditionEvaluator evaluator = new ConditionEvaluator();

  @Test
  void containsIsCaseInsensitive() {
    assertThat(evaluator.matches("contains:Refund", "need a REFUND")).isTrue();
    assertThat(evaluator.matches("contains:refund", "need help")).isFalse();
  }

  @Test
  void equalsIgnoresSurroundingWhitespace() {
    assertThat(evaluator.matches("equals:yes", "  Yes ")).isTrue();
    assertThat(evaluator.matches("equals:yes", "yes please")).isFalse();
  }

  @Test
  void unknownOrEmptyExpressionsNeverMatch() {
    assertThat(evaluator.matches("regex:.*", "anything")).isFalse();
    assertThat(evaluator.matches("contains:", "anything")).isFalse();
    assertThat(evaluator.matches(null, "anything")).isFalse();
    assertThat(evaluator.matches("  ", "anything")).isFalse();
  }
}
