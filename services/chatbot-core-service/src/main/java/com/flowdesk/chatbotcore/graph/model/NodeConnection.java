package com.flowdesk.chatbotcore.graph.model;

public record NodeConnection(
    Long id, Long sourceNodeId, Long targetNodeId, Long optionId, String condition) {

  /** A connection with neither option nor condition is the source node's default edge. */
  public boolean isDefault() {
    return optionId == null && (condition == null || condition.isBlank());
  }
}
