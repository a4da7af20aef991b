package com.flowdesk.chatbotcore.graph.model;

/** A selectable option of an OPTION node. {@code targetNodeId} is null when not set directly. */
public record NodeOption(Long id, Long nodeId, String text, int order, Long targetNodeId) {

  public NodeOption withoutTarget() {
    return new NodeOption(id, nodeId, text, order, null);
  }
}
