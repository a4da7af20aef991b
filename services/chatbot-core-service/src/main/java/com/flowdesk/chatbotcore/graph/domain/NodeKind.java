package com.flowdesk.chatbotcore.graph.domain;

public enum NodeKind {
  MESSAGE,
  OPTION,
  INPUT,
  CONDITION,
  ACTION,
  ESCALATION;

  /** OPTION and INPUT nodes hold the cursor until the contact answers. */
  public boolean awaitsInput() {
    return this == OPTION || this == INPUT;
  }
}
