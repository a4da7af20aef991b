package com.flowdesk.chatbotcore.flow;

import com.flowdesk.chatbotcore.flow.response.BotResponse;

/**
 * Result of one engine step.
 *
 * @param nextNodeId new cursor, or null to keep the current one
 * @param escalated an ESCALATION node was presented during this step
 */
public record FlowDecision(BotResponse response, Long nextNodeId, boolean escalated) {

  public static FlowDecision stay(BotResponse response) {
    return new FlowDecision(response, null, false);
  }

  public boolean movesCursor() {
    return nextNodeId != null;
  }
}
