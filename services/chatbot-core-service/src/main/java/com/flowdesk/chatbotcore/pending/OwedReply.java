package com.flowdesk.chatbotcore.pending;

import com.flowdesk.chatbotcore.conversation.domain.Conversation;

/**
 * The engine step whose reply did not reach the contact, kept so the drain can replay it.
 *
 * @param fromNodeId cursor the step started from; once the cursor moves the entry is stale
 * @param input contact text to replay, or null to present the current node again
 * @param deliveredBlocks leading blocks of the reply the contact already has
 */
public record OwedReply(
    String tenantId,
    String conversationId,
    String contactAddress,
    Long fromNodeId,
    String input,
    int deliveredBlocks) {

  public static OwedReply greeting(Conversation conversation) {
    return greeting(conversation, 0);
  }

  public static OwedReply greeting(Conversation conversation, int deliveredBlocks) {
    return of(conversation, null, deliveredBlocks);
  }

  public static OwedReply reply(Conversation conversation, String input, int deliveredBlocks) {
    return of(conversation, input, deliveredBlocks);
  }

  private static OwedReply of(Conversation c, String input, int deliveredBlocks) {
    return new OwedReply(
        c.tenantId(), c.id(), c.contactAddress(), c.currentNodeId(), input, deliveredBlocks);
  }
}
