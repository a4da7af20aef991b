package com.flowdesk.chatbotcore.conversation.service;

import com.flowdesk.chatbotcore.conversation.domain.CloseReason;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted conversation cursors. Callers hold the conversation lock around read-modify-write
 * sequences.
 */
public interface ConversationStateStore {

  Optional<Conversation> find(String conversationId);

  /** The newest conversation of the contact that is not FINISHED. */
  Optional<Conversation> findOpen(String tenantId, String contactAddress);

  Conversation start(
      String tenantId, String contactAddress, Long graphId, Long startNodeId, Instant at);

  /**
   * Moves the cursor (when {@code nextNodeId} is not null), escalates when asked and refreshes
   * activity.
   */
  Conversation advance(String conversationId, Long nextNodeId, boolean escalated, Instant at);

  void touch(String conversationId, Instant at);

  List<Conversation> findIdle(Instant cutoff);

  /** Returns the finished conversation, or empty when it was unknown or already finished. */
  Optional<Conversation> finish(String conversationId, CloseReason reason, Instant at);
}
