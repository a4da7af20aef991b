package com.flowdesk.chatbotcore.conversation.service;

import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.common.web.NotFoundException;
import com.flowdesk.chatbotcore.conversation.domain.CloseReason;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.domain.ConversationStatus;
import com.flowdesk.chatbotcore.dispatch.DispatchResult;
import com.flowdesk.chatbotcore.dispatch.DispatchStatus;
import com.flowdesk.chatbotcore.dispatch.ResponseDispatcher;
import com.flowdesk.chatbotcore.events.EventFanout;
import com.flowdesk.chatbotcore.events.EventKind;
import com.flowdesk.chatbotcore.flow.response.BotResponse;
import com.flowdesk.chatbotcore.graph.model.FlowGraph;
import com.flowdesk.chatbotcore.graph.service.NodeGraphStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finishes conversations, sending a best-effort closing notice first. The notice never blocks
 * the close.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationCloser {

  private final ConversationStateStore store;
  private final ConversationLocks locks;
  private final ConnectionManager connections;
  private final ResponseDispatcher dispatcher;
  private final NodeGraphStore graphs;
  private final ClosingMessageSelector messages;
  private final EventFanout fanout;
  private final Clock clock;

  /** Closes the conversation if it is still ACTIVE and idle since before {@code cutoff}. */
  public boolean closeIdle(Conversation candidate, Instant cutoff) {
    return locks.withLock(
        candidate.lockKey(),
        () -> {
          Optional<Conversation> current = store.find(candidate.id());
          if (current.isEmpty()
              || current.get().status() != ConversationStatus.ACTIVE
              || !current.get().lastActivityAt().isBefore(cutoff)) {
            return false;
          }
          return close(current.get(), CloseReason.INACTIVITY).isPresent();
        });
  }

  /** Administrative close. Unknown ids are a 404, finished conversations are returned as is. */
  public Conversation closeConversation(String conversationId, CloseReason reason) {
    Conversation conversation =
        store.find(conversationId)
            .orElseThrow(() -> new NotFoundException("Conversation", conversationId));
    if (conversation.status() == ConversationStatus.FINISHED) {
      return conversation;
    }
    CloseReason effective = reason == null ? CloseReason.MANUAL : reason;
    return locks.withLock(
        conversation.lockKey(),
        () -> close(conversation, effective).orElseGet(() -> store.find(conversationId).orElseThrow()));
  }

  private Optional<Conversation> close(Conversation conversation, CloseReason reason) {
    if (connections.isLive(conversation.tenantId())) {
      sendClosingNotice(conversation);
    } else {
      log.debug("Tenant {}: channel down, closing {} silently", conversation.tenantId(), conversation.id());
    }
    Optional<Conversation> finished = store.finish(conversation.id(), reason, clock.instant());
    finished.ifPresent(
        c -> {
          log.info("Conversation {} finished ({})", c.id(), reason);
          fanout.notify(
              c.tenantId(),
              EventKind.CONVERSATION_CLOSED,
              Map.of(
                  "conversationId", c.id(),
                  "contactAddress", c.contactAddress(),
                  "reason", reason.name()));
        });
    return finished;
  }

  private void sendClosingNotice(Conversation conversation) {
    try {
      String tenantMessage =
          graphs.load(conversation.graphId()).map(FlowGraph::closingMessage).orElse(null);
      DispatchResult result =
          dispatcher.dispatch(
              conversation.tenantId(),
              conversation.contactAddress(),
              BotResponse.text(messages.select(tenantMessage)));
      if (result.status() != DispatchStatus.SENT) {
        log.warn(
            "Closing notice for conversation {} not sent: {} {}",
            conversation.id(),
            result.status(),
            result.error());
      }
    } catch (RuntimeException e) {
      log.warn("Closing notice for conversation {} failed: {}", conversation.id(), e.getMessage());
    }
  }
}
