package com.flowdesk.chatbotcore.pending;

import com.flowdesk.chatbotcore.channel.state.ChannelConnectedEvent;
import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.common.lock.KeyedLocks;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.domain.ConversationStatus;
import com.flowdesk.chatbotcore.conversation.service.ConversationLocks;
import com.flowdesk.chatbotcore.conversation.service.ConversationStateStore;
import com.flowdesk.chatbotcore.dispatch.DispatchResult;
import com.flowdesk.chatbotcore.dispatch.DispatchStatus;
import com.flowdesk.chatbotcore.dispatch.ResponseDispatcher;
import com.flowdesk.chatbotcore.flow.FlowDecision;
import com.flowdesk.chatbotcore.flow.FlowEngine;
import com.flowdesk.chatbotcore.flow.response.BotResponse;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Responses that could not be delivered while the channel was down or a send failed.
 *
 * <p>An entry records the engine step whose reply was lost: the cursor it started from, the
 * contact input (none for a greeting) and how many blocks already went out. Delivery replays
 * that step against the unchanged cursor and sends only the missing blocks; the cursor moves
 * once the reply is sent. An entry whose conversation has moved on since is dropped.
 *
 * <p>Lock order is conversation lock, then the tenant queue lock; a drainer never holds the
 * queue lock while waiting for a conversation.
 */
@Service
@Slf4j
public class PendingResponseQueue {

  private final PendingResponseStore store;
  private final ConversationStateStore conversations;
  private final ConversationLocks conversationLocks;
  private final FlowEngine engine;
  private final ResponseDispatcher dispatcher;
  private final ConnectionManager connections;
  private final Executor executor;
  private final Clock clock;
  private final int maxAttempts;
  private final KeyedLocks queueLocks = new KeyedLocks(64);

  public PendingResponseQueue(
      PendingResponseStore store,
      ConversationStateStore conversations,
      ConversationLocks conversationLocks,
      FlowEngine engine,
      ResponseDispatcher dispatcher,
      ConnectionManager connections,
      @Qualifier("channelExecutor") Executor executor,
      Clock clock,
      @Value("${pending.max-attempts:5}") int maxAttempts) {
    this.store = store;
    this.conversations = conversations;
    this.conversationLocks = conversationLocks;
    this.engine = engine;
    this.dispatcher = dispatcher;
    this.connections = connections;
    this.executor = executor;
    this.clock = clock;
    this.maxAttempts = maxAttempts;
  }

  /** Must be called while holding the conversation lock. */
  public boolean append(OwedReply reply) {
    boolean added =
        queueLocks.withLock(reply.tenantId(), () -> store.appendIfAbsent(reply, clock.instant()));
    if (added) {
      log.info("Tenant {}: queued response for conversation {}", reply.tenantId(), reply.conversationId());
    }
    return added;
  }

  /**
   * Sends the reply still owed to this conversation before a new contact message is handled.
   * Must be called while holding the conversation lock. Returns the conversation as it stands
   * afterwards, or empty when nothing was waiting for it.
   */
  public Optional<Conversation> deliverOwed(Conversation conversation) {
    Optional<PendingEntry> owed =
        queueLocks.withLock(conversation.tenantId(), () -> store.claimFor(conversation.id()));
    if (owed.isEmpty()) {
      return Optional.empty();
    }
    deliverOrRelease(owed.get());
    return conversations.find(conversation.id());
  }

  public boolean hasPending(String tenantId) {
    return store.hasPending(tenantId);
  }

  /** Delivers the tenant's queued responses. Returns how many were sent. */
  public int drain(String tenantId) {
    if (!connections.isLive(tenantId)) {
      return 0;
    }
    List<PendingEntry> claimed = queueLocks.withLock(tenantId, () -> store.claim(tenantId));
    int sent = 0;
    for (PendingEntry entry : claimed) {
      if (deliverOrRelease(entry)) {
        sent++;
      }
    }
    if (!claimed.isEmpty()) {
      log.info("Tenant {}: drained {} of {} queued response(s)", tenantId, sent, claimed.size());
    }
    return sent;
  }

  public void drainAsync(String tenantId) {
    try {
      executor.execute(
          () -> {
            try {
              drain(tenantId);
            } catch (RuntimeException e) {
              log.error("Tenant {}: queue drain failed", tenantId, e);
            }
          });
    } catch (RejectedExecutionException e) {
      log.warn("Tenant {}: queue drain rejected, periodic drain will retry", tenantId);
    }
  }

  @EventListener
  public void onChannelConnected(ChannelConnectedEvent event) {
    drainAsync(event.tenantId());
  }

  @EventListener(ApplicationReadyEvent.class)
  public void resetClaimedOnStartup() {
    int reset = store.resetClaimed();
    if (reset > 0) {
      log.info("Returned {} in-flight pending response(s) to the queue", reset);
    }
  }

  @Scheduled(
      fixedDelayString = "${pending.drain-interval:PT30S}",
      initialDelayString = "${pending.drain-interval:PT30S}")
  public void drainAll() {
    for (String tenantId : store.tenantsWithPending()) {
      drainAsync(tenantId);
    }
  }

  private boolean deliverOrRelease(PendingEntry entry) {
    try {
      return deliver(entry);
    } catch (RuntimeException e) {
      log.error("Tenant {}: pending entry {} failed", entry.tenantId(), entry.id(), e);
      finalize(entry, DispatchResult.failed(List.of(), e.getMessage()));
      return false;
    }
  }

  private boolean deliver(PendingEntry entry) {
    return conversationLocks.withLock(
        Conversation.lockKey(entry.tenantId(), entry.contactAddress()),
        () -> {
          Optional<Conversation> found = conversations.find(entry.conversationId());
          String stale = staleReason(entry, found);
          if (stale != null) {
            log.debug("Dropping queued response for conversation {}: {}", entry.conversationId(), stale);
            queueLocks.withLock(entry.tenantId(), () -> store.complete(entry.id()));
            return false;
          }
          Conversation conversation = found.get();
          FlowDecision decision =
              entry.isGreeting()
                  ? engine.resume(conversation)
                  : engine.decide(conversation, entry.input());
          BotResponse missing = decision.response().remainingAfter(entry.deliveredBlocks());
          DispatchResult result =
              dispatcher.dispatch(conversation.tenantId(), conversation.contactAddress(), missing);
          if (result.status() == DispatchStatus.SENT) {
            conversations.advance(
                conversation.id(), decision.nextNodeId(), decision.escalated(), clock.instant());
          }
          finalize(entry, result);
          return result.status() == DispatchStatus.SENT;
        });
  }

  private static String staleReason(PendingEntry entry, Optional<Conversation> found) {
    if (found.isEmpty() || found.get().status() == ConversationStatus.FINISHED) {
      return "closed";
    }
    Conversation conversation = found.get();
    if (conversation.status().botSuppressed()) {
      return "handed to an operator";
    }
    if (entry.fromNodeId() != null && !entry.fromNodeId().equals(conversation.currentNodeId())) {
      return "moved on";
    }
    return null;
  }

  private void finalize(PendingEntry entry, DispatchResult result) {
    queueLocks.withLock(
        entry.tenantId(),
        () -> {
          if (result.status() == DispatchStatus.SENT || result.status() == DispatchStatus.REJECTED) {
            store.complete(entry.id());
            return;
          }
          int delivered = entry.deliveredBlocks() + result.deliveredBlocks();
          PendingStatus status = store.release(entry.id(), result.error(), maxAttempts, delivered);
          if (status == PendingStatus.DEAD) {
            log.warn(
                "Tenant {}: queued response for conversation {} dead-lettered: {}",
                entry.tenantId(),
                entry.conversationId(),
                result.error());
          }
        });
  }
}
