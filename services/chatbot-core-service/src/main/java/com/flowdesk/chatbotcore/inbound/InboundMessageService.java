package com.flowdesk.chatbotcore.inbound;

import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.service.ConversationLocks;
import com.flowdesk.chatbotcore.conversation.service.ConversationStateStore;
import com.flowdesk.chatbotcore.dispatch.ContactAddressPolicy;
import com.flowdesk.chatbotcore.dispatch.DispatchResult;
import com.flowdesk.chatbotcore.dispatch.ResponseDispatcher;
import com.flowdesk.chatbotcore.flow.FlowDecision;
import com.flowdesk.chatbotcore.flow.FlowEngine;
import com.flowdesk.chatbotcore.graph.model.FlowGraph;
import com.flowdesk.chatbotcore.graph.model.GraphNode;
import com.flowdesk.chatbotcore.graph.service.NodeGraphStore;
import com.flowdesk.chatbotcore.pending.OwedReply;
import com.flowdesk.chatbotcore.pending.PendingResponseQueue;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for contact messages: finds or starts the conversation, asks the engine for the
 * next step and sends the reply. The cursor moves only once the reply is sent; an undelivered
 * reply is queued with the input that produced it. Everything per contact runs under the
 * conversation lock, so concurrent messages are applied one after another.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundMessageService {

  private final ContactAddressPolicy addressPolicy;
  private final ConversationLocks locks;
  private final ConversationStateStore conversations;
  private final NodeGraphStore graphs;
  private final FlowEngine engine;
  private final ResponseDispatcher dispatcher;
  private final ConnectionManager connections;
  private final PendingResponseQueue pending;
  private final Clock clock;

  public InboundResult onInboundMessage(String tenantId, String contactAddress, String rawInput) {
    if (!addressPolicy.isIndividual(contactAddress)) {
      log.debug("Tenant {}: ignoring message from {}", tenantId, contactAddress);
      return InboundResult.IGNORED;
    }
    InboundResult result =
        locks.withLock(
            Conversation.lockKey(tenantId, contactAddress),
            () -> handle(tenantId, contactAddress, rawInput));
    if (result == InboundResult.RESPONDED && pending.hasPending(tenantId)) {
      pending.drainAsync(tenantId);
    }
    return result;
  }

  private InboundResult handle(String tenantId, String contactAddress, String rawInput) {
    Instant now = clock.instant();
    Conversation conversation;
    boolean created = false;

    Optional<Conversation> open = conversations.findOpen(tenantId, contactAddress);
    if (open.isPresent()) {
      conversation = open.get();
    } else {
      Optional<FlowGraph> graph = graphs.findActiveGraphFor(tenantId);
      Optional<GraphNode> start = graph.flatMap(FlowGraph::startNode);
      if (start.isEmpty()) {
        log.warn("Tenant {}: no active graph with a start node, message dropped", tenantId);
        return InboundResult.NO_FLOW;
      }
      conversation =
          conversations.start(tenantId, contactAddress, graph.get().id(), start.get().id(), now);
      created = true;
    }

    if (conversation.status().botSuppressed()) {
      conversations.touch(conversation.id(), now);
      return InboundResult.SUPPRESSED;
    }

    boolean live = connections.isLive(tenantId);
    if (created && !live) {
      pending.append(OwedReply.greeting(conversation));
      return InboundResult.QUEUED;
    }
    if (!created && live) {
      Optional<Conversation> settled = pending.deliverOwed(conversation);
      if (settled.isPresent()) {
        conversation = settled.get();
        if (conversation.status().botSuppressed()) {
          conversations.touch(conversation.id(), now);
          return InboundResult.SUPPRESSED;
        }
      }
    }

    FlowDecision decision =
        created ? engine.resume(conversation) : engine.decide(conversation, rawInput);
    DispatchResult result = dispatcher.dispatch(tenantId, contactAddress, decision.response());
    switch (result.status()) {
      case SENT -> {
        conversations.advance(
            conversation.id(), decision.nextNodeId(), decision.escalated(), now);
        return InboundResult.RESPONDED;
      }
      case REJECTED -> {
        conversations.touch(conversation.id(), now);
        return InboundResult.REJECTED;
      }
      default -> {
        conversations.touch(conversation.id(), now);
        pending.append(
            created
                ? OwedReply.greeting(conversation, result.deliveredBlocks())
                : OwedReply.reply(conversation, rawInput, result.deliveredBlocks()));
        return InboundResult.QUEUED;
      }
    }
  }
}
