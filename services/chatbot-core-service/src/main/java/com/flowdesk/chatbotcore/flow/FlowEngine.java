package com.flowdesk.chatbotcore.flow;

import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.flow.response.BotResponse;
import com.flowdesk.chatbotcore.graph.domain.NodeKind;
import com.flowdesk.chatbotcore.graph.model.FlowGraph;
import com.flowdesk.chatbotcore.graph.model.GraphNode;
import com.flowdesk.chatbotcore.graph.model.NodeConnection;
import com.flowdesk.chatbotcore.graph.model.NodeOption;
import com.flowdesk.chatbotcore.graph.service.NodeGraphStore;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Decides the next graph position and the response for a conversation. Stateless: the caller
 * persists {@link FlowDecision#nextNodeId()} and serializes calls per conversation.
 *
 * <p>Awaiting nodes (OPTION, INPUT) hold the cursor until the input matches. Every other node
 * is presented once and the cursor follows its default edge. A MESSAGE followed by an OPTION is
 * rendered together with it in a single step.
 */
@Service
@Slf4j
public class FlowEngine {

  private final NodeGraphStore graphStore;
  private final OptionResolver optionResolver;
  private final ConditionEvaluator conditionEvaluator;
  private final NodeRenderer renderer;
  private final String fallbackGreeting;

  public FlowEngine(
      NodeGraphStore graphStore,
      OptionResolver optionResolver,
      ConditionEvaluator conditionEvaluator,
      NodeRenderer renderer,
      @Value("${flow.fallback-greeting:Hello! How can we help you today?}") String fallbackGreeting) {
    this.graphStore = graphStore;
    this.optionResolver = optionResolver;
    this.conditionEvaluator = conditionEvaluator;
    this.renderer = renderer;
    this.fallbackGreeting = fallbackGreeting;
  }

  public FlowDecision decide(Conversation conversation, String rawInput) {
    Optional<FlowGraph> graph = graphStore.load(conversation.graphId());
    Optional<GraphNode> current = graph.flatMap(g -> g.node(conversation.currentNodeId()));
    if (current.isEmpty()) {
      return fallback(conversation);
    }
    FlowGraph g = graph.get();
    GraphNode node = current.get();

    return switch (node.kind()) {
      case OPTION -> optionResolver
          .resolve(g.options(node.id()), rawInput)
          .flatMap(option -> targetOf(g, node, option))
          .map(target -> arrive(g, target))
          .orElseGet(() -> FlowDecision.stay(renderer.render(g, node)));
      case INPUT -> inputEdge(g, node, rawInput)
          .map(target -> arrive(g, target))
          .orElseGet(() -> FlowDecision.stay(renderer.render(g, node)));
      default -> present(g, node);
    };
  }

  /** Renders the current position without consuming input. */
  public FlowDecision resume(Conversation conversation) {
    Optional<FlowGraph> graph = graphStore.load(conversation.graphId());
    Optional<GraphNode> current = graph.flatMap(g -> g.node(conversation.currentNodeId()));
    if (current.isEmpty()) {
      return fallback(conversation);
    }
    GraphNode node = current.get();
    if (node.kind().awaitsInput()) {
      return FlowDecision.stay(renderer.render(graph.get(), node));
    }
    return present(graph.get(), node);
  }

  private FlowDecision arrive(FlowGraph graph, GraphNode target) {
    if (target.kind().awaitsInput()) {
      return new FlowDecision(renderer.render(graph, target), target.id(), false);
    }
    return present(graph, target);
  }

  private FlowDecision present(FlowGraph graph, GraphNode node) {
    BotResponse response = renderer.render(graph, node);
    boolean escalated = node.kind() == NodeKind.ESCALATION;
    Optional<GraphNode> next = graph.defaultNext(node.id());
    if (next.isEmpty()) {
      return new FlowDecision(response, node.id(), escalated);
    }
    GraphNode n = next.get();
    if (node.kind() == NodeKind.MESSAGE && n.kind() == NodeKind.OPTION) {
      return new FlowDecision(response.append(renderer.render(graph, n)), n.id(), escalated);
    }
    return new FlowDecision(response, n.id(), escalated);
  }

  private Optional<GraphNode> targetOf(FlowGraph graph, GraphNode node, NodeOption option) {
    if (option.targetNodeId() != null) {
      Optional<GraphNode> direct = graph.node(option.targetNodeId());
      if (direct.isPresent()) {
        return direct;
      }
    }
    return graph.outgoing(node.id()).stream()
        .filter(c -> option.id().equals(c.optionId()))
        .findFirst()
        .flatMap(c -> graph.node(c.targetNodeId()));
  }

  private Optional<GraphNode> inputEdge(FlowGraph graph, GraphNode node, String rawInput) {
    NodeConnection fallbackEdge = null;
    for (NodeConnection c : graph.outgoing(node.id())) {
      if (c.optionId() != null) {
        continue;
      }
      if (c.isDefault()) {
        if (fallbackEdge == null) {
          fallbackEdge = c;
        }
      } else if (conditionEvaluator.matches(c.condition(), rawInput)) {
        return graph.node(c.targetNodeId());
      }
    }
    return fallbackEdge == null ? Optional.empty() : graph.node(fallbackEdge.targetNodeId());
  }

  private FlowDecision fallback(Conversation conversation) {
    log.warn(
        "Conversation {}: node {} of graph {} not loadable, answering with fallback greeting",
        conversation.id(),
        conversation.currentNodeId(),
        conversation.graphId());
    return FlowDecision.stay(BotResponse.text(fallbackGreeting));
  }
}
