package com.flowdesk.chatbotcore.graph.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of one tenant graph. Options are kept in display order, connections in
 * authoring order.
 */
public record FlowGraph(
    Long id,
    String tenantId,
    String name,
    String closingMessage,
    Map<Long, GraphNode> nodes,
    Map<Long, List<NodeOption>> optionsByNode,
    Map<Long, List<NodeConnection>> outgoingByNode) {

  public FlowGraph {
    nodes = Map.copyOf(nodes);
    optionsByNode = Map.copyOf(optionsByNode);
    outgoingByNode = Map.copyOf(outgoingByNode);
  }

  public Optional<GraphNode> node(Long nodeId) {
    return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
  }

  public List<NodeOption> options(Long nodeId) {
    return optionsByNode.getOrDefault(nodeId, List.of());
  }

  public List<NodeConnection> outgoing(Long nodeId) {
    return outgoingByNode.getOrDefault(nodeId, List.of());
  }

  public Optional<GraphNode> startNode() {
    return nodes.values().stream()
        .filter(GraphNode::start)
        .min((a, b) -> Long.compare(a.id(), b.id()));
  }

  /** Target of the first connection without option and condition. */
  public Optional<GraphNode> defaultNext(Long nodeId) {
    return outgoing(nodeId).stream()
        .filter(NodeConnection::isDefault)
        .findFirst()
        .flatMap(c -> node(c.targetNodeId()));
  }
}
