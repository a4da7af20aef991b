package com.flowdesk.chatbotcore.graph.service;

import com.flowdesk.chatbotcore.common.cache.CaffeineExpiringCache;
import com.flowdesk.chatbotcore.common.cache.ExpiringCache;
import com.flowdesk.chatbotcore.graph.domain.FlowGraphEntity;
import com.flowdesk.chatbotcore.graph.domain.GraphConnectionEntity;
import com.flowdesk.chatbotcore.graph.domain.GraphNodeEntity;
import com.flowdesk.chatbotcore.graph.domain.GraphOptionEntity;
import com.flowdesk.chatbotcore.graph.model.FlowGraph;
import com.flowdesk.chatbotcore.graph.model.GraphNode;
import com.flowdesk.chatbotcore.graph.model.NodeConnection;
import com.flowdesk.chatbotcore.graph.model.NodeOption;
import com.flowdesk.chatbotcore.graph.repository.FlowGraphRepository;
import com.flowdesk.chatbotcore.graph.repository.GraphConnectionRepository;
import com.flowdesk.chatbotcore.graph.repository.GraphNodeRepository;
import com.flowdesk.chatbotcore.graph.repository.GraphOptionRepository;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only access to tenant graphs. Whole graphs are loaded at once and cached as immutable
 * snapshots; authoring changes become visible after {@code flow.graph-cache.ttl} or {@link
 * #evict}.
 */
@Service
@Slf4j
public class NodeGraphStore {

  private final FlowGraphRepository graphs;
  private final GraphNodeRepository nodes;
  private final GraphOptionRepository options;
  private final GraphConnectionRepository connections;
  private final ExpiringCache<Long, FlowGraph> cache;

  public NodeGraphStore(
      FlowGraphRepository graphs,
      GraphNodeRepository nodes,
      GraphOptionRepository options,
      GraphConnectionRepository connections,
      @Value("${flow.graph-cache.ttl:PT5M}") Duration ttl,
      @Value("${flow.graph-cache.max-size:1000}") long maxSize) {
    this.graphs = graphs;
    this.nodes = nodes;
    this.options = options;
    this.connections = connections;
    this.cache = new CaffeineExpiringCache<>(ttl, maxSize);
  }

  @Transactional(readOnly = true)
  public Optional<FlowGraph> load(Long graphId) {
    if (graphId == null) {
      return Optional.empty();
    }
    Optional<FlowGraph> cached = cache.get(graphId);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<FlowGraph> loaded = graphs.findById(graphId).map(this::assemble);
    loaded.ifPresent(g -> cache.put(graphId, g));
    return loaded;
  }

  @Transactional(readOnly = true)
  public Optional<FlowGraph> findActiveGraphFor(String tenantId) {
    return graphs
        .findFirstByTenantIdAndActiveTrueOrderByIdAsc(tenantId)
        .flatMap(g -> load(g.getId()));
  }

  public void evict(Long graphId) {
    cache.invalidate(graphId);
  }

  private FlowGraph assemble(FlowGraphEntity graph) {
    Map<Long, GraphNode> nodeMap = new LinkedHashMap<>();
    for (GraphNodeEntity n : nodes.findByGraphId(graph.getId())) {
      nodeMap.put(n.getId(), new GraphNode(n.getId(), n.getKind(), n.getText(), n.isStart(), n.isEnd()));
    }

    Map<Long, List<NodeOption>> optionMap = new LinkedHashMap<>();
    if (!nodeMap.isEmpty()) {
      for (GraphOptionEntity o :
          options.findByNodeIdInOrderByNodeIdAscSortOrderAscIdAsc(nodeMap.keySet())) {
        NodeOption option =
            new NodeOption(o.getId(), o.getNodeId(), o.getText(), o.getSortOrder(), o.getTargetNodeId());
        if (option.targetNodeId() != null && !nodeMap.containsKey(option.targetNodeId())) {
          log.warn(
              "Graph {}: option {} targets unknown node {}, falling back to connections",
              graph.getId(),
              option.id(),
              option.targetNodeId());
          option = option.withoutTarget();
        }
        optionMap.computeIfAbsent(option.nodeId(), k -> new ArrayList<>()).add(option);
      }
    }

    Map<Long, List<NodeConnection>> outgoing = new LinkedHashMap<>();
    for (GraphConnectionEntity c : connections.findByGraphIdOrderByIdAsc(graph.getId())) {
      if (!nodeMap.containsKey(c.getTargetNodeId())) {
        log.warn(
            "Graph {}: connection {} targets unknown node {}, ignored",
            graph.getId(),
            c.getId(),
            c.getTargetNodeId());
        continue;
      }
      outgoing
          .computeIfAbsent(c.getSourceNodeId(), k -> new ArrayList<>())
          .add(
              new NodeConnection(
                  c.getId(), c.getSourceNodeId(), c.getTargetNodeId(), c.getOptionId(), c.getCondition()));
    }

    Map<Long, List<NodeOption>> frozenOptions = new LinkedHashMap<>();
    optionMap.forEach((k, v) -> frozenOptions.put(k, List.copyOf(v)));
    Map<Long, List<NodeConnection>> frozenOutgoing = new LinkedHashMap<>();
    outgoing.forEach((k, v) -> frozenOutgoing.put(k, List.copyOf(v)));

    log.debug("Loaded graph {} ({} nodes) for tenant {}", graph.getId(), nodeMap.size(), graph.getTenantId());
    return new FlowGraph(
        graph.getId(),
        graph.getTenantId(),
        graph.getName(),
        graph.getClosingMessage(),
        nodeMap,
        frozenOptions,
        frozenOutgoing);
  }
}
