package com.flowdesk.chatbotcore.support;

import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.domain.ConversationStatus;
import com.flowdesk.chatbotcore.graph.domain.NodeKind;
import com.flowdesk.chatbotcore.graph.model.FlowGraph;
import com.flowdesk.chatbotcore.graph.model.GraphNode;
import com.flowdesk.chatbotcore.graph.model.NodeConnection;
import com.flowdesk.chatbotcore.graph.model.NodeOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class GraphFixtures {

  private GraphFixtures() {}

  public static Builder graph(long id, String tenantId) {
    return new Builder(id, tenantId);
  }

  public static Conversation conversation(
      String id, String tenantId, String contact, long graphId, Long nodeId, Instant lastActivity) {
    return new Conversation(
        id,
        tenantId,
        contact,
        graphId,
        nodeId,
        ConversationStatus.ACTIVE,
        lastActivity,
        lastActivity,
        null,
        null);
  }

  public static final class Builder {
    private final long id;
    private final String tenantId;
    private String closingMessage;
    private final Map<Long, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<Long, List<NodeOption>> options = new LinkedHashMap<>();
    private final Map<Long, List<NodeConnection>> outgoing = new LinkedHashMap<>();
    private long nextConnectionId = 10_000;

    private Builder(long id, String tenantId) {
      this.id = id;
      this.tenantId = tenantId;
    }

    public Builder start(long nodeId, NodeKind kind, String text) {
      nodes.put(nodeId, new GraphNode(nodeId, kind, text, true, false));
      return this;
    }

    public Builder node(long nodeId, NodeKind kind, String text) {
      nodes.put(nodeId, new GraphNode(nodeId, kind, text, false, false));
      return this;
    }

    public Builder option(long optionId, long nodeId, String text, Long targetNodeId) {
      List<NodeOption> list = options.computeIfAbsent(nodeId, k -> new ArrayList<>());
      list.add(new NodeOption(optionId, nodeId, text, list.size(), targetNodeId));
      return this;
    }

    public Builder edge(long from, long to) {
      return connection(from, to, null, null);
    }

    public Builder conditionalEdge(long from, long to, String condition) {
      return connection(from, to, null, condition);
    }

    public Builder optionEdge(long from, long to, long optionId) {
      return connection(from, to, optionId, null);
    }

    public Builder closingMessage(String closingMessage) {
      this.closingMessage = closingMessage;
      return this;
    }

    private Builder connection(long from, long to, Long optionId, String condition) {
      outgoing
          .computeIfAbsent(from, k -> new ArrayList<>())
          .add(new NodeConnection(nextConnectionId++, from, to, optionId, condition));
      return this;
    }

    public FlowGraph build() {
      Map<Long, List<NodeOption>> frozenOptions = new LinkedHashMap<>();
      options.forEach((k, v) -> frozenOptions.put(k, List.copyOf(v)));
      Map<Long, List<NodeConnection>> frozenOutgoing = new LinkedHashMap<>();
      outgoing.forEach((k, v) -> frozenOutgoing.put(k, List.copyOf(v)));
      return new FlowGraph(
          id, tenantId, "graph-" + id, closingMessage, nodes, frozenOptions, frozenOutgoing);
    }
  }
}
