package com.flowdesk.chatbotcore.graph.model;

import com.flowdesk.chatbotcore.graph.domain.NodeKind;

public record GraphNode(Long id, NodeKind kind, String text, boolean start, boolean end) {}
