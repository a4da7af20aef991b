package com.flowdesk.chatbotcore.graph.domain;

import jakarta.persistence.*;
import org.hibernate.Hibernate;

@Entity
@Table(name = "graph_options")
public class GraphOptionEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "node_id", nullable = false)
  private Long nodeId;

  @Column(name = "text", nullable = false, length = 512)
  private String text;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "target_node_id")
  private Long targetNodeId;

  protected GraphOptionEntity() {}

  public GraphOptionEntity(Long nodeId, String text, int sortOrder, Long targetNodeId) {
    this.nodeId = nodeId;
    this.text = text;
    this.sortOrder = sortOrder;
    this.targetNodeId = targetNodeId;
  }

  public Long getId() {
    return id;
  }

  public Long getNodeId() {
    return nodeId;
  }

  public String getText() {
    return text;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public Long getTargetNodeId() {
    return targetNodeId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    GraphOptionEntity that = (GraphOptionEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
