package com.flowdesk.chatbotcore.graph.domain;

import jakarta.persistence.*;
import org.hibernate.Hibernate;

@Entity
@Table(name = "graph_connections")
public class GraphConnectionEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "graph_id", nullable = false)
  private Long graphId;

  @Column(name = "source_node_id", nullable = false)
  private Long sourceNodeId;

  @Column(name = "target_node_id", nullable = false)
  private Long targetNodeId;

  @Column(name = "option_id")
  private Long optionId;

  @Column(name = "condition_expr", length = 512)
  private String condition;

  protected GraphConnectionEntity() {}

  public GraphConnectionEntity(
      Long graphId, Long sourceNodeId, Long targetNodeId, Long optionId, String condition) {
    this.graphId = graphId;
    this.sourceNodeId = sourceNodeId;
    this.targetNodeId = targetNodeId;
    this.optionId = optionId;
    this.condition = condition;
  }

  public Long getId() {
    return id;
  }

  public Long getGraphId() {
    return graphId;
  }

  public Long getSourceNodeId() {
    return sourceNodeId;
  }

  public Long getTargetNodeId() {
    return targetNodeId;
  }

  public Long getOptionId() {
    return optionId;
  }

  public String getCondition() {
    return condition;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    GraphConnectionEntity that = (GraphConnectionEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
