package com.flowdesk.chatbotcore.graph.domain;

import jakarta.persistence.*;
import org.hibernate.Hibernate;

@Entity
@Table(name = "graph_nodes")
public class GraphNodeEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "graph_id", nullable = false)
  private Long graphId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 32)
  private NodeKind kind;

  @Column(name = "text", length = 4096)
  private String text;

  @Column(name = "is_start", nullable = false)
  private boolean start;

  @Column(name = "is_end", nullable = false)
  private boolean end;

  protected GraphNodeEntity() {}

  public GraphNodeEntity(Long graphId, NodeKind kind, String text, boolean start, boolean end) {
    this.graphId = graphId;
    this.kind = kind;
    this.text = text;
    this.start = start;
    this.end = end;
  }

  public Long getId() {
    return id;
  }

  public Long getGraphId() {
    return graphId;
  }

  public NodeKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public boolean isStart() {
    return start;
  }

  public boolean isEnd() {
    return end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    GraphNodeEntity that = (GraphNodeEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
