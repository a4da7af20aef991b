package com.flowdesk.chatbotcore.graph.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

@Entity
@Table(name = "flow_graphs")
public class FlowGraphEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "tenant_id", nullable = false, length = 64)
  private String tenantId;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "closing_message", length = 1024)
  private String closingMessage;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected FlowGraphEntity() {}

  public FlowGraphEntity(String tenantId, String name, boolean active, String closingMessage) {
    this.tenantId = tenantId;
    this.name = name;
    this.active = active;
    this.closingMessage = closingMessage;
  }

  @PrePersist
  @PreUpdate
  public void touch() {
    updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getName() {
    return name;
  }

  public boolean isActive() {
    return active;
  }

  public String getClosingMessage() {
    return closingMessage;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    FlowGraphEntity that = (FlowGraphEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
