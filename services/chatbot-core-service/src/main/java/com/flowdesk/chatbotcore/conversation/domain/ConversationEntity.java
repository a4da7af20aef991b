package com.flowdesk.chatbotcore.conversation.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.Hibernate;

@Entity
@Table(name = "conversations")
public class ConversationEntity {

  @Id
  @Column(name = "id", nullable = false, length = 36)
  private String id;

  @Column(name = "tenant_id", nullable = false, length = 64)
  private String tenantId;

  @Column(name = "contact_address", nullable = false, length = 128)
  private String contactAddress;

  @Column(name = "graph_id", nullable = false)
  private Long graphId;

  @Column(name = "current_node_id")
  private Long currentNodeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private ConversationStatus status;

  @Column(name = "last_activity_at", nullable = false)
  private Instant lastActivityAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "finished_at")
  private Instant finishedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "close_reason", length = 16)
  private CloseReason closeReason;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected ConversationEntity() {}

  public ConversationEntity(
      String tenantId, String contactAddress, Long graphId, Long startNodeId, Instant at) {
    this.id = UUID.randomUUID().toString();
    this.tenantId = tenantId;
    this.contactAddress = contactAddress;
    this.graphId = graphId;
    this.currentNodeId = startNodeId;
    this.status = ConversationStatus.ACTIVE;
    this.lastActivityAt = at;
    this.createdAt = at;
  }

  public void moveTo(Long nodeId) {
    this.currentNodeId = nodeId;
  }

  public void touch(Instant at) {
    this.lastActivityAt = at;
  }

  public void escalate() {
    if (status == ConversationStatus.ACTIVE) {
      status = ConversationStatus.ESCALATED;
    }
  }

  public void finish(CloseReason reason, Instant at) {
    this.status = ConversationStatus.FINISHED;
    this.closeReason = reason;
    this.finishedAt = at;
  }

  public Conversation toView() {
    return new Conversation(
        id,
        tenantId,
        contactAddress,
        graphId,
        currentNodeId,
        status,
        lastActivityAt,
        createdAt,
        finishedAt,
        closeReason);
  }

  public String getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getContactAddress() {
    return contactAddress;
  }

  public Long getCurrentNodeId() {
    return currentNodeId;
  }

  public ConversationStatus getStatus() {
    return status;
  }

  public Instant getLastActivityAt() {
    return lastActivityAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    ConversationEntity that = (ConversationEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
