package com.flowdesk.chatbotcore.pending;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

@Entity
@Table(name = "pending_responses")
public class PendingResponseEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "tenant_id", nullable = false, length = 64)
  private String tenantId;

  @Column(name = "conversation_id", nullable = false, length = 36)
  private String conversationId;

  @Column(name = "contact_address", nullable = false, length = 128)
  private String contactAddress;

  @Column(name = "from_node_id")
  private Long fromNodeId;

  @Column(name = "replay_input", length = 4096)
  private String input;

  @Column(name = "delivered_blocks", nullable = false)
  private int deliveredBlocks;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private PendingStatus status;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "last_error", length = 512)
  private String lastError;

  @Column(name = "enqueued_at", nullable = false, updatable = false)
  private Instant enqueuedAt;

  protected PendingResponseEntity() {}

  public PendingResponseEntity(OwedReply reply, Instant enqueuedAt) {
    this.tenantId = reply.tenantId();
    this.conversationId = reply.conversationId();
    this.contactAddress = reply.contactAddress();
    this.fromNodeId = reply.fromNodeId();
    this.input = reply.input() == null ? null : truncate(reply.input(), 4096);
    this.deliveredBlocks = reply.deliveredBlocks();
    this.status = PendingStatus.PENDING;
    this.enqueuedAt = enqueuedAt;
  }

  public PendingEntry toEntry() {
    return new PendingEntry(
        id,
        tenantId,
        conversationId,
        contactAddress,
        fromNodeId,
        input,
        deliveredBlocks,
        status,
        attempts,
        lastError,
        enqueuedAt);
  }

  public void claim() {
    this.status = PendingStatus.SENDING;
  }

  /** Returns the entry to the queue, or dead-letters it once {@code maxAttempts} is reached. */
  public void release(String error, int maxAttempts, int deliveredBlocks) {
    this.attempts++;
    this.deliveredBlocks = deliveredBlocks;
    this.lastError = error == null ? null : truncate(error, 512);
    this.status = attempts >= maxAttempts ? PendingStatus.DEAD : PendingStatus.PENDING;
  }

  private static String truncate(String s, int max) {
    return s.length() <= max ? s : s.substring(0, max);
  }

  public Long getId() {
    return id;
  }

  public PendingStatus getStatus() {
    return status;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    PendingResponseEntity that = (PendingResponseEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
