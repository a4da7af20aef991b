package com.flowdesk.chatbotcore.channel.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

/** Opaque auth material issued by the messaging network after pairing. */
@Entity
@Table(name = "channel_credentials")
public class ChannelCredentialEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "tenant_id", nullable = false, unique = true, length = 64)
  private String tenantId;

  @Column(name = "payload", nullable = false, columnDefinition = "text")
  private String payload;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ChannelCredentialEntity() {}

  public ChannelCredentialEntity(String tenantId, String payload) {
    this.tenantId = tenantId;
    this.payload = payload;
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

  public String getPayload() {
    return payload;
  }

  public void replacePayload(String payload) {
    this.payload = payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    ChannelCredentialEntity that = (ChannelCredentialEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
