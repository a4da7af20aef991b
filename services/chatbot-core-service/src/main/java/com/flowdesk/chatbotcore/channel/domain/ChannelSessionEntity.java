package com.flowdesk.chatbotcore.channel.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

@Entity
@Table(name = "channel_sessions")
public class ChannelSessionEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "tenant_id", nullable = false, unique = true, length = 64)
  private String tenantId;

  @Column(name = "channel", nullable = false, length = 32)
  private String channel;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private SessionStatus status;

  @Column(name = "reconnect_attempts", nullable = false)
  private int reconnectAttempts;

  @Column(name = "last_disconnect_reason", length = 64)
  private String lastDisconnectReason;

  @Column(name = "credentials_ref", length = 64)
  private String credentialsRef;

  @Column(name = "manual_disconnect", nullable = false)
  private boolean manualDisconnect;

  @Column(name = "pairing_code", length = 1024)
  private String pairingCode;

  @Column(name = "pairing_expires_at")
  private Instant pairingExpiresAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ChannelSessionEntity() {}

  public ChannelSessionEntity(String tenantId, String channel) {
    this.tenantId = tenantId;
    this.channel = channel;
    this.status = SessionStatus.DISCONNECTED;
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

  public String getChannel() {
    return channel;
  }

  public SessionStatus getStatus() {
    return status;
  }

  public void setStatus(SessionStatus status) {
    this.status = status;
  }

  public int getReconnectAttempts() {
    return reconnectAttempts;
  }

  public void setReconnectAttempts(int reconnectAttempts) {
    this.reconnectAttempts = reconnectAttempts;
  }

  public String getLastDisconnectReason() {
    return lastDisconnectReason;
  }

  public void setLastDisconnectReason(String lastDisconnectReason) {
    this.lastDisconnectReason = lastDisconnectReason;
  }

  public String getCredentialsRef() {
    return credentialsRef;
  }

  public void setCredentialsRef(String credentialsRef) {
    this.credentialsRef = credentialsRef;
  }

  public boolean isManualDisconnect() {
    return manualDisconnect;
  }

  public void setManualDisconnect(boolean manualDisconnect) {
    this.manualDisconnect = manualDisconnect;
  }

  public String getPairingCode() {
    return pairingCode;
  }

  public void setPairingCode(String pairingCode) {
    this.pairingCode = pairingCode;
  }

  public Instant getPairingExpiresAt() {
    return pairingExpiresAt;
  }

  public void setPairingExpiresAt(Instant pairingExpiresAt) {
    this.pairingExpiresAt = pairingExpiresAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    ChannelSessionEntity that = (ChannelSessionEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
