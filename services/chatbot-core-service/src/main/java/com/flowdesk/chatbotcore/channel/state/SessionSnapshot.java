package com.flowdesk.chatbotcore.channel.state;

import com.flowdesk.chatbotcore.channel.domain.SessionStatus;
import java.time.Instant;

public record SessionSnapshot(
    String tenantId,
    String channel,
    SessionStatus status,
    int reconnectAttempts,
    String lastDisconnectReason,
    boolean manualDisconnect,
    String pairingCode,
    Instant pairingExpiresAt,
    boolean live) {}
