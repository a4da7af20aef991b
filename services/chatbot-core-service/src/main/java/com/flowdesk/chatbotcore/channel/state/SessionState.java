package com.flowdesk.chatbotcore.channel.state;

import com.flowdesk.chatbotcore.channel.domain.SessionStatus;
import java.time.Instant;

/** Connection state of one tenant session. Replaced wholesale on every transition. */
public record SessionState(
    SessionStatus status,
    int attempts,
    String lastReason,
    boolean manual,
    String pairingCode,
    Instant pairingExpiresAt) {

  public static SessionState initial() {
    return new SessionState(SessionStatus.DISCONNECTED, 0, null, false, null, null);
  }

  public SessionState withStatus(SessionStatus status) {
    return new SessionState(status, attempts, lastReason, manual, pairingCode, pairingExpiresAt);
  }

  public SessionState withAttempts(int attempts) {
    return new SessionState(status, attempts, lastReason, manual, pairingCode, pairingExpiresAt);
  }

  public SessionState withReason(String lastReason) {
    return new SessionState(status, attempts, lastReason, manual, pairingCode, pairingExpiresAt);
  }

  public SessionState withManual(boolean manual) {
    return new SessionState(status, attempts, lastReason, manual, pairingCode, pairingExpiresAt);
  }

  public SessionState withPairing(String pairingCode, Instant pairingExpiresAt) {
    return new SessionState(status, attempts, lastReason, manual, pairingCode, pairingExpiresAt);
  }

  public SessionState withoutPairing() {
    return withPairing(null, null);
  }
}
