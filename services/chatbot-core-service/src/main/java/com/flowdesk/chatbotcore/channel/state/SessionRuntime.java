package com.flowdesk.chatbotcore.channel.state;

import com.flowdesk.chatbotcore.channel.domain.SessionStatus;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory runtime of one tenant session. All fields are guarded by {@link #lock}.
 *
 * <p>{@code generation} changes whenever a new connection attempt starts or the session is
 * manually disconnected; asynchronous results from an older generation are discarded.
 */
final class SessionRuntime {

  final String tenantId;
  final ReentrantLock lock = new ReentrantLock();

  SessionState state;
  boolean persisted;
  long generation;
  CompletableFuture<SessionStatus> inFlight;
  SessionTimers.Handle reconnectTimer;
  SessionTimers.Handle connectTimeoutTimer;
  SessionTimers.Handle pairingTimer;

  SessionRuntime(String tenantId, SessionState state) {
    this.tenantId = tenantId;
    this.state = state;
  }

  boolean initializing() {
    return inFlight != null && !inFlight.isDone();
  }

  boolean reconnectPending() {
    return reconnectTimer != null && reconnectTimer.isPending();
  }

  void cancelReconnect() {
    if (reconnectTimer != null) {
      reconnectTimer.cancel();
      reconnectTimer = null;
    }
  }

  void cancelConnectTimeout() {
    if (connectTimeoutTimer != null) {
      connectTimeoutTimer.cancel();
      connectTimeoutTimer = null;
    }
  }

  void cancelPairing() {
    if (pairingTimer != null) {
      pairingTimer.cancel();
      pairingTimer = null;
    }
  }

  void cancelAllTimers() {
    cancelReconnect();
    cancelConnectTimeout();
    cancelPairing();
  }

  void settle(SessionStatus status) {
    if (inFlight != null && !inFlight.isDone()) {
      inFlight.complete(status);
    }
  }
}
