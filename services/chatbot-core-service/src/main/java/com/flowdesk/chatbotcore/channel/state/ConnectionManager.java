package com.flowdesk.chatbotcore.channel.state;

import com.flowdesk.chatbotcore.channel.domain.SessionStatus;
import com.flowdesk.chatbotcore.channel.store.ChannelSessionStore;
import com.flowdesk.chatbotcore.channel.store.CredentialStore;
import com.flowdesk.chatbotcore.channel.transport.ChannelTransport;
import com.flowdesk.chatbotcore.channel.transport.DisconnectReason;
import com.flowdesk.chatbotcore.channel.transport.PairingCode;
import com.flowdesk.chatbotcore.common.web.NotFoundException;
import com.flowdesk.chatbotcore.common.web.RejectedOperationException;
import com.flowdesk.chatbotcore.config.ChannelProperties;
import com.flowdesk.chatbotcore.events.EventFanout;
import com.flowdesk.chatbotcore.events.EventKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Per-tenant connection state machine.
 *
 * <p>Every state change happens under the tenant's {@link SessionRuntime#lock} and goes through
 * {@link #transition}, which persists the row and publishes {@code SESSION_STATUS}. Blocking
 * transport calls run on {@code channelExecutor} outside the lock; their results are applied only
 * if the session generation is unchanged.
 *
 * <p>Transitions:
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> [QR_PENDING -> CONNECTING] -> CONNECTED
 * any -> DISCONNECTED (recoverable close, backoff) | ERROR (auth rejected, timeout, attempts exhausted)
 * </pre>
 */
@Service
@Slf4j
public class ConnectionManager {

  public static final String REASON_RESTART = "RESTART";
  static final String REASON_MANUAL = "MANUAL";
  static final String REASON_CONNECT_TIMEOUT = "CONNECT_TIMEOUT";
  static final String REASON_MAX_ATTEMPTS = "MAX_RECONNECT_ATTEMPTS";
  static final String REASON_PAIRING_UNSUPPORTED = "PAIRING_UNSUPPORTED";

  private static final long ANY_GENERATION = -1L;
  private static final Duration MIN_PAIRING_REFRESH = Duration.ofSeconds(1);

  private final Map<String, SessionRuntime> runtimes = new ConcurrentHashMap<>();

  private final ChannelTransport transport;
  private final ChannelSessionStore sessionStore;
  private final CredentialStore credentialStore;
  private final SessionTimers timers;
  private final ReconnectPolicy policy;
  private final ChannelProperties props;
  private final EventFanout fanout;
  private final ApplicationEventPublisher eventPublisher;
  private final Executor executor;
  private final Clock clock;

  public ConnectionManager(
      ChannelTransport transport,
      ChannelSessionStore sessionStore,
      CredentialStore credentialStore,
      SessionTimers timers,
      ReconnectPolicy policy,
      ChannelProperties props,
      EventFanout fanout,
      ApplicationEventPublisher eventPublisher,
      @Qualifier("channelExecutor") Executor executor,
      Clock clock) {
    this.transport = transport;
    this.sessionStore = sessionStore;
    this.credentialStore = credentialStore;
    this.timers = timers;
    this.policy = policy;
    this.props = props;
    this.fanout = fanout;
    this.eventPublisher = eventPublisher;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Starts a connection attempt unless one is already running, in which case the running
   * attempt's future is returned. The future completes with the first settled status
   * (CONNECTED, QR_PENDING, DISCONNECTED or ERROR).
   */
  public CompletableFuture<SessionStatus> initialize(String tenantId, String trigger) {
    SessionRuntime rt = startingRuntime(tenantId);
    CompletableFuture<SessionStatus> future;
    long gen;
    rt.lock.lock();
    try {
      if (rt.initializing()) {
        log.debug("Tenant {}: joining running initialization (trigger={})", tenantId, trigger);
        return rt.inFlight;
      }
      SessionState s = rt.state;
      if (s.manual() || s.status() == SessionStatus.ERROR || s.status().holdsConnection()) {
        return CompletableFuture.completedFuture(s.status());
      }
      rt.cancelAllTimers();
      gen = ++rt.generation;
      future = new CompletableFuture<>();
      rt.inFlight = future;
      transition(rt, s.withStatus(SessionStatus.CONNECTING).withoutPairing());
      rt.connectTimeoutTimer =
          timers.schedule(() -> onConnectTimeout(rt, gen), props.connectTimeout());
    } finally {
      rt.lock.unlock();
    }

    log.info("Tenant {}: initializing channel session (trigger={})", tenantId, trigger);
    try {
      executor.execute(() -> startTransport(rt, gen));
    } catch (RejectedExecutionException e) {
      log.warn("Tenant {}: channel executor rejected start", tenantId);
      handleClose(rt, DisconnectReason.transportFailure("executor saturated"), gen);
    }
    return future;
  }

  /** Manual connect: clears the manual marker and the attempt counter, then initializes. */
  public SessionSnapshot connect(String tenantId) {
    SessionRuntime rt = startingRuntime(tenantId);
    locked(
        rt,
        () -> {
          SessionState s = rt.state;
          if (s.manual() || s.attempts() > 0 || s.status() == SessionStatus.ERROR || !rt.persisted) {
            rt.cancelReconnect();
            SessionStatus status =
                s.status() == SessionStatus.ERROR ? SessionStatus.DISCONNECTED : s.status();
            transition(rt, s.withStatus(status).withAttempts(0).withManual(false));
          }
        });

    CompletableFuture<SessionStatus> future = initialize(tenantId, "manual");
    try {
      SessionStatus settled = future.get(props.initWait().toMillis(), TimeUnit.MILLISECONDS);
      log.info("Tenant {}: manual connect settled in {}", tenantId, settled);
    } catch (TimeoutException e) {
      log.info("Tenant {}: manual connect still in progress after {}", tenantId, props.initWait());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      log.warn("Tenant {}: manual connect failed: {}", tenantId, e.getCause().getMessage());
    }
    return snapshot(rt);
  }

  /** Manual disconnect. The session stays down until {@link #connect}. */
  public SessionSnapshot disconnect(String tenantId) {
    SessionRuntime rt = existingRuntime(tenantId);
    locked(
        rt,
        () -> {
          rt.generation++;
          rt.cancelAllTimers();
          transition(
              rt, new SessionState(SessionStatus.DISCONNECTED, 0, REASON_MANUAL, true, null, null));
        });
    log.info("Tenant {}: manually disconnected", tenantId);
    disconnectTransportQuietly(tenantId);
    return snapshot(rt);
  }

  /** Requests a new pairing code for a session waiting to be scanned. */
  public SessionSnapshot refreshPairing(String tenantId) {
    SessionRuntime rt = existingRuntime(tenantId);
    long gen =
        locked(
            rt,
            () -> {
              if (rt.state.status() != SessionStatus.QR_PENDING) {
                throw new RejectedOperationException(
                    "NOT_PAIRING", "Session of tenant " + tenantId + " is not waiting for pairing");
              }
              return rt.generation;
            });
    requestNewPairingCode(rt, gen);
    return snapshot(rt);
  }

  public boolean isLive(String tenantId) {
    Optional<SessionRuntime> known = knownRuntime(tenantId);
    if (known.isEmpty()) {
      return false;
    }
    SessionRuntime rt = known.get();
    Long gen =
        locked(
            rt, () -> rt.state.status() == SessionStatus.CONNECTED ? rt.generation : null);
    if (gen == null) {
      return false;
    }
    if (!transport.capabilities().liveness()) {
      return true;
    }
    boolean live;
    try {
      live = transport.isLive(tenantId);
    } catch (RuntimeException e) {
      log.warn("Tenant {}: liveness check failed: {}", tenantId, e.getMessage());
      live = false;
    }
    if (!live) {
      log.warn("Tenant {}: CONNECTED session has a dead transport handle", tenantId);
      handleClose(rt, DisconnectReason.stale(), gen);
    }
    return live;
  }

  public SessionSnapshot getSessionStatus(String tenantId) {
    SessionRuntime rt = existingRuntime(tenantId);
    isLive(tenantId);
    return snapshot(rt);
  }

  // transport events

  public void onConnecting(String tenantId) {
    SessionRuntime rt = eventRuntime(tenantId, "connecting").orElse(null);
    if (rt == null) {
      return;
    }
    locked(
        rt,
        () -> {
          if (rt.state.status() != SessionStatus.QR_PENDING) {
            return;
          }
          rt.cancelPairing();
          transition(rt, rt.state.withStatus(SessionStatus.CONNECTING).withoutPairing());
        });
  }

  public void onCredentials(String tenantId, String credentials) {
    SessionRuntime rt = eventRuntime(tenantId, "credentials").orElse(null);
    if (rt == null) {
      return;
    }
    locked(
        rt,
        () -> {
          String ref = credentialStore.save(tenantId, credentials);
          sessionStore.updateCredentialsRef(tenantId, ref);
          log.info("Tenant {}: channel credentials stored as {}", tenantId, ref);
        });
  }

  public void onOpened(String tenantId) {
    SessionRuntime rt = eventRuntime(tenantId, "open").orElse(null);
    if (rt == null) {
      return;
    }
    Boolean connected =
        locked(
            rt,
            () -> {
              SessionState s = rt.state;
              if (s.manual() || s.status() == SessionStatus.ERROR) {
                log.warn(
                    "Tenant {}: ignoring open in {} (manual={})", tenantId, s.status(), s.manual());
                return null;
              }
              if (s.status() == SessionStatus.CONNECTED) {
                return false;
              }
              rt.cancelAllTimers();
              transition(
                  rt, new SessionState(SessionStatus.CONNECTED, 0, null, false, null, null));
              fanout.notify(tenantId, EventKind.CONNECTION_SUCCESS, Map.of("channel", props.name()));
              return true;
            });
    if (connected == null) {
      disconnectTransportQuietly(tenantId);
    } else if (connected) {
      log.info("Tenant {}: channel connected", tenantId);
      eventPublisher.publishEvent(new ChannelConnectedEvent(tenantId));
    }
  }

  public void onClosed(String tenantId, DisconnectReason reason) {
    eventRuntime(tenantId, "close").ifPresent(rt -> handleClose(rt, reason, ANY_GENERATION));
  }

  // sweeps

  /**
   * Re-initializes DISCONNECTED sessions that were not manually disconnected and have no
   * reconnect pending. Returns the number of attempts started.
   */
  public int sweepDisconnected() {
    List<String> candidates = sessionStore.findReconnectCandidates();
    int started = 0;
    for (String tenantId : candidates) {
      try {
        Optional<SessionRuntime> known = knownRuntime(tenantId);
        if (known.isEmpty()) {
          continue;
        }
        SessionRuntime rt = known.get();
        boolean eligible =
            locked(
                rt,
                () ->
                    rt.state.status() == SessionStatus.DISCONNECTED
                        && !rt.state.manual()
                        && !rt.reconnectPending()
                        && !rt.initializing());
        if (eligible) {
          initialize(tenantId, "sweep");
          started++;
        }
      } catch (RuntimeException e) {
        log.warn("Tenant {}: reconnect sweep failed: {}", tenantId, e.getMessage());
      }
    }
    return started;
  }

  /** Resets sessions that were holding a connection when the previous process stopped. */
  public int restoreAfterRestart() {
    int reset = sessionStore.resetInterrupted(REASON_RESTART);
    if (reset > 0) {
      log.info("Reset {} interrupted channel session(s) to DISCONNECTED", reset);
    }
    return reset;
  }

  // internals

  private void startTransport(SessionRuntime rt, long gen) {
    String tenantId = rt.tenantId;
    try {
      Optional<String> credentials = credentialStore.load(tenantId);
      if (credentials.isPresent()) {
        transport.resume(tenantId, credentials.get());
        return;
      }
      if (!transport.capabilities().pairing()) {
        locked(
            rt,
            () -> {
              if (rt.generation == gen) {
                log.warn("Tenant {}: no credentials and transport cannot pair", tenantId);
                fail(rt, REASON_PAIRING_UNSUPPORTED);
              }
            });
        return;
      }
      applyPairingCode(rt, gen, transport.beginPairing(tenantId), false);
    } catch (RuntimeException e) {
      log.warn("Tenant {}: channel start failed: {}", tenantId, e.getMessage());
      handleClose(rt, DisconnectReason.transportFailure(e.getMessage()), gen);
    }
  }

  private void requestNewPairingCode(SessionRuntime rt, long gen) {
    try {
      applyPairingCode(rt, gen, transport.beginPairing(rt.tenantId), true);
    } catch (RuntimeException e) {
      log.warn("Tenant {}: pairing refresh failed: {}", rt.tenantId, e.getMessage());
      handleClose(rt, DisconnectReason.transportFailure(e.getMessage()), gen);
    }
  }

  private void applyPairingCode(SessionRuntime rt, long gen, PairingCode code, boolean refresh) {
    Instant now = clock.instant();
    Instant expiresAt =
        code.expiresAt() != null ? code.expiresAt() : now.plus(props.pairingTtl());
    SessionStatus expected = refresh ? SessionStatus.QR_PENDING : SessionStatus.CONNECTING;
    locked(
        rt,
        () -> {
          if (rt.generation != gen || rt.state.status() != expected) {
            log.debug("Tenant {}: discarding pairing code, session moved on", rt.tenantId);
            return;
          }
          rt.cancelPairing();
          transition(
              rt, rt.state.withStatus(SessionStatus.QR_PENDING).withPairing(code.code(), expiresAt));
          Map<String, Object> payload = new LinkedHashMap<>();
          payload.put("code", code.code());
          payload.put("expiresAt", expiresAt.toString());
          fanout.notify(rt.tenantId, EventKind.PAIRING_TOKEN, payload);

          Duration ttl = Duration.between(now, expiresAt);
          if (ttl.compareTo(MIN_PAIRING_REFRESH) < 0) {
            ttl = MIN_PAIRING_REFRESH;
          }
          rt.pairingTimer = timers.schedule(() -> onPairingExpired(rt, gen), ttl);
        });
  }

  private void onPairingExpired(SessionRuntime rt, long gen) {
    boolean due =
        locked(rt, () -> rt.generation == gen && rt.state.status() == SessionStatus.QR_PENDING);
    if (!due) {
      return;
    }
    log.debug("Tenant {}: pairing code expired, requesting a new one", rt.tenantId);
    executor.execute(() -> requestNewPairingCode(rt, gen));
  }

  private void onConnectTimeout(SessionRuntime rt, long gen) {
    String tenantId = rt.tenantId;
    boolean timedOut =
        locked(
            rt,
            () -> {
              SessionStatus st = rt.state.status();
              if (rt.generation != gen
                  || (st != SessionStatus.CONNECTING && st != SessionStatus.QR_PENDING)) {
                return false;
              }
              log.warn("Tenant {}: not connected within {}", tenantId, props.connectTimeout());
              fail(rt, REASON_CONNECT_TIMEOUT);
              return true;
            });
    if (timedOut) {
      executor.execute(() -> disconnectTransportQuietly(tenantId));
    }
  }

  private void handleClose(SessionRuntime rt, DisconnectReason reason, long gen) {
    String tenantId = rt.tenantId;
    locked(
        rt,
        () -> {
          if (gen != ANY_GENERATION && gen != rt.generation) {
            log.debug("Tenant {}: ignoring close from an older attempt", tenantId);
            return;
          }
          SessionState s = rt.state;
          if (s.manual() || s.status() == SessionStatus.ERROR) {
            log.debug("Tenant {}: ignoring close {} in {}", tenantId, reason.kind(), s.status());
            return;
          }
          if (!reason.recoverable()) {
            log.warn("Tenant {}: channel rejected credentials ({}), re-pairing required", tenantId, reason.kind());
            credentialStore.delete(tenantId);
            sessionStore.updateCredentialsRef(tenantId, null);
            fail(rt, reason.kind().name());
            return;
          }
          if (s.status() == SessionStatus.DISCONNECTED || rt.reconnectPending()) {
            log.debug("Tenant {}: duplicate close {} ignored", tenantId, reason.kind());
            return;
          }

          int attempt = s.attempts() + 1;
          Optional<Duration> delay = policy.delayFor(attempt);
          if (delay.isEmpty()) {
            log.warn("Tenant {}: giving up after {} reconnect attempts", tenantId, policy.maxAttempts());
            rt.state = rt.state.withAttempts(attempt);
            fail(rt, REASON_MAX_ATTEMPTS);
            return;
          }
          rt.cancelConnectTimeout();
          rt.cancelPairing();
          transition(
              rt,
              s.withStatus(SessionStatus.DISCONNECTED)
                  .withAttempts(attempt)
                  .withReason(reason.kind().name())
                  .withoutPairing());
          rt.reconnectTimer = timers.schedule(() -> initialize(tenantId, "reconnect"), delay.get());
          log.info(
              "Tenant {}: disconnected ({}), reconnect attempt {} in {}",
              tenantId,
              reason.kind(),
              attempt,
              delay.get());
        });
  }

  private void fail(SessionRuntime rt, String reason) {
    rt.cancelAllTimers();
    transition(rt, rt.state.withStatus(SessionStatus.ERROR).withReason(reason).withoutPairing());
    fanout.notify(rt.tenantId, EventKind.CONNECTION_ERROR, Map.of("reason", reason));
  }

  private void transition(SessionRuntime rt, SessionState next) {
    SessionState previous = rt.state;
    rt.state = next;
    try {
      sessionStore.save(rt.tenantId, next);
      rt.persisted = true;
    } catch (RuntimeException e) {
      log.error("Tenant {}: failed to persist session state {}", rt.tenantId, next.status(), e);
    }
    if (previous.status() != next.status()) {
      log.info("Tenant {}: {} -> {}", rt.tenantId, previous.status(), next.status());
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("status", next.status().name());
    payload.put("reconnectAttempts", next.attempts());
    if (next.lastReason() != null) {
      payload.put("reason", next.lastReason());
    }
    fanout.notify(rt.tenantId, EventKind.SESSION_STATUS, payload);
    if (next.status() != SessionStatus.CONNECTING) {
      rt.settle(next.status());
    }
  }

  private void disconnectTransportQuietly(String tenantId) {
    try {
      transport.disconnect(tenantId);
    } catch (RuntimeException e) {
      log.warn("Tenant {}: transport disconnect failed: {}", tenantId, e.getMessage());
    }
  }

  private SessionSnapshot snapshot(SessionRuntime rt) {
    SessionState s = locked(rt, () -> rt.state);
    return new SessionSnapshot(
        rt.tenantId,
        props.name(),
        s.status(),
        s.attempts(),
        s.lastReason(),
        s.manual(),
        s.pairingCode(),
        s.pairingExpiresAt(),
        s.status() == SessionStatus.CONNECTED);
  }

  /** Loads or creates the runtime of a session that is about to be started. */
  private SessionRuntime startingRuntime(String tenantId) {
    SessionRuntime cached = runtimes.get(tenantId);
    if (cached != null) {
      return cached;
    }
    Optional<SessionState> stored = sessionStore.find(tenantId);
    SessionRuntime rt = new SessionRuntime(tenantId, stored.orElseGet(SessionState::initial));
    rt.persisted = stored.isPresent();
    SessionRuntime raced = runtimes.putIfAbsent(tenantId, rt);
    return raced != null ? raced : rt;
  }

  /** Runtime of a session that was started here or has a stored row; never creates one. */
  private Optional<SessionRuntime> knownRuntime(String tenantId) {
    SessionRuntime cached = runtimes.get(tenantId);
    if (cached != null) {
      return Optional.of(cached);
    }
    Optional<SessionState> stored = sessionStore.find(tenantId);
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    SessionRuntime rt = new SessionRuntime(tenantId, stored.get());
    rt.persisted = true;
    SessionRuntime raced = runtimes.putIfAbsent(tenantId, rt);
    return Optional.of(raced != null ? raced : rt);
  }

  private Optional<SessionRuntime> eventRuntime(String tenantId, String event) {
    Optional<SessionRuntime> rt = knownRuntime(tenantId);
    if (rt.isEmpty()) {
      log.warn("Tenant {}: ignoring transport {} event for an unknown session", tenantId, event);
    }
    return rt;
  }

  private SessionRuntime existingRuntime(String tenantId) {
    return knownRuntime(tenantId)
        .filter(rt -> rt.persisted)
        .orElseThrow(() -> new NotFoundException("Channel session", tenantId));
  }

  private static <T> T locked(SessionRuntime rt, Supplier<T> action) {
    rt.lock.lock();
    try {
      return action.get();
    } finally {
      rt.lock.unlock();
    }
  }

  private static void locked(SessionRuntime rt, Runnable action) {
    rt.lock.lock();
    try {
      action.run();
    } finally {
      rt.lock.unlock();
    }
  }
}
