package com.flowdesk.chatbotcore.conversation.service;

import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Finds idle conversations on the scheduler thread and closes each one on {@code
 * channelExecutor}, so closing notices never hold up session timers.
 */
@Component
@Slf4j
public class InactivityReaper {

  private final ConversationStateStore store;
  private final ConversationCloser closer;
  private final Executor executor;
  private final Clock clock;
  private final Duration threshold;

  public InactivityReaper(
      ConversationStateStore store,
      ConversationCloser closer,
      @Qualifier("channelExecutor") Executor executor,
      Clock clock,
      @Value("${conversation.inactivity.threshold:PT2M}") Duration threshold) {
    this.store = store;
    this.closer = closer;
    this.executor = executor;
    this.clock = clock;
    this.threshold = threshold;
  }

  @Scheduled(
      fixedDelayString = "${conversation.inactivity.sweep-interval:PT30S}",
      initialDelayString = "${conversation.inactivity.sweep-interval:PT30S}")
  public void scheduledSweep() {
    try {
      sweep()
          .whenComplete(
              (closed, e) -> {
                if (e != null) {
                  log.error("Inactivity sweep failed", e);
                } else if (closed > 0) {
                  log.info("Closed {} idle conversation(s)", closed);
                }
              });
    } catch (RuntimeException e) {
      log.error("Inactivity sweep failed", e);
    }
  }

  /** Starts closing every idle conversation; completes with the number closed. */
  public CompletableFuture<Integer> sweep() {
    Instant cutoff = clock.instant().minus(threshold);
    List<Conversation> idle = store.findIdle(cutoff);
    List<CompletableFuture<Boolean>> closes =
        idle.stream()
            .map(c -> CompletableFuture.supplyAsync(() -> closeQuietly(c, cutoff), executor))
            .toList();
    return CompletableFuture.allOf(closes.toArray(new CompletableFuture[0]))
        .thenApply(v -> (int) closes.stream().filter(CompletableFuture::join).count());
  }

  private boolean closeQuietly(Conversation c, Instant cutoff) {
    try {
      return closer.closeIdle(c, cutoff);
    } catch (RuntimeException e) {
      log.warn("Failed to close idle conversation {}: {}", c.id(), e.getMessage());
      return false;
    }
  }
}
