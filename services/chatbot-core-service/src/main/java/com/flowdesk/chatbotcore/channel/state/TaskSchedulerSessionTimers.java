package com.flowdesk.chatbotcore.channel.state;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class TaskSchedulerSessionTimers implements SessionTimers {

  private final TaskScheduler scheduler;
  private final Clock clock;

  @Override
  public Handle schedule(Runnable task, Duration delay) {
    AtomicBoolean started = new AtomicBoolean(false);
    ScheduledFuture<?> future =
        scheduler.schedule(
            () -> {
              started.set(true);
              try {
                task.run();
              } catch (RuntimeException e) {
                log.error("Session timer task failed", e);
              }
            },
            clock.instant().plus(delay));
    return new Handle() {
      @Override
      public void cancel() {
        future.cancel(false);
      }

      @Override
      public boolean isPending() {
        return !started.get() && !future.isDone();
      }
    };
  }
}
