package com.flowdesk.chatbotcore.config;

import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the channel runtime.
 *
 * <p>{@code taskScheduler} drives both {@code @Scheduled} sweeps and per-session timers.
 * Blocking transport calls go to {@code channelExecutor} so one slow tenant never holds a
 * scheduler thread.
 */
@Configuration
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(
      @Value("${channel.scheduler.pool-size:4}") int poolSize) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("channel-timer-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean(name = "channelExecutor")
  public ThreadPoolTaskExecutor channelExecutor(
      @Value("${channel.executor.core-size:4}") int coreSize,
      @Value("${channel.executor.max-size:16}") int maxSize,
      @Value("${channel.executor.queue-capacity:500}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(coreSize);
    executor.setMaxPoolSize(maxSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("channel-io-");
    return executor;
  }
}
