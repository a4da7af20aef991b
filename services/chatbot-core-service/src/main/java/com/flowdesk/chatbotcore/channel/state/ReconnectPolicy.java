package com.flowdesk.chatbotcore.channel.state;

import com.flowdesk.chatbotcore.config.ChannelProperties;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class ReconnectPolicy {

  private final List<Duration> delays;

  public ReconnectPolicy(ChannelProperties props) {
    this.delays = props.reconnectDelays();
  }

  /** Delay before the given 1-based attempt, or empty once the schedule is exhausted. */
  public Optional<Duration> delayFor(int attempt) {
    if (attempt < 1 || attempt > delays.size()) {
      return Optional.empty();
    }
    return Optional.of(delays.get(attempt - 1));
  }

  public int maxAttempts() {
    return delays.size();
  }
}
