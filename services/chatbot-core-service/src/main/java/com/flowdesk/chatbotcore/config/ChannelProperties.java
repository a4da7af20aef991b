package com.flowdesk.chatbotcore.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection lifecycle tuning for the tenant messaging channel.
 *
 * <p>{@code reconnectDelays} is the backoff schedule: entry {@code n-1} is the delay before
 * reconnect attempt {@code n}; its size is the attempt cap.
 */
@ConfigurationProperties(prefix = "channel")
public record ChannelProperties(
    String name,
    List<Duration> reconnectDelays,
    Duration connectTimeout,
    Duration pairingTtl,
    Duration initWait) {

  public ChannelProperties {
    if (name == null || name.isBlank()) {
      name = "whatsapp";
    }
    if (reconnectDelays == null || reconnectDelays.isEmpty()) {
      reconnectDelays =
          List.of(
              Duration.ofSeconds(5),
              Duration.ofSeconds(10),
              Duration.ofSeconds(20),
              Duration.ofSeconds(30),
              Duration.ofSeconds(60));
    } else {
      reconnectDelays = List.copyOf(reconnectDelays);
    }
    if (connectTimeout == null) {
      connectTimeout = Duration.ofMinutes(5);
    }
    if (pairingTtl == null) {
      pairingTtl = Duration.ofSeconds(60);
    }
    if (initWait == null) {
      initWait = Duration.ofSeconds(15);
    }
  }

  public static ChannelProperties defaults() {
    return new ChannelProperties(null, null, null, null, null);
  }
}
