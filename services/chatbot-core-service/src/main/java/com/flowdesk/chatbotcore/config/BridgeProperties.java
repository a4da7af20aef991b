package com.flowdesk.chatbotcore.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * HTTP bridge sidecar that holds the messaging-network sockets.
 *
 * @param webhookSecret expected {@code X-Bridge-Secret} on inbound events; blank disables the check
 * @param buttons the bridge can deliver interactive button messages
 * @param media the bridge can deliver media messages
 */
@ConfigurationProperties(prefix = "channel.bridge")
public record BridgeProperties(
    String baseUrl, String webhookSecret, Duration timeout, boolean buttons, boolean media) {

  public BridgeProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = "http://localhost:8090";
    }
    webhookSecret = webhookSecret == null ? "" : webhookSecret.trim();
    if (timeout == null) {
      timeout = Duration.ofSeconds(10);
    }
  }
}
