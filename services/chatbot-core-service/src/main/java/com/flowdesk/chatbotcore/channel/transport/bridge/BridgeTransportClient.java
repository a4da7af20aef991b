package com.flowdesk.chatbotcore.channel.transport.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowdesk.chatbotcore.channel.transport.ChannelTransport;
import com.flowdesk.chatbotcore.channel.transport.OutboundMessage;
import com.flowdesk.chatbotcore.channel.transport.PairingCode;
import com.flowdesk.chatbotcore.channel.transport.TransportCapabilities;
import com.flowdesk.chatbotcore.channel.transport.TransportException;
import com.flowdesk.chatbotcore.config.BridgeProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ChannelTransport} backed by the bridge sidecar. Connection progress arrives later on
 * {@link BridgeWebhookController}; the calls here only start, check and stop sessions.
 */
@Service
@Slf4j
public class BridgeTransportClient implements ChannelTransport {

  private final RestClient rest;
  private final TransportCapabilities capabilities;
  private final Clock clock;

  public BridgeTransportClient(RestClient bridgeRestClient, BridgeProperties props, Clock clock) {
    this.rest = bridgeRestClient;
    this.capabilities = new TransportCapabilities(true, true, props.buttons(), props.media());
    this.clock = clock;
  }

  @Override
  public TransportCapabilities capabilities() {
    return capabilities;
  }

  @Override
  public void resume(String tenantId, String credentials) {
    try {
      rest.post()
          .uri("/sessions/{tenantId}/start", tenantId)
          .body(Map.of("credentials", credentials))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException e) {
      throw new TransportException("Bridge start failed for tenant " + tenantId, e);
    }
  }

  @Override
  public PairingCode beginPairing(String tenantId) {
    JsonNode body;
    try {
      body =
          rest.post()
              .uri("/sessions/{tenantId}/pairing", tenantId)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      throw new TransportException("Bridge pairing failed for tenant " + tenantId, e);
    }
    String code = body == null ? null : body.path("code").asText(null);
    if (code == null || code.isBlank()) {
      throw new TransportException("Bridge returned no pairing code for tenant " + tenantId);
    }
    long ttlSeconds = body.path("expiresInSeconds").asLong(0);
    Instant expiresAt = ttlSeconds > 0 ? clock.instant().plusSeconds(ttlSeconds) : null;
    return new PairingCode(code, expiresAt);
  }

  @Override
  public boolean isLive(String tenantId) {
    try {
      JsonNode body =
          rest.get().uri("/sessions/{tenantId}/health", tenantId).retrieve().body(JsonNode.class);
      return body != null && body.path("live").asBoolean(false);
    } catch (RestClientException e) {
      throw new TransportException("Bridge health check failed for tenant " + tenantId, e);
    }
  }

  @Override
  public String send(String tenantId, String contactAddress, OutboundMessage message) {
    Map<String, Object> body = new HashMap<>();
    body.put("to", contactAddress);
    if (message instanceof OutboundMessage.Text text) {
      body.put("type", "text");
      body.put("text", text.text());
    } else if (message instanceof OutboundMessage.Buttons buttons) {
      body.put("type", "buttons");
      body.put("text", buttons.text());
      List<Map<String, String>> items =
          buttons.buttons().stream()
              .map(b -> Map.of("id", b.id(), "title", b.title()))
              .toList();
      body.put("buttons", items);
    } else if (message instanceof OutboundMessage.Media media) {
      body.put("type", "media");
      body.put("url", media.url());
      if (media.mimeType() != null) {
        body.put("mimeType", media.mimeType());
      }
      if (media.caption() != null) {
        body.put("caption", media.caption());
      }
    } else {
      throw new IllegalArgumentException("Unsupported message " + message);
    }

    try {
      JsonNode resp =
          rest.post()
              .uri("/sessions/{tenantId}/messages", tenantId)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
      return resp == null ? null : resp.path("messageId").asText(null);
    } catch (RestClientException e) {
      throw new TransportException("Bridge send failed for tenant " + tenantId, e);
    }
  }

  @Override
  public void disconnect(String tenantId) {
    try {
      rest.delete().uri("/sessions/{tenantId}", tenantId).retrieve().toBodilessEntity();
    } catch (RestClientException e) {
      throw new TransportException("Bridge disconnect failed for tenant " + tenantId, e);
    }
  }
}
