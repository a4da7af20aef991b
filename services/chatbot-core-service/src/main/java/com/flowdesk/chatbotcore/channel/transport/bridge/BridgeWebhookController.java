package com.flowdesk.chatbotcore.channel.transport.bridge;

import com.flowdesk.chatbotcore.channel.transport.ChannelEventSink;
import com.flowdesk.chatbotcore.channel.transport.DisconnectReason;
import com.flowdesk.chatbotcore.config.BridgeProperties;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Receives connection and message events from the bridge sidecar. */
@RestController
@RequestMapping("/channel/bridge")
@Slf4j
public class BridgeWebhookController {

  private final ChannelEventSink sink;
  private final String secret;

  public BridgeWebhookController(ChannelEventSink sink, BridgeProperties props) {
    this.sink = sink;
    this.secret = props.webhookSecret();
  }

  @PostMapping("/events")
  public ResponseEntity<Map<String, Object>> events(
      @Valid @RequestBody BridgeEvent event,
      @RequestHeader(value = "X-Bridge-Secret", required = false) String headerSecret) {

    if (!secret.isBlank() && (headerSecret == null || !secret.equals(headerSecret))) {
      log.warn("Bridge webhook secret mismatch");
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("ok", false));
    }

    String tenantId = event.tenantId();
    switch (event.type().trim().toLowerCase(Locale.ROOT)) {
      case "connecting" -> sink.onConnecting(tenantId);
      case "credentials" -> {
        if (event.credentials() == null || event.credentials().isBlank()) {
          return ResponseEntity.ok(Map.of("ok", true, "ignored", "no_credentials"));
        }
        sink.onCredentials(tenantId, event.credentials());
      }
      case "open" -> sink.onOpened(tenantId);
      case "close" -> sink.onClosed(
          tenantId, DisconnectReason.fromStatusCode(event.statusCode(), event.detail()));
      case "message" -> {
        if (event.from() == null || event.text() == null || event.text().isBlank()) {
          return ResponseEntity.ok(Map.of("ok", true, "ignored", "no_text"));
        }
        sink.onMessage(tenantId, event.from(), event.text());
      }
      default -> {
        log.debug("Unknown bridge event type {}", event.type());
        return ResponseEntity.ok(Map.of("ok", true, "ignored", "unknown_type"));
      }
    }
    return ResponseEntity.ok(Map.of("ok", true));
  }
}
