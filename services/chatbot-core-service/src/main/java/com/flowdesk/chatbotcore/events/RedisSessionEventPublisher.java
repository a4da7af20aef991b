package com.flowdesk.chatbotcore.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Publishes JSON envelopes to {@code flowdesk:tenant:<tenantId>:events}. */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "events.redis.enabled", havingValue = "true")
public class RedisSessionEventPublisher implements SessionEventPublisher {

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;

  static String channelFor(String tenantId) {
    return "flowdesk:tenant:" + tenantId + ":events";
  }

  @Override
  public void publish(String tenantId, EventKind kind, Map<String, Object> payload) {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("tenantId", tenantId);
    envelope.put("event", kind.name());
    envelope.put("payload", payload);
    envelope.put("timestamp", Instant.now().toString());
    String json;
    try {
      json = objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize event " + kind, e);
    }
    redis.convertAndSend(channelFor(tenantId), json);
  }
}
