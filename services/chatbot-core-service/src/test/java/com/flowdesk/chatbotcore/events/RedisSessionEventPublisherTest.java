package com.flowdesk.chatbotcore.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;

@ExtendWith(MockitoExtension.class)
class RedisSessionEventPublisherTest {

  @Mock StringRedisTemplate redis;

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void publishesEnvelopeOnTenantChannel() throws Exception {
    new RedisSessionEventPublisher(redis, mapper)
        .publish("tenant-1", EventKind.PAIRING_TOKEN, Map.of("code", "abc"));

    ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    verify(redis).convertAndSend(eq("flowdesk:tenant:tenant-1:events"), json.capture());
    JsonNode envelope = mapper.readTree(json.getValue());
    assertThat(envelope.get("event").asText()).isEqualTo("PAIRING_TOKEN");
    assertThat(envelope.get("tenantId").asText()).isEqualTo("tenant-1");
    assertThat(envelope.at("/payload/code").asText()).isEqualTo("abc");
  }

  @Test
  void fanoutSwallowsPublisherFailures() {
    doThrow(new IllegalStateException("redis down")).when(redis).convertAndSend(anyString(), anyString());
    EventFanout fanout = new EventFanout(new RedisSessionEventPublisher(redis, mapper));

    fanout.notify("tenant-1", EventKind.SESSION_STATUS, Map.of("status", "CONNECTED"));

    verify(redis).convertAndSend(eq(RedisSessionEventPublisher.channelFor("tenant-1")), anyString());
  }
}
