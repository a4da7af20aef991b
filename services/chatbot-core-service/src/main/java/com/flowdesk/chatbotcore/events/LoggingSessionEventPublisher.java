package com.flowdesk.chatbotcore.events;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(name = "events.redis.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingSessionEventPublisher implements SessionEventPublisher {

  @Override
  public void publish(String tenantId, EventKind kind, Map<String, Object> payload) {
    log.info("event tenant={} kind={} payload={}", tenantId, kind, payload);
  }
}
