package com.flowdesk.chatbotcore.events;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Fire-and-forget front of {@link SessionEventPublisher}: publisher failures are only logged. */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventFanout {

  private final SessionEventPublisher publisher;

  public void notify(String tenantId, EventKind kind, Map<String, Object> payload) {
    try {
      publisher.publish(tenantId, kind, payload == null ? Map.of() : payload);
    } catch (Exception e) {
      log.warn("Failed to publish {} for tenant {}: {}", kind, tenantId, e.getMessage());
    }
  }
}
