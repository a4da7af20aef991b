package com.flowdesk.chatbotcore.events;

import java.util.Map;

/** Outbound notification sink for dashboards and other tenant-facing consumers. */
public interface SessionEventPublisher {

  void publish(String tenantId, EventKind kind, Map<String, Object> payload);
}
