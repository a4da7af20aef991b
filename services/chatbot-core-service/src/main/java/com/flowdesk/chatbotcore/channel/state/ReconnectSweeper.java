package com.flowdesk.chatbotcore.channel.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReconnectSweeper {

  private final ConnectionManager connections;

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    connections.restoreAfterRestart();
    sweep();
  }

  @Scheduled(
      fixedDelayString = "${channel.reconnect.sweep-interval:PT30S}",
      initialDelayString = "${channel.reconnect.sweep-interval:PT30S}")
  public void sweep() {
    try {
      int started = connections.sweepDisconnected();
      if (started > 0) {
        log.info("Reconnect sweep started {} session(s)", started);
      }
    } catch (RuntimeException e) {
      log.error("Reconnect sweep failed", e);
    }
  }
}
