package com.flowdesk.chatbotcore.channel.api;

import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.channel.state.SessionSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenants/{tenantId}/channel")
@RequiredArgsConstructor
public class ChannelSessionController {

  private final ConnectionManager connections;

  @GetMapping("/session")
  public SessionSnapshot session(@PathVariable String tenantId) {
    return connections.getSessionStatus(tenantId);
  }

  @PostMapping("/connect")
  public SessionSnapshot connect(@PathVariable String tenantId) {
    return connections.connect(tenantId);
  }

  @PostMapping("/disconnect")
  public SessionSnapshot disconnect(@PathVariable String tenantId) {
    return connections.disconnect(tenantId);
  }

  @PostMapping("/pairing")
  public SessionSnapshot refreshPairing(@PathVariable String tenantId) {
    return connections.refreshPairing(tenantId);
  }
}
