package com.flowdesk.chatbotcore.inbound.api;

import com.flowdesk.chatbotcore.inbound.InboundMessageService;
import com.flowdesk.chatbotcore.inbound.InboundResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local testing endpoint.
 *
 * <p>Feeds a contact message into the flow without a bridge. Enabled only with
 * dev.channel.enabled=true.
 */
@RestController
@RequestMapping("/dev/channel")
@ConditionalOnProperty(name = "dev.channel.enabled", havingValue = "true")
public class DevChannelController {

  private final InboundMessageService inbound;

  public DevChannelController(InboundMessageService inbound) {
    this.inbound = inbound;
  }

  public record DevMessageRequest(
      @NotBlank String tenantId, @NotBlank String contactAddress, @NotBlank String text) {}

  @PostMapping("/message")
  public Map<String, Object> message(@Valid @RequestBody DevMessageRequest req) {
    InboundResult result = inbound.onInboundMessage(req.tenantId(), req.contactAddress(), req.text());
    return Map.of("ok", true, "result", result.name());
  }
}
