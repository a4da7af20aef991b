package com.flowdesk.chatbotcore.dispatch;

import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.channel.transport.ChannelTransport;
import com.flowdesk.chatbotcore.channel.transport.OutboundMessage;
import com.flowdesk.chatbotcore.channel.transport.TransportCapabilities;
import com.flowdesk.chatbotcore.channel.transport.TransportException;
import com.flowdesk.chatbotcore.flow.response.BotResponse;
import com.flowdesk.chatbotcore.flow.response.MediaBlock;
import com.flowdesk.chatbotcore.flow.response.NoticeBlock;
import com.flowdesk.chatbotcore.flow.response.OptionItem;
import com.flowdesk.chatbotcore.flow.response.OptionsBlock;
import com.flowdesk.chatbotcore.flow.response.ResponseBlock;
import com.flowdesk.chatbotcore.flow.response.TextBlock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Sends a {@link BotResponse} over the tenant channel, one transport message per block.
 *
 * <p>Each message is retried up to {@code channel.dispatch.max-attempts}; liveness is checked
 * before the first message and between retries.
 */
@Service
@Slf4j
public class ResponseDispatcher {

  /** Interactive button messages carry at most this many buttons. */
  static final int MAX_BUTTONS = 3;

  private final ChannelTransport transport;
  private final ConnectionManager connections;
  private final ContactAddressPolicy addressPolicy;
  private final int maxAttempts;
  private final Duration retryBackoff;

  public ResponseDispatcher(
      ChannelTransport transport,
      ConnectionManager connections,
      ContactAddressPolicy addressPolicy,
      @Value("${channel.dispatch.max-attempts:3}") int maxAttempts,
      @Value("${channel.dispatch.retry-backoff:PT2S}") Duration retryBackoff) {
    this.transport = transport;
    this.connections = connections;
    this.addressPolicy = addressPolicy;
    this.maxAttempts = Math.max(1, maxAttempts);
    this.retryBackoff = retryBackoff;
  }

  public DispatchResult dispatch(String tenantId, String contactAddress, BotResponse response) {
    if (!addressPolicy.isIndividual(contactAddress)) {
      log.warn("Tenant {}: refusing to send to non-individual address {}", tenantId, contactAddress);
      return DispatchResult.rejected("address is a group or broadcast list");
    }
    if (response == null || response.isEmpty()) {
      return DispatchResult.sent(List.of());
    }
    if (!connections.isLive(tenantId)) {
      return DispatchResult.notLive(List.of());
    }

    List<OutboundMessage> messages = toMessages(response, transport.capabilities());
    List<String> ids = new ArrayList<>();
    int delivered = 0;
    for (OutboundMessage message : messages) {
      String lastError = null;
      boolean sent = false;
      for (int attempt = 1; attempt <= maxAttempts && !sent; attempt++) {
        try {
          String id = transport.send(tenantId, contactAddress, message);
          if (id != null) {
            ids.add(id);
          }
          sent = true;
        } catch (TransportException e) {
          lastError = e.getMessage();
          log.warn(
              "Tenant {}: send to {} failed (attempt {}/{}): {}",
              tenantId,
              contactAddress,
              attempt,
              maxAttempts,
              lastError);
          if (attempt < maxAttempts) {
            if (!pause()) {
              return DispatchResult.failed(ids, delivered, "interrupted");
            }
            if (!connections.isLive(tenantId)) {
              return DispatchResult.notLive(ids, delivered);
            }
          }
        }
      }
      if (!sent) {
        return DispatchResult.failed(ids, delivered, lastError);
      }
      delivered++;
    }
    return DispatchResult.sent(ids);
  }

  /** One message per block, in block order. */
  List<OutboundMessage> toMessages(BotResponse response, TransportCapabilities caps) {
    List<OutboundMessage> out = new ArrayList<>();
    for (ResponseBlock block : response.blocks()) {
      if (block instanceof TextBlock text) {
        out.add(new OutboundMessage.Text(text.text()));
      } else if (block instanceof NoticeBlock notice) {
        out.add(new OutboundMessage.Text(notice.text()));
      } else if (block instanceof OptionsBlock options) {
        out.add(optionsMessage(options, caps));
      } else if (block instanceof MediaBlock media) {
        if (caps.media()) {
          out.add(new OutboundMessage.Media(media.url(), media.mimeType(), media.caption()));
        } else {
          String caption = media.caption() == null || media.caption().isBlank() ? "" : media.caption() + "\n";
          out.add(new OutboundMessage.Text(caption + media.url()));
        }
      }
    }
    return out;
  }

  private static OutboundMessage optionsMessage(OptionsBlock options, TransportCapabilities caps) {
    String prompt = options.prompt() == null ? "" : options.prompt();
    if (caps.buttons() && !options.items().isEmpty() && options.items().size() <= MAX_BUTTONS) {
      List<OutboundMessage.Button> buttons =
          options.items().stream()
              .map(i -> new OutboundMessage.Button(i.payload(), i.text()))
              .toList();
      return new OutboundMessage.Buttons(prompt, buttons);
    }
    StringBuilder sb = new StringBuilder(prompt);
    for (OptionItem item : options.items()) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(item.index()).append(". ").append(item.text());
    }
    return new OutboundMessage.Text(sb.toString());
  }

  private boolean pause() {
    if (retryBackoff.isZero() || retryBackoff.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(retryBackoff.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
