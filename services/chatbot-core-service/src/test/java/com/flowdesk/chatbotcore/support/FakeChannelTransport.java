package com.flowdesk.chatbotcore.support;

import com.flowdesk.chatbotcore.channel.transport.ChannelTransport;
import com.flowdesk.chatbotcore.channel.transport.OutboundMessage;
import com.flowdesk.chatbotcore.channel.transport.PairingCode;
import com.flowdesk.chatbotcore.channel.transport.TransportCapabilities;
import com.flowdesk.chatbotcore.channel.transport.TransportException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

public class FakeChannelTransport implements ChannelTransport {

  public record Sent(String tenantId, String contactAddress, OutboundMessage message) {}

  public volatile TransportCapabilities capabilities = new TransportCapabilities(true, true, true, true);
  public volatile boolean live = true;
  public volatile Consumer<String> onResume = tenantId -> {};
  public final AtomicInteger failNextSends = new AtomicInteger();
  /** Once this many messages went out, every further send fails. Negative disables. */
  public volatile int failAfterSends = -1;

  public final AtomicInteger resumeCalls = new AtomicInteger();
  public final AtomicInteger pairingCalls = new AtomicInteger();
  public final AtomicInteger disconnectCalls = new AtomicInteger();
  public final AtomicInteger sendAttempts = new AtomicInteger();
  public final List<Sent> sent = new CopyOnWriteArrayList<>();

  @Override
  public TransportCapabilities capabilities() {
    return capabilities;
  }

  @Override
  public void resume(String tenantId, String credentials) {
    resumeCalls.incrementAndGet();
    onResume.accept(tenantId);
  }

  @Override
  public PairingCode beginPairing(String tenantId) {
    return new PairingCode("code-" + pairingCalls.incrementAndGet(), null);
  }

  @Override
  public boolean isLive(String tenantId) {
    return live;
  }

  @Override
  public String send(String tenantId, String contactAddress, OutboundMessage message) {
    int attempt = sendAttempts.incrementAndGet();
    if (failNextSends.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0
        || (failAfterSends >= 0 && sent.size() >= failAfterSends)) {
      throw new TransportException("simulated send failure");
    }
    sent.add(new Sent(tenantId, contactAddress, message));
    return "msg-" + attempt;
  }

  @Override
  public void disconnect(String tenantId) {
    disconnectCalls.incrementAndGet();
  }
}
