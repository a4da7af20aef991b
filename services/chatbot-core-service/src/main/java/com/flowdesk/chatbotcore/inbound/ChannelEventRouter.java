package com.flowdesk.chatbotcore.inbound;

import com.flowdesk.chatbotcore.channel.state.ConnectionManager;
import com.flowdesk.chatbotcore.channel.transport.ChannelEventSink;
import com.flowdesk.chatbotcore.channel.transport.DisconnectReason;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Routes transport connection events to the state machine and messages to the flow. */
@Component
@RequiredArgsConstructor
public class ChannelEventRouter implements ChannelEventSink {

  private final ConnectionManager connections;
  private final InboundMessageService inbound;

  @Override
  public void onConnecting(String tenantId) {
    connections.onConnecting(tenantId);
  }

  @Override
  public void onCredentials(String tenantId, String credentials) {
    connections.onCredentials(tenantId, credentials);
  }

  @Override
  public void onOpened(String tenantId) {
    connections.onOpened(tenantId);
  }

  @Override
  public void onClosed(String tenantId, DisconnectReason reason) {
    connections.onClosed(tenantId, reason);
  }

  @Override
  public void onMessage(String tenantId, String contactAddress, String text) {
    inbound.onInboundMessage(tenantId, contactAddress, text);
  }
}
