package com.flowdesk.chatbotcore.channel.transport;

/** Receiver of asynchronous transport events. */
public interface ChannelEventSink {

  /** The pairing code was scanned; authentication is in progress. */
  void onConnecting(String tenantId);

  void onCredentials(String tenantId, String credentials);

  void onOpened(String tenantId);

  void onClosed(String tenantId, DisconnectReason reason);

  void onMessage(String tenantId, String contactAddress, String text);
}
