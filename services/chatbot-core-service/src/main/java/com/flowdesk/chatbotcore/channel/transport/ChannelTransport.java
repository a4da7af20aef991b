package com.flowdesk.chatbotcore.channel.transport;

/**
 * Connection to the external messaging network, one logical session per tenant.
 *
 * <p>Calls may block on network I/O and throw {@link TransportException}. Connection progress
 * (scan, credentials, open, close) and inbound messages are reported asynchronously through
 * {@link ChannelEventSink}.
 */
public interface ChannelTransport {

  TransportCapabilities capabilities();

  /** Starts the session with previously stored credentials. */
  void resume(String tenantId, String credentials);

  /**
   * Starts an unauthenticated session and returns a fresh pairing code. Only valid when {@link
   * TransportCapabilities#pairing()} is set.
   */
  PairingCode beginPairing(String tenantId);

  boolean isLive(String tenantId);

  /** Returns the network message id. */
  String send(String tenantId, String contactAddress, OutboundMessage message);

  void disconnect(String tenantId);
}
