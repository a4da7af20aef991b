package com.flowdesk.chatbotcore.channel.transport;

/**
 * What a concrete transport supports beyond the required operations.
 *
 * @param pairing can issue pairing codes for unauthenticated sessions
 * @param liveness can report whether the underlying socket is still usable
 * @param buttons can send interactive button messages
 * @param media can send media attachments
 */
public record TransportCapabilities(
    boolean pairing, boolean liveness, boolean buttons, boolean media) {

  public static TransportCapabilities textOnly() {
    return new TransportCapabilities(false, false, false, false);
  }
}
