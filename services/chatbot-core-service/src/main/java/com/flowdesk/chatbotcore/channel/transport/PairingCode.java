package com.flowdesk.chatbotcore.channel.transport;

import java.time.Instant;

/** A pairing token to be scanned on the contact device; {@code expiresAt} may be null. */
public record PairingCode(String code, Instant expiresAt) {}
