package com.flowdesk.chatbotcore.channel.transport.bridge;

import jakarta.validation.constraints.NotBlank;

/**
 * Event pushed by the bridge. {@code type} is one of {@code connecting}, {@code credentials},
 * {@code open}, {@code close}, {@code message}; the other fields are filled per type.
 */
public record BridgeEvent(
    @NotBlank String type,
    @NotBlank String tenantId,
    String from,
    String text,
    String credentials,
    Integer statusCode,
    String detail) {}
