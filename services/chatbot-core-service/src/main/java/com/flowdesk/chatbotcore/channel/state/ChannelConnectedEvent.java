package com.flowdesk.chatbotcore.channel.state;

/** In-process signal that a tenant session reached CONNECTED. */
public record ChannelConnectedEvent(String tenantId) {}
