package com.flowdesk.chatbotcore.flow.response;

public record TextBlock(String text) implements ResponseBlock {}
