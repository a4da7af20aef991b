package com.flowdesk.chatbotcore.flow.response;

public record MediaBlock(String url, String mimeType, String caption) implements ResponseBlock {}
