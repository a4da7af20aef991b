package com.flowdesk.chatbotcore.flow.response;

public record NoticeBlock(String text) implements ResponseBlock {}
