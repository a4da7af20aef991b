package com.flowdesk.chatbotcore.flow.response;

/** One selectable entry; {@code index} is 1-based display position. */
public record OptionItem(int index, String text, String payload) {}
