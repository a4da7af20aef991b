package com.flowdesk.chatbotcore.flow.response;

/** One unit of a bot reply; the dispatcher maps each block to one transport message. */
public interface ResponseBlock {}
