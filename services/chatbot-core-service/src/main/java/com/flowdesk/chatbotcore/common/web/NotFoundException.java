package com.flowdesk.chatbotcore.common.web;

/** 404 for an unknown tenant session or conversation, rendered by {@link ApiExceptionHandler}. */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String kind, Object id) {
    super(kind + " not found: " + id);
  }
}
