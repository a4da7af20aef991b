package com.flowdesk.chatbotcore.conversation.api;

import com.flowdesk.chatbotcore.conversation.domain.CloseReason;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.service.ConversationCloser;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationAdminController {

  private final ConversationCloser closer;

  public record CloseRequest(CloseReason reason) {}

  @PostMapping("/{id}/close")
  public Conversation close(
      @PathVariable("id") String id, @RequestBody(required = false) CloseRequest request) {
    return closer.closeConversation(id, request == null ? null : request.reason());
  }
}
