package com.flowdesk.chatbotcore.conversation.service;

import com.flowdesk.chatbotcore.common.web.NotFoundException;
import com.flowdesk.chatbotcore.conversation.domain.CloseReason;
import com.flowdesk.chatbotcore.conversation.domain.Conversation;
import com.flowdesk.chatbotcore.conversation.domain.ConversationEntity;
import com.flowdesk.chatbotcore.conversation.domain.ConversationStatus;
import com.flowdesk.chatbotcore.conversation.repository.ConversationRepository;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaConversationStateStore implements ConversationStateStore {

  private static final EnumSet<ConversationStatus> OPEN =
      EnumSet.of(ConversationStatus.ACTIVE, ConversationStatus.PAUSED, ConversationStatus.ESCALATED);

  private final ConversationRepository repo;

  @Override
  @Transactional(readOnly = true)
  public Optional<Conversation> find(String conversationId) {
    return repo.findById(conversationId).map(ConversationEntity::toView);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Conversation> findOpen(String tenantId, String contactAddress) {
    return repo.findFirstByTenantIdAndContactAddressAndStatusInOrderByCreatedAtDesc(
            tenantId, contactAddress, OPEN)
        .map(ConversationEntity::toView);
  }

  @Override
  @Transactional
  public Conversation start(
      String tenantId, String contactAddress, Long graphId, Long startNodeId, Instant at) {
    ConversationEntity saved =
        repo.save(new ConversationEntity(tenantId, contactAddress, graphId, startNodeId, at));
    log.info("Started conversation {} for tenant {} contact {}", saved.getId(), tenantId, contactAddress);
    return saved.toView();
  }

  @Override
  @Transactional
  public Conversation advance(String conversationId, Long nextNodeId, boolean escalated, Instant at) {
    ConversationEntity c = load(conversationId);
    if (nextNodeId != null) {
      c.moveTo(nextNodeId);
    }
    if (escalated) {
      c.escalate();
      log.info("Conversation {} escalated to a human operator", conversationId);
    }
    c.touch(at);
    return c.toView();
  }

  @Override
  @Transactional
  public void touch(String conversationId, Instant at) {
    load(conversationId).touch(at);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Conversation> findIdle(Instant cutoff) {
    return repo
        .findByStatusAndLastActivityAtBeforeOrderByLastActivityAtAsc(ConversationStatus.ACTIVE, cutoff)
        .stream()
        .map(ConversationEntity::toView)
        .toList();
  }

  @Override
  @Transactional
  public Optional<Conversation> finish(String conversationId, CloseReason reason, Instant at) {
    Optional<ConversationEntity> found = repo.findById(conversationId);
    if (found.isEmpty() || found.get().getStatus() == ConversationStatus.FINISHED) {
      return Optional.empty();
    }
    ConversationEntity c = found.get();
    c.finish(reason, at);
    return Optional.of(c.toView());
  }

  private ConversationEntity load(String conversationId) {
    return repo
        .findById(conversationId)
        .orElseThrow(() -> new NotFoundException("Conversation", conversationId));
  }
}
