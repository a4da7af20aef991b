package com.flowdesk.chatbotcore.conversation.repository;

import com.flowdesk.chatbotcore.conversation.domain.ConversationEntity;
import com.flowdesk.chatbotcore.conversation.domain.ConversationStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {

  Optional<ConversationEntity> findFirstByTenantIdAndContactAddressAndStatusInOrderByCreatedAtDesc(
      String tenantId, String contactAddress, Collection<ConversationStatus> statuses);

  List<ConversationEntity> findByStatusAndLastActivityAtBeforeOrderByLastActivityAtAsc(
      ConversationStatus status, Instant cutoff);
}
