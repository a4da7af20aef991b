package com.flowdesk.chatbotcore.pending;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface PendingResponseRepository extends JpaRepository<PendingResponseEntity, Long> {

  boolean existsByConversationIdAndStatusIn(String conversationId, Collection<PendingStatus> statuses);

  Optional<PendingResponseEntity> findFirstByConversationIdAndStatus(
      String conversationId, PendingStatus status);

  boolean existsByTenantIdAndStatus(String tenantId, PendingStatus status);

  List<PendingResponseEntity> findByTenantIdAndStatusOrderByEnqueuedAtAsc(
      String tenantId, PendingStatus status);

  @Query("select distinct p.tenantId from PendingResponseEntity p where p.status = ?1")
  List<String> findTenantIdsByStatus(PendingStatus status);

  @Modifying
  @Query("update PendingResponseEntity p set p.status = ?2 where p.status = ?1")
  int updateStatus(PendingStatus from, PendingStatus to);
}
