package com.flowdesk.chatbotcore.channel.repository;

import com.flowdesk.chatbotcore.channel.domain.ChannelSessionEntity;
import com.flowdesk.chatbotcore.channel.domain.SessionStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface ChannelSessionRepository extends JpaRepository<ChannelSessionEntity, Long> {

  Optional<ChannelSessionEntity> findByTenantId(String tenantId);

  List<ChannelSessionEntity> findByStatusAndManualDisconnectFalse(SessionStatus status);

  @Modifying
  @Query(
      "update ChannelSessionEntity s set s.status = ?2, s.lastDisconnectReason = ?3, s.pairingCode = null, s.pairingExpiresAt = null where s.status in ?1")
  int resetStatuses(Collection<SessionStatus> from, SessionStatus to, String reason);
}
