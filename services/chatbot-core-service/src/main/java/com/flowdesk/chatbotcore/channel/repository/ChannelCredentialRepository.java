package com.flowdesk.chatbotcore.channel.repository;

import com.flowdesk.chatbotcore.channel.domain.ChannelCredentialEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface ChannelCredentialRepository extends JpaRepository<ChannelCredentialEntity, Long> {

  Optional<ChannelCredentialEntity> findByTenantId(String tenantId);

  @Modifying
  @Query("delete from ChannelCredentialEntity c where c.tenantId = ?1")
  int deleteByTenant(String tenantId);
}
