package com.flowdesk.chatbotcore.graph.repository;

import com.flowdesk.chatbotcore.graph.domain.FlowGraphEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FlowGraphRepository extends JpaRepository<FlowGraphEntity, Long> {

  Optional<FlowGraphEntity> findFirstByTenantIdAndActiveTrueOrderByIdAsc(String tenantId);
}
