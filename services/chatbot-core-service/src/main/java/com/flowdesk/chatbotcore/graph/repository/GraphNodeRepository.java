package com.flowdesk.chatbotcore.graph.repository;

import com.flowdesk.chatbotcore.graph.domain.GraphNodeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GraphNodeRepository extends JpaRepository<GraphNodeEntity, Long> {

  List<GraphNodeEntity> findByGraphId(Long graphId);
}
