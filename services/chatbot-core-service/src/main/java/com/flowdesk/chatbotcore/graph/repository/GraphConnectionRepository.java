package com.flowdesk.chatbotcore.graph.repository;

import com.flowdesk.chatbotcore.graph.domain.GraphConnectionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GraphConnectionRepository extends JpaRepository<GraphConnectionEntity, Long> {

  List<GraphConnectionEntity> findByGraphIdOrderByIdAsc(Long graphId);
}
