package com.flowdesk.chatbotcore.graph.repository;

import com.flowdesk.chatbotcore.graph.domain.GraphOptionEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GraphOptionRepository extends JpaRepository<GraphOptionEntity, Long> {

  List<GraphOptionEntity> findByNodeIdInOrderByNodeIdAscSortOrderAscIdAsc(Collection<Long> nodeIds);
}
