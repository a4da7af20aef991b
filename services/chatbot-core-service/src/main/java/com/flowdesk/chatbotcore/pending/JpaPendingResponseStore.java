package com.flowdesk.chatbotcore.pending;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class JpaPendingResponseStore implements PendingResponseStore {

  private final PendingResponseRepository repo;

  @Override
  @Transactional
  public boolean appendIfAbsent(OwedReply reply, Instant at) {
    if (repo.existsByConversationIdAndStatusIn(
        reply.conversationId(), EnumSet.of(PendingStatus.PENDING, PendingStatus.SENDING))) {
      return false;
    }
    repo.save(new PendingResponseEntity(reply, at));
    return true;
  }

  @Override
  @Transactional
  public List<PendingEntry> claim(String tenantId) {
    List<PendingResponseEntity> rows =
        repo.findByTenantIdAndStatusOrderByEnqueuedAtAsc(tenantId, PendingStatus.PENDING);
    rows.forEach(PendingResponseEntity::claim);
    return rows.stream().map(PendingResponseEntity::toEntry).toList();
  }

  @Override
  @Transactional
  public Optional<PendingEntry> claimFor(String conversationId) {
    return repo.findFirstByConversationIdAndStatus(conversationId, PendingStatus.PENDING)
        .map(
            e -> {
              e.claim();
              return e.toEntry();
            });
  }

  @Override
  @Transactional
  public void complete(Long entryId) {
    repo.deleteById(entryId);
  }

  @Override
  @Transactional
  public PendingStatus release(Long entryId, String error, int maxAttempts, int deliveredBlocks) {
    return repo.findById(entryId)
        .map(
            e -> {
              e.release(error, maxAttempts, deliveredBlocks);
              return e.getStatus();
            })
        .orElse(PendingStatus.DEAD);
  }

  @Override
  @Transactional(readOnly = true)
  public boolean hasPending(String tenantId) {
    return repo.existsByTenantIdAndStatus(tenantId, PendingStatus.PENDING);
  }

  @Override
  @Transactional(readOnly = true)
  public List<String> tenantsWithPending() {
    return repo.findTenantIdsByStatus(PendingStatus.PENDING);
  }

  @Override
  @Transactional
  public int resetClaimed() {
    return repo.updateStatus(PendingStatus.SENDING, PendingStatus.PENDING);
  }
}
