package com.flowdesk.chatbotcore.pending;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Durable queue rows. Callers serialize per tenant. */
public interface PendingResponseStore {

  /** Adds a PENDING entry unless the conversation already has a PENDING or SENDING one. */
  boolean appendIfAbsent(OwedReply reply, Instant at);

  /** Moves all PENDING entries of the tenant to SENDING and returns them, oldest first. */
  List<PendingEntry> claim(String tenantId);

  /** Moves the conversation's PENDING entry, if any, to SENDING. */
  Optional<PendingEntry> claimFor(String conversationId);

  void complete(Long entryId);

  /**
   * Returns a SENDING entry to PENDING with one more attempt, or DEAD once {@code maxAttempts}
   * is reached. {@code deliveredBlocks} replaces the entry's count of blocks already sent.
   */
  PendingStatus release(Long entryId, String error, int maxAttempts, int deliveredBlocks);

  boolean hasPending(String tenantId);

  List<String> tenantsWithPending();

  int resetClaimed();
}
