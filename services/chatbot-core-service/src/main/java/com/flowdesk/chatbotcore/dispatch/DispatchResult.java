package com.flowdesk.chatbotcore.dispatch;

import java.util.List;

/**
 * Outcome of one dispatch.
 *
 * @param deliveredBlocks for NOT_LIVE and FAILED, how many leading blocks reached the contact
 *     before the dispatch stopped
 */
public record DispatchResult(
    DispatchStatus status, List<String> messageIds, int deliveredBlocks, String error) {

  public DispatchResult {
    messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
  }

  public static DispatchResult sent(List<String> messageIds) {
    return new DispatchResult(DispatchStatus.SENT, messageIds, 0, null);
  }

  public static DispatchResult notLive(List<String> messageIds) {
    return notLive(messageIds, 0);
  }

  public static DispatchResult notLive(List<String> messageIds, int deliveredBlocks) {
    return new DispatchResult(
        DispatchStatus.NOT_LIVE, messageIds, deliveredBlocks, "channel not live");
  }

  public static DispatchResult failed(List<String> messageIds, String error) {
    return failed(messageIds, 0, error);
  }

  public static DispatchResult failed(List<String> messageIds, int deliveredBlocks, String error) {
    return new DispatchResult(DispatchStatus.FAILED, messageIds, deliveredBlocks, error);
  }

  public static DispatchResult rejected(String error) {
    return new DispatchResult(DispatchStatus.REJECTED, List.of(), 0, error);
  }

  /** Worth retrying later from the pending queue. */
  public boolean retryable() {
    return status == DispatchStatus.NOT_LIVE || status == DispatchStatus.FAILED;
  }
}
