package com.flowdesk.chatbotcore.channel.state;

import java.time.Duration;

/** One-shot timers for session lifecycle (reconnect, connect timeout, pairing refresh). */
public interface SessionTimers {

  Handle schedule(Runnable task, Duration delay);

  interface Handle {

    void cancel();

    /** True until the task has started running or was cancelled. */
    boolean isPending();
  }
}
