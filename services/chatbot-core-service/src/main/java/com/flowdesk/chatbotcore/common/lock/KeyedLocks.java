package com.flowdesk.chatbotcore.common.lock;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped mutual exclusion by string key.
 *
 * <p>Equal keys always map to the same lock; unrelated keys may occasionally share a stripe.
 * The stripe count is fixed, so there is nothing to evict.
 */
public class KeyedLocks {

  private final ReentrantLock[] stripes;

  public KeyedLocks(int stripeCount) {
    if (stripeCount <= 0) {
      throw new IllegalArgumentException("stripeCount must be positive");
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  public <T> T withLock(String key, Supplier<T> action) {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void withLock(String key, Runnable action) {
    withLock(
        key,
        () -> {
          action.run();
          return null;
        });
  }

  ReentrantLock lockFor(String key) {
    int h = key == null ? 0 : key.hashCode();
    h ^= (h >>> 16);
    return stripes[Math.floorMod(h, stripes.length)];
  }
}
