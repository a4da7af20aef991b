package com.flowdesk.chatbotcore.common.cache;

import java.util.Optional;

/**
 * Key to value cache with time-based expiry. Callers depend on this interface only, so the
 * in-process implementation can be replaced by a distributed one.
 */
public interface ExpiringCache<K, V> {

  Optional<V> get(K key);

  void put(K key, V value);

  void invalidate(K key);
}
