package com.flowdesk.chatbotcore.common.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;

public class CaffeineExpiringCache<K, V> implements ExpiringCache<K, V> {

  private final Cache<K, V> cache;

  public CaffeineExpiringCache(Duration ttl, long maximumSize) {
    this.cache = Caffeine.newBuilder().maximumSize(maximumSize).expireAfterWrite(ttl).build();
  }

  @Override
  public Optional<V> get(K key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  @Override
  public void put(K key, V value) {
    cache.put(key, value);
  }

  @Override
  public void invalidate(K key) {
    cache.invalidate(key);
  }
}
