package org.jbridge.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A thread-safe bounded cache with LRU eviction.
 *
 * <p>Lookups reorder the underlying access-ordered map, so every operation takes the same lock.
 * An optional eviction listener runs under that lock and must not call back into the cache.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class BoundedCache<K, V> {
  private final int maxSize;
  private final LinkedHashMap<K, V> map;
  private final ReentrantLock lock = new ReentrantLock();
  private final BiConsumer<K, V> evictionListener;

  // Statistics for monitoring
  private long hits = 0;
  private long misses = 0;
  private long evictions = 0;

  public BoundedCache(int maxSize) {
    this(maxSize, (k, v) -> {});
  }

  /**
   * Create a bounded cache with the specified maximum size.
   *
   * @param maxSize maximum number of entries before eviction (must be > 0)
   * @param evictionListener called with each entry dropped to make room
   */
  public BoundedCache(int maxSize, BiConsumer<K, V> evictionListener) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    this.maxSize = maxSize;
    this.evictionListener = evictionListener;
    this.map =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            boolean shouldRemove = size() > BoundedCache.this.maxSize;
            if (shouldRemove) {
              evictions++;
              BoundedCache.this.evictionListener.accept(eldest.getKey(), eldest.getValue());
            }
            return shouldRemove;
          }
        };
  }

  /** The cached value, or null if not present. */
  public V get(K key) {
    lock.lock();
    try {
      V value = map.get(key);
      if (value != null) {
        hits++;
      } else {
        misses++;
      }
      return value;
    } finally {
      lock.unlock();
    }
  }

  public void put(K key, V value) {
    lock.lock();
    try {
      map.put(key, value);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Get or compute a value if absent. The mapping function runs outside the lock, so two threads
   * may both compute a missing value; the first one stored wins.
   */
  public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
    V value = get(key);
    if (value != null) {
      return value;
    }
    V computed = mappingFunction.apply(key);
    if (computed == null) {
      return null;
    }
    lock.lock();
    try {
      V raced = map.get(key);
      if (raced != null) {
        return raced;
      }
      map.put(key, computed);
      return computed;
    } finally {
      lock.unlock();
    }
  }

  public V remove(K key) {
    lock.lock();
    try {
      return map.remove(key);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return map.size();
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    lock.lock();
    try {
      map.clear();
    } finally {
      lock.unlock();
    }
  }

  /** Get cache statistics as a formatted string. */
  public String getStats() {
    lock.lock();
    try {
      long total = hits + misses;
      double hitRate = total > 0 ? (100.0 * hits / total) : 0.0;
      return String.format(
          "size=%d/%d hits=%d misses=%d evictions=%d hitRate=%.1f%%",
          map.size(), maxSize, hits, misses, evictions, hitRate);
    } finally {
      lock.unlock();
    }
  }

  public long getEvictions() {
    lock.lock();
    try {
      return evictions;
    } finally {
      lock.unlock();
    }
  }

  public int getMaxSize() {
    return maxSize;
  }
}
