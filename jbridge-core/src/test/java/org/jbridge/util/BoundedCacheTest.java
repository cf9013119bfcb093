package org.jbridge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BoundedCacheTest {

  @Test
  void testLeastRecentlyUsedIsEvicted() {
    List<String> evicted = new ArrayList<>();
    BoundedCache<String, Integer> cache = new BoundedCache<>(2, (k, v) -> evicted.add(k));
    cache.put("a", 1);
    cache.put("b", 2);
    cache.get("a");
    cache.put("c", 3);

    assertEquals(List.of("b"), evicted);
    assertEquals(1, cache.get("a"));
    assertNull(cache.get("b"));
    assertEquals(2, cache.size());
    assertEquals(1, cache.getEvictions());
  }

  @Test
  void testComputeIfAbsent() {
    BoundedCache<String, Integer> cache = new BoundedCache<>(4);
    assertEquals(3, cache.computeIfAbsent("abc", String::length));
    assertEquals(3, cache.computeIfAbsent("abc", k -> 99));
    assertNull(cache.computeIfAbsent("none", k -> null));
    assertEquals(1, cache.size());
  }

  @Test
  void testRemoveAndClear() {
    BoundedCache<Integer, String> cache = new BoundedCache<>(8);
    cache.put(1, "one");
    cache.put(2, "two");
    assertEquals("one", cache.remove(1));
    assertNull(cache.remove(1));
    cache.clear();
    assertEquals(0, cache.size());
    assertEquals(8, cache.getMaxSize());
  }

  @Test
  void testStats() {
    BoundedCache<String, String> cache = new BoundedCache<>(2);
    cache.put("k", "v");
    cache.get("k");
    cache.get("missing");
    assertTrue(cache.getStats().contains("hits=1 misses=1"), cache.getStats());
  }

  @Test
  void testSizeMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedCache<String, String>(0));
  }
}
