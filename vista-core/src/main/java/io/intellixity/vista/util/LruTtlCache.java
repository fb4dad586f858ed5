package io.intellixity.vista.util;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Synchronized LRU cache with expire-after-write and optional expire-after-access.\n
 *
 * Evicted or expired values are handed to the eviction listener (used to close pools and
 * release file tables). A zero ttl or idle disables that expiry.
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier nowMillis;
  private final BiConsumer<K, V> onEvict;

  private final LinkedHashMap<K, Slot<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Slot<V> {
    final V value;
    final long writtenAt;
    long touchedAt;

    Slot(V value, long now) {
      this.value = value;
      this.writtenAt = now;
      this.touchedAt = now;
    }
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis) {
    this(maxEntries, ttlMillis, idleMillis, System::currentTimeMillis, (k, v) -> {});
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, LongSupplier nowMillis, BiConsumer<K, V> onEvict) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0 || idleMillis < 0) throw new IllegalArgumentException("ttl and idle must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.onEvict = Objects.requireNonNull(onEvict, "onEvict");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    expire(now);
    Slot<V> s = map.get(key);
    if (s == null) return null;
    s.touchedAt = now;
    return s.value;
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    expire(now);
    Slot<V> prev = map.put(key, new Slot<>(value, now));
    if (prev != null && prev.value != value) onEvict.accept(key, prev.value);
    trim();
  }

  /** Returns the cached value or computes, caches and returns a new one. Null results are not cached. */
  public synchronized V getOrCompute(K key, Supplier<V> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    V existing = get(key);
    if (existing != null) return existing;
    V created = supplier.get();
    if (created != null) put(key, created);
    return created;
  }

  public synchronized void invalidate(K key) {
    Slot<V> s = map.remove(key);
    if (s != null) onEvict.accept(key, s.value);
  }

  public synchronized void clear() {
    List<Map.Entry<K, Slot<V>>> all = new ArrayList<>(map.entrySet());
    map.clear();
    for (Map.Entry<K, Slot<V>> e : all) onEvict.accept(e.getKey(), e.getValue().value);
  }

  public synchronized int size() {
    expire(nowMillis.getAsLong());
    return map.size();
  }

  private boolean expired(Slot<V> s, long now) {
    return (ttlMillis > 0 && now - s.writtenAt >= ttlMillis)
        || (idleMillis > 0 && now - s.touchedAt >= idleMillis);
  }

  private void expire(long now) {
    Iterator<Map.Entry<K, Slot<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<K, Slot<V>> e = it.next();
      if (expired(e.getValue(), now)) {
        it.remove();
        onEvict.accept(e.getKey(), e.getValue().value);
      }
    }
  }

  private void trim() {
    Iterator<Map.Entry<K, Slot<V>>> it = map.entrySet().iterator();
    while (map.size() > maxEntries && it.hasNext()) {
      Map.Entry<K, Slot<V>> eldest = it.next();
      it.remove();
      onEvict.accept(eldest.getKey(), eldest.getValue().value);
    }
  }
}
