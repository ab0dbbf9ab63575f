package com.schemaid.identity;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Per-model memo of computed values.
 *
 * Reads never lock and computation happens outside any lock. Two threads racing on the same
 * uncached model may both compute; the first write wins and both get the stored value, which is
 * equal to what the loser computed because computation is deterministic. Failed computations are
 * never stored.
 *
 * Keys are exact classes, so a subclass never sees an entry cached for its superclass.
 */
public class IdentityCache<V> {

    private final ConcurrentMap<Class<?>, V> entries = new ConcurrentHashMap<>();

    public Optional<V> get(Class<?> model) {
        return Optional.ofNullable(entries.get(model));
    }

    public V getOrCompute(Class<?> model, Function<Class<?>, V> computation) {
        V cached = entries.get(model);
        if (cached != null) {
            return cached;
        }
        V computed = computation.apply(model);
        V raced = entries.putIfAbsent(model, computed);
        return raced != null ? raced : computed;
    }

    /**
     * Stores unconditionally, replacing any earlier value.
     */
    public void put(Class<?> model, V value) {
        entries.put(model, value);
    }

    public int size() {
        return entries.size();
    }
}
