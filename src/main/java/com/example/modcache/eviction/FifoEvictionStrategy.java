package com.example.modcache.eviction;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Oldest-write-first ordering. Reads never promote a key; writing a key again makes it the
 * newest.
 */
public class FifoEvictionStrategy<K> implements EvictionStrategy<K> {

    // insertion-order LinkedHashMap; re-inserts are moved by remove + put
    private final LinkedHashMap<K, Boolean> order = new LinkedHashMap<>();

    @Override
    public void onHit(K key) {
    }

    @Override
    public void onInsert(K key) {
        order.remove(key);
        order.put(key, Boolean.TRUE);
    }

    @Override
    public void onRemove(K key) {
        order.remove(key);
    }

    @Override
    public Optional<K> selectVictim(Map<K, ?> store) {
        Iterator<K> it = order.keySet().iterator();
        while (it.hasNext()) {
            K candidateKey = it.next();
            it.remove();
            if (store.containsKey(candidateKey)) {
                return Optional.of(candidateKey);
            }
        }
        return Optional.empty();
    }

    @Override
    public void clear() {
        order.clear();
    }

    int trackedKeys() {
        return order.size();
    }
}
