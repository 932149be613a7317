package com.example.modcache.eviction;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Least-recently-used ordering. Inserts and hits move a key to the tail; the victim is taken
 * from the head, so entries that were never read leave in insertion order.
 */
public class LruEvictionStrategy<K> implements EvictionStrategy<K> {

    // LinkedHashMap in access-order mode: accessOrder = true
    private final LinkedHashMap<K, Boolean> order = new LinkedHashMap<>(16, 0.75f, true);

    @Override
    public void onHit(K key) {
        // access-order LinkedHashMap moves key to end on get/put
        order.get(key);
    }

    @Override
    public void onInsert(K key) {
        order.put(key, Boolean.TRUE);
    }

    @Override
    public void onRemove(K key) {
        order.remove(key);
    }

    @Override
    public Optional<K> selectVictim(Map<K, ?> store) {
        Iterator<Map.Entry<K, Boolean>> it = order.entrySet().iterator();
        while (it.hasNext()) {
            K candidateKey = it.next().getKey();
            it.remove();
            // candidate may already be gone from the store
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
