package com.example.modcache.backend;

import com.example.modcache.core.CacheManager;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Last deleted and last edited message per channel. Memory only: entries age out after the
 * domain's TTL and, when the domain is full, the oldest capture goes first regardless of reads.
 */
@Slf4j
@Component
public class SnipeStore {

    public static final String SNIPES = "snipes";
    public static final String EDIT_SNIPES = "edit-snipes";

    private final CacheManager cacheManager;

    public SnipeStore(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    public void recordDeleted(SnipedMessage message) {
        record(SNIPES, message);
    }

    public void recordEdited(SnipedMessage message) {
        record(EDIT_SNIPES, message);
    }

    public Optional<SnipedMessage> lastDeleted(long channelId) {
        return cacheManager.get(SNIPES, channelId);
    }

    public Optional<SnipedMessage> lastEdited(long channelId) {
        return cacheManager.get(EDIT_SNIPES, channelId);
    }

    public void clear() {
        int dropped = cacheManager.invalidateAll(SNIPES) + cacheManager.invalidateAll(EDIT_SNIPES);
        log.debug("Cleared {} sniped messages", dropped);
    }

    private void record(String domain, SnipedMessage message) {
        Objects.requireNonNull(message, "message");
        if (message.channelId() <= 0) {
            throw new IllegalArgumentException("Invalid channel id: " + message.channelId());
        }
        cacheManager.put(domain, message.channelId(), message);
    }
}
