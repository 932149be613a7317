package com.example.modcache.config;

import com.example.modcache.eviction.EvictionPolicy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Externalized settings for the cache, limiter and storage layers.
 */
@Data
@Component
@ConfigurationProperties(prefix = "modcache")
public class ModCacheProperties {

    /**
     * One TTL cache per logical domain, keyed by domain name.
     */
    private Map<String, CacheSpec> caches = new LinkedHashMap<>();

    private RateLimit rateLimit = new RateLimit();

    /**
     * Interval between expiry sweeps, independent of request traffic.
     */
    private Duration sweepInterval = Duration.ofSeconds(60);

    /**
     * Upper bound for a single cache load.
     */
    private Duration loadTimeout = Duration.ofSeconds(5);

    private int loaderThreads = 32;

    private Storage storage = new Storage();

    @Data
    public static class CacheSpec {
        private int capacity = 1000;
        private Duration ttl = Duration.ofMinutes(5);
        private EvictionPolicy eviction = EvictionPolicy.LRU;
    }

    @Data
    public static class RateLimit {
        private int maxRequests = 30;
        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Storage {
        private String path = "modbot.db";
        private int readerPoolSize = 4;
        private Duration busyTimeout = Duration.ofSeconds(5);
        private Duration writeLockTimeout = Duration.ofSeconds(10);

        /**
         * Schema version to migrate to at startup; latest known when unset.
         */
        private Integer schemaVersion;
    }
}
