package com.example.modcache.config;

import com.example.modcache.core.CacheManager;
import com.example.modcache.core.TtlCache;
import com.example.modcache.load.CoalescingLoader;
import com.example.modcache.ratelimit.SlidingWindowRateLimiter;
import com.example.modcache.storage.ModerationSchema;
import com.example.modcache.storage.StorageAccessor;
import com.example.modcache.storage.StorageSettings;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Startup order: storage is opened and migrated first, so a fatal schema problem stops the
 * context before any cache is built. Shutdown runs in reverse: the cache manager stops its
 * sweep, then storage flushes and closes.
 */
@Slf4j
@Configuration
public class ModCacheConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StorageAccessor storageAccessor(ModCacheProperties properties, Clock clock) {
        ModCacheProperties.Storage storage = properties.getStorage();
        StorageSettings settings = new StorageSettings(
            Path.of(storage.getPath()),
            storage.getReaderPoolSize(),
            storage.getBusyTimeout(),
            storage.getWriteLockTimeout());

        StorageAccessor accessor = new StorageAccessor(settings, ModerationSchema.migrations(), clock);
        int target = storage.getSchemaVersion() != null ? storage.getSchemaVersion() : ModerationSchema.LATEST_VERSION;
        try {
            accessor.migrate(target);
        } catch (RuntimeException e) {
            log.error("Storage not usable, refusing to start", e);
            accessor.close();
            throw e;
        }
        return accessor;
    }

    @Bean
    public ThreadPoolTaskScheduler sweepScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("modcache-sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }

    @Bean(initMethod = "start")
    public CacheManager cacheManager(
        ModCacheProperties properties,
        StorageAccessor storageAccessor,
        ThreadPoolTaskScheduler sweepScheduler,
        Clock clock
    ) {
        List<TtlCache<Object, Object>> caches = new ArrayList<>();
        properties.getCaches().forEach((domain, spec) ->
            caches.add(new TtlCache<>(
                domain, spec.getCapacity(), spec.getTtl(), clock, spec.getEviction().<Object>newStrategy())));

        ModCacheProperties.RateLimit rateLimit = properties.getRateLimit();
        SlidingWindowRateLimiter limiter =
            new SlidingWindowRateLimiter(rateLimit.getMaxRequests(), rateLimit.getWindow(), clock);

        return new CacheManager(
            caches,
            limiter,
            storageAccessor,
            new CoalescingLoader(properties.getLoaderThreads(), properties.getLoadTimeout()),
            sweepScheduler,
            properties.getSweepInterval());
    }
}
