package com.example.modcache.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.example.modcache.core.CacheManager;
import com.example.modcache.core.TtlCache;
import com.example.modcache.eviction.EvictionPolicy;
import com.example.modcache.load.CoalescingLoader;
import com.example.modcache.ratelimit.SlidingWindowRateLimiter;
import com.example.modcache.storage.StorageAccessor;
import com.example.modcache.support.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class SnipeStoreTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;
    private CacheManager cacheManager;
    private SnipeStore snipes;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        cacheManager = new CacheManager(
            List.of(cache(SnipeStore.SNIPES), cache(SnipeStore.EDIT_SNIPES)),
            new SlidingWindowRateLimiter(30, Duration.ofSeconds(60), clock),
            mock(StorageAccessor.class),
            new CoalescingLoader(2, Duration.ofSeconds(5)),
            mock(TaskScheduler.class),
            Duration.ofSeconds(60));
        snipes = new SnipeStore(cacheManager);
    }

    @AfterEach
    void tearDown() {
        cacheManager.close();
    }

    private TtlCache<Object, Object> cache(String domain) {
        return new TtlCache<>(domain, 2, TTL, clock, EvictionPolicy.FIFO.<Object>newStrategy());
    }

    private SnipedMessage deletedIn(long channelId, String content) {
        return SnipedMessage.deleted(channelId, 7L, "alice", content, clock.instant());
    }

    @Test
    @DisplayName("the last deleted message replaces the previous one for the channel")
    void lastDeletedWins() {
        // given
        snipes.recordDeleted(deletedIn(10L, "first"));

        // when
        snipes.recordDeleted(deletedIn(10L, "second"));

        // then
        assertThat(snipes.lastDeleted(10L)).map(SnipedMessage::content).contains("second");
        assertThat(snipes.lastDeleted(11L)).isEmpty();
    }

    @Test
    @DisplayName("edits keep both versions and live apart from deletions")
    void editsAreSeparateFromDeletions() {
        snipes.recordEdited(SnipedMessage.edited(10L, 7L, "alice", "teh", "the", clock.instant()));

        assertThat(snipes.lastDeleted(10L)).isEmpty();
        assertThat(snipes.lastEdited(10L)).hasValueSatisfying(message -> {
            assertThat(message.before()).isEqualTo("teh");
            assertThat(message.content()).isEqualTo("the");
        });
    }

    @Test
    @DisplayName("a capture is gone once its lifetime has passed")
    void capturesExpire() {
        snipes.recordDeleted(deletedIn(10L, "gone soon"));

        clock.advance(TTL.minusSeconds(1));
        assertThat(snipes.lastDeleted(10L)).isPresent();

        clock.advanceSeconds(1);
        assertThat(snipes.lastDeleted(10L)).isEmpty();
    }

    @Test
    @DisplayName("when full the oldest capture is dropped even if it was just read")
    void oldestCaptureIsDroppedFirst() {
        snipes.recordDeleted(deletedIn(1L, "one"));
        snipes.recordDeleted(deletedIn(2L, "two"));
        assertThat(snipes.lastDeleted(1L)).isPresent();

        snipes.recordDeleted(deletedIn(3L, "three"));

        assertThat(snipes.lastDeleted(1L)).isEmpty();
        assertThat(snipes.lastDeleted(2L)).isPresent();
        assertThat(snipes.lastDeleted(3L)).isPresent();
    }

    @Test
    void clearDropsBothKinds() {
        snipes.recordDeleted(deletedIn(1L, "one"));
        snipes.recordEdited(SnipedMessage.edited(1L, 7L, "alice", "a", "b", clock.instant()));

        snipes.clear();

        assertThat(snipes.lastDeleted(1L)).isEmpty();
        assertThat(snipes.lastEdited(1L)).isEmpty();
    }

    @Test
    void rejectsInvalidChannel() {
        assertThatThrownBy(() -> snipes.recordDeleted(deletedIn(0L, "x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> snipes.recordEdited(null))
            .isInstanceOf(NullPointerException.class);
    }
}
