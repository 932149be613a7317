package com.example.modcache.backend;

import java.time.Instant;
import java.util.Objects;

/**
 * A deleted or edited message kept for a short while so moderators can see what was there.
 *
 * @param before previous content for edits; null for deletions
 */
public record SnipedMessage(long channelId, long authorId, String author, String content, String before,
                            Instant capturedAt) {

    public SnipedMessage {
        Objects.requireNonNull(capturedAt, "capturedAt");
    }

    public static SnipedMessage deleted(long channelId, long authorId, String author, String content,
                                        Instant capturedAt) {
        return new SnipedMessage(channelId, authorId, author, content, null, capturedAt);
    }

    public static SnipedMessage edited(long channelId, long authorId, String author, String before,
                                       String after, Instant capturedAt) {
        return new SnipedMessage(channelId, authorId, author, after, before, capturedAt);
    }
}
