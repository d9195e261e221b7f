package com.ocpbot.channel.slack;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;

/**
 * Recently seen event keys.
 * <p>
 * Slack delivers a mention in a channel both as {@code app_mention} and as
 * {@code message}, and retries events it considers unacknowledged; each post
 * must be dispatched once.
 */
public class EventDedupe {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_SIZE = 2000;

    private final Cache<String, Boolean> seen;

    public EventDedupe() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE);
    }

    public EventDedupe(Duration ttl, int maxSize) {
        this.seen = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .build();
    }

    /**
     * Record a key. Returns true if it was already seen within the TTL.
     */
    public boolean isDuplicate(String key) {
        if (key == null)
            return false;
        return seen.asMap().putIfAbsent(key, Boolean.TRUE) != null;
    }

    public void clear() {
        seen.invalidateAll();
    }
}
