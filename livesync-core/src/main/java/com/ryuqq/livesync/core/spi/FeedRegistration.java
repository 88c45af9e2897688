package com.ryuqq.livesync.core.spi;

/**
 * Handle to an open change feed.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FeedRegistration {

    /**
     * Closes the feed. Calling this more than once has no effect.
     */
    void remove();
}
