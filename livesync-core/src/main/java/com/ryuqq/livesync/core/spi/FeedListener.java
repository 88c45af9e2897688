package com.ryuqq.livesync.core.spi;

import java.util.List;

/**
 * Receiver of change feed events from a {@link RemoteStore}.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface FeedListener {

    /**
     * Receives a full snapshot of the query result set.
     *
     * @param documents the current documents in store order (never null, may be empty)
     */
    void onSnapshot(List<RawDocument> documents);

    /**
     * Receives a terminal feed error. No further snapshots follow.
     *
     * @param error the failure reported by the store
     */
    void onError(RemoteStoreException error);
}
