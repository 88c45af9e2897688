package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.model.QueryDescriptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Remote Document Store SPI for change feeds and writes.
 *
 * <p>This interface abstracts the hosted document database that owns the
 * authoritative copy of every entity. The sync layer never talks to the network
 * directly; it only opens change feeds and dispatches writes through this SPI.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Open a change feed for a {@link QueryDescriptor} and push full snapshots to a {@link FeedListener}</li>
 *   <li>Mark documents that still reflect uncommitted local writes ({@code hasPendingWrites})</li>
 *   <li>Apply batched writes and report completion asynchronously</li>
 * </ul>
 *
 * <p><strong>Snapshot Semantics:</strong></p>
 * <pre>
 * subscribe(query, listener)
 *   → listener.onSnapshot(initial documents)
 *   → listener.onSnapshot(full result set after each change)
 *   → ...
 *   → listener.onError(e)   (terminal, no further snapshots)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: subscribe/commit may be called from multiple threads</li>
 *   <li>Snapshots of one feed must be delivered in order</li>
 *   <li>{@link FeedRegistration#remove()} must be idempotent</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface RemoteStore {

    /**
     * Opens a change feed for the given query.
     *
     * <p>The store delivers the current result set as the first snapshot and then a
     * new full snapshot after every change affecting the query.</p>
     *
     * @param query the query to observe
     * @param listener receiver of snapshots and terminal errors
     * @return registration used to close the feed
     * @throws IllegalArgumentException if query or listener is null
     * @throws RemoteStoreException if the store rejects the subscription synchronously
     *         (permission denied, invalid query, unavailable)
     */
    FeedRegistration subscribe(QueryDescriptor query, FeedListener listener);

    /**
     * Applies a batch of writes.
     *
     * <p>The returned future completes normally once the store has accepted every write,
     * or exceptionally with a {@link RemoteStoreException} if the batch was rejected.
     * The store does not retry.</p>
     *
     * @param writes the writes to apply atomically
     * @return completion of the batch
     * @throws IllegalArgumentException if writes is null or empty
     */
    CompletableFuture<Void> commit(List<DocumentWrite> writes);
}
