package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.pending.MutationKind;
import com.ryuqq.livesync.core.pending.PendingMutation;

import java.time.Duration;
import java.util.Optional;

/**
 * Tracker of local writes that have not yet been reflected by the remote store.
 *
 * <p>Between a local write and its confirmation by the change feed, the feed may
 * still deliver snapshots produced before the write. The tracker lets the
 * reconciler recognise that window and keep the optimistic local state.</p>
 *
 * <p><strong>Expiry:</strong> an entry is active while {@code now - registeredAt < ttl}.
 * Every query evaluates expiry lazily with {@link PendingMutation#isActive(long, long)};
 * {@link #sweepExpired()} only reclaims memory and uses the same function.</p>
 *
 * <p><strong>Known Gap:</strong> the store offers no per-write acknowledgement channel,
 * so the TTL is a heuristic. A write slower than the TTL can still flicker back to
 * the stale remote value once. Callers should clear their own entry explicitly on write failure.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent markPending/query/sweep on different and equal ids</li>
 *   <li>Non-blocking: no I/O</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface PendingMutationTracker {

    /**
     * Default time-to-live of a pending entry.
     */
    Duration DEFAULT_TTL = Duration.ofSeconds(5);

    /**
     * Records (or refreshes) a pending write for an entity.
     *
     * <p>An existing entry for the same id is overwritten with the new kind and timestamp.</p>
     *
     * @param entityId the entity being written
     * @param kind CREATE, UPDATE or DELETE
     * @return the stored entry, to be passed to {@link #clear(EntityId, PendingMutation)}
     *         if this write fails
     * @throws IllegalArgumentException if entityId or kind is null, or kind is REORDER_BATCH
     */
    PendingMutation markPending(EntityId entityId, MutationKind kind);

    /**
     * Records (or refreshes) a collection-wide reorder flag.
     *
     * @param scope the collection whose order was changed locally
     * @return the stored flag, to be passed to {@link #clearReorder(SubscriptionKey, PendingMutation)}
     *         if this write fails
     * @throws IllegalArgumentException if scope is null
     */
    PendingMutation markReorderPending(SubscriptionKey scope);

    /**
     * Returns the active entry for an entity, if any.
     *
     * @param entityId the entity
     * @return the entry if it exists and has not expired
     */
    Optional<PendingMutation> activeMutation(EntityId entityId);

    /**
     * Checks whether any active entry exists for an entity.
     */
    default boolean isActive(EntityId entityId) {
        return activeMutation(entityId).isPresent();
    }

    /**
     * Checks whether an active entry of the given kind exists for an entity.
     */
    default boolean isActive(EntityId entityId, MutationKind kind) {
        return activeMutation(entityId).filter(m -> m.kind() == kind).isPresent();
    }

    /**
     * Checks whether the reorder flag of a collection is active.
     *
     * @param scope the collection
     * @return true if a reorder was marked within the TTL
     */
    boolean isReorderActive(SubscriptionKey scope);

    /**
     * Removes an entity entry immediately (write failure path). No-op if absent.
     */
    void clear(EntityId entityId);

    /**
     * Removes an entity entry only if it is still the given instance.
     *
     * <p>A later {@link #markPending} for the same entity replaces the stored instance,
     * so the failure of an earlier write leaves the newer entry in place. Instances are
     * compared by identity: two marks of the same kind in the same millisecond are
     * equal records but distinct entries.</p>
     *
     * @param entityId the entity
     * @param expected the entry returned by the failed write's {@link #markPending}
     * @return true if the entry was removed
     */
    boolean clear(EntityId entityId, PendingMutation expected);

    /**
     * Removes a collection reorder flag immediately. No-op if absent.
     */
    void clearReorder(SubscriptionKey scope);

    /**
     * Removes a collection reorder flag only if it is still the given instance.
     *
     * @param scope the collection
     * @param expected the flag returned by the failed write's {@link #markReorderPending}
     * @return true if the flag was removed
     */
    boolean clearReorder(SubscriptionKey scope, PendingMutation expected);

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    int sweepExpired();

    /**
     * Returns the number of stored entries, expired or not.
     */
    int size();

    /**
     * Returns the configured time-to-live.
     */
    Duration ttl();
}
