package com.ryuqq.livesync.adapter.inmemory.pending;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.pending.MutationKind;
import com.ryuqq.livesync.core.pending.PendingMutation;
import com.ryuqq.livesync.core.spi.PendingMutationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link PendingMutationTracker}.
 *
 * <p>Entries are kept in two {@link ConcurrentHashMap}s: one keyed by entity ID and one
 * keyed by collection for reorder flags. A single instance is shared by every
 * collection of the process.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link #markPending} overwrites atomically with {@link ConcurrentHashMap#put}</li>
 *   <li>{@link #sweepExpired} removes with {@link ConcurrentHashMap#remove(Object, Object)},
 *       so an entry refreshed concurrently with the sweep survives</li>
 *   <li>Conditional clears remove only the exact instance a write registered, so the
 *       failure of an older write never drops a newer entry</li>
 *   <li>Queries never remove entries; expiry is evaluated lazily</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * PendingMutationTracker tracker = new InMemoryPendingMutationTracker();
 *
 * tracker.markPending(taskId, MutationKind.UPDATE);
 * remoteStore.commit(writes);
 *
 * tracker.isActive(taskId, MutationKind.UPDATE); // true for 5 seconds
 * </pre>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public class InMemoryPendingMutationTracker implements PendingMutationTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPendingMutationTracker.class);

    private final ConcurrentHashMap<EntityId, PendingMutation> entries;
    private final ConcurrentHashMap<SubscriptionKey, PendingMutation> reorders;
    private final Clock clock;
    private final Duration ttl;

    /**
     * Creates a tracker with the system clock and {@link #DEFAULT_TTL}.
     */
    public InMemoryPendingMutationTracker() {
        this(Clock.systemUTC(), DEFAULT_TTL);
    }

    /**
     * Creates a tracker with a custom clock and TTL.
     *
     * @param clock time source
     * @param ttl time-to-live of every entry
     * @throws IllegalArgumentException if clock is null or ttl is not positive
     */
    public InMemoryPendingMutationTracker(Clock clock, Duration ttl) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, but was: " + ttl);
        }
        this.entries = new ConcurrentHashMap<>();
        this.reorders = new ConcurrentHashMap<>();
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if entityId or kind is null, or kind is REORDER_BATCH
     */
    @Override
    public PendingMutation markPending(EntityId entityId, MutationKind kind) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (!kind.isEntityScoped()) {
            throw new IllegalArgumentException("use markReorderPending for " + kind);
        }
        PendingMutation mutation = PendingMutation.forEntity(entityId, kind, clock.millis());
        entries.put(entityId, mutation);
        log.debug("Pending {} marked for {}", kind, entityId);
        return mutation;
    }

    @Override
    public PendingMutation markReorderPending(SubscriptionKey scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        PendingMutation flag = PendingMutation.reorder(clock.millis());
        reorders.put(scope, flag);
        log.debug("Pending reorder marked for {}", scope);
        return flag;
    }

    @Override
    public Optional<PendingMutation> activeMutation(EntityId entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        PendingMutation mutation = entries.get(entityId);
        if (mutation == null || !mutation.isActive(clock.millis(), ttl.toMillis())) {
            return Optional.empty();
        }
        return Optional.of(mutation);
    }

    @Override
    public boolean isReorderActive(SubscriptionKey scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        PendingMutation flag = reorders.get(scope);
        return flag != null && flag.isActive(clock.millis(), ttl.toMillis());
    }

    @Override
    public void clear(EntityId entityId) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (entries.remove(entityId) != null) {
            log.debug("Pending entry cleared for {}", entityId);
        }
    }

    @Override
    public void clearReorder(SubscriptionKey scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (reorders.remove(scope) != null) {
            log.debug("Pending reorder cleared for {}", scope);
        }
    }

    @Override
    public boolean clear(EntityId entityId, PendingMutation expected) {
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        boolean removed = removeSame(entries, entityId, expected);
        if (removed) {
            log.debug("Pending entry cleared for {}", entityId);
        } else {
            log.debug("Pending entry for {} was replaced by a newer write, kept", entityId);
        }
        return removed;
    }

    @Override
    public boolean clearReorder(SubscriptionKey scope, PendingMutation expected) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        boolean removed = removeSame(reorders, scope, expected);
        if (removed) {
            log.debug("Pending reorder cleared for {}", scope);
        } else {
            log.debug("Pending reorder for {} was replaced by a newer reorder, kept", scope);
        }
        return removed;
    }

    // identity, not equals: same-millisecond marks of one kind are equal records
    private static <K> boolean removeSame(ConcurrentHashMap<K, PendingMutation> map, K key,
                                          PendingMutation expected) {
        boolean[] removed = new boolean[1];
        map.computeIfPresent(key, (k, current) -> {
            if (current == expected) {
                removed[0] = true;
                return null;
            }
            return current;
        });
        return removed[0];
    }

    @Override
    public int sweepExpired() {
        long now = clock.millis();
        long ttlMillis = ttl.toMillis();
        int removed = sweep(entries, now, ttlMillis) + sweep(reorders, now, ttlMillis);
        if (removed > 0) {
            log.debug("Swept {} expired pending entries", removed);
        }
        return removed;
    }

    private static <K> int sweep(ConcurrentHashMap<K, PendingMutation> map, long now, long ttlMillis) {
        int removed = 0;
        for (Map.Entry<K, PendingMutation> entry : map.entrySet()) {
            PendingMutation mutation = entry.getValue();
            if (!mutation.isActive(now, ttlMillis) && map.remove(entry.getKey(), mutation)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size() + reorders.size();
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    /**
     * Clears all entries.
     *
     * <p>This method is used for test cleanup and on sign-out.</p>
     */
    public void clear() {
        entries.clear();
        reorders.clear();
    }
}
