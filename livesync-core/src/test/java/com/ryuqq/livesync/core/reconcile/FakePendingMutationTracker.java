package com.ryuqq.livesync.core.reconcile;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.pending.MutationKind;
import com.ryuqq.livesync.core.pending.PendingMutation;
import com.ryuqq.livesync.core.spi.PendingMutationTracker;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 수동 시계를 사용하는 단일 스레드 테스트용 추적기.
 */
class FakePendingMutationTracker implements PendingMutationTracker {

    private final Map<EntityId, PendingMutation> entries = new HashMap<>();
    private final Map<SubscriptionKey, PendingMutation> reorders = new HashMap<>();
    private long now = 1_000_000L;
    private int sweepCalls;

    void advance(Duration duration) {
        now += duration.toMillis();
    }

    int sweepCalls() {
        return sweepCalls;
    }

    @Override
    public PendingMutation markPending(EntityId entityId, MutationKind kind) {
        PendingMutation mutation = PendingMutation.forEntity(entityId, kind, now);
        entries.put(entityId, mutation);
        return mutation;
    }

    @Override
    public PendingMutation markReorderPending(SubscriptionKey scope) {
        PendingMutation flag = PendingMutation.reorder(now);
        reorders.put(scope, flag);
        return flag;
    }

    @Override
    public Optional<PendingMutation> activeMutation(EntityId entityId) {
        return Optional.ofNullable(entries.get(entityId))
            .filter(m -> m.isActive(now, ttl().toMillis()));
    }

    @Override
    public boolean isReorderActive(SubscriptionKey scope) {
        PendingMutation flag = reorders.get(scope);
        return flag != null && flag.isActive(now, ttl().toMillis());
    }

    @Override
    public void clear(EntityId entityId) {
        entries.remove(entityId);
    }

    @Override
    public boolean clear(EntityId entityId, PendingMutation expected) {
        if (entries.get(entityId) != expected) {
            return false;
        }
        entries.remove(entityId);
        return true;
    }

    @Override
    public void clearReorder(SubscriptionKey scope) {
        reorders.remove(scope);
    }

    @Override
    public boolean clearReorder(SubscriptionKey scope, PendingMutation expected) {
        if (reorders.get(scope) != expected) {
            return false;
        }
        reorders.remove(scope);
        return true;
    }

    @Override
    public int sweepExpired() {
        sweepCalls++;
        int before = size();
        entries.values().removeIf(m -> !m.isActive(now, ttl().toMillis()));
        reorders.values().removeIf(m -> !m.isActive(now, ttl().toMillis()));
        return before - size();
    }

    @Override
    public int size() {
        return entries.size() + reorders.size();
    }

    @Override
    public Duration ttl() {
        return DEFAULT_TTL;
    }
}
