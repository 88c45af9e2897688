package com.ryuqq.livesync.adapter.runner;

import com.ryuqq.livesync.application.collection.CollectionObserver;
import com.ryuqq.livesync.application.collection.SyncedCollection;
import com.ryuqq.livesync.application.registry.SnapshotCallback;
import com.ryuqq.livesync.application.registry.SubscriptionHandle;
import com.ryuqq.livesync.application.registry.SubscriptionRegistry;
import com.ryuqq.livesync.core.failure.FailureReason;
import com.ryuqq.livesync.core.failure.SyncFailure;
import com.ryuqq.livesync.core.failure.WriteFailed;
import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.QueryDescriptor;
import com.ryuqq.livesync.core.model.RemoteDocument;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;
import com.ryuqq.livesync.core.model.SyncEntity;
import com.ryuqq.livesync.core.pending.MutationKind;
import com.ryuqq.livesync.core.pending.PendingMutation;
import com.ryuqq.livesync.core.reconcile.ReconciledList;
import com.ryuqq.livesync.core.reconcile.SnapshotReconciler;
import com.ryuqq.livesync.core.spi.DocumentCodec;
import com.ryuqq.livesync.core.spi.DocumentWrite;
import com.ryuqq.livesync.core.spi.PendingMutationTracker;
import com.ryuqq.livesync.core.spi.RemoteStore;
import com.ryuqq.livesync.core.spi.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 구독 하나에 대한 {@link SyncedCollection} 구현.
 *
 * <p>레지스트리 구독자로 등록되어 스냅샷을 받을 때마다 {@link SnapshotReconciler}로
 * 이전 목록과 병합하고 관찰자에게 게시합니다. 낙관적 쓰기는 로컬 목록을 즉시 바꾸고,
 * 대기 항목을 기록한 다음 원격 쓰기를 보냅니다.</p>
 *
 * <p><strong>동시성:</strong> 현재 목록의 읽기-수정-쓰기(병합, 낙관적 변경)는 모두 stateLock 안에서 수행되며,
 * 게시도 같은 잠금 안에서 이루어지므로 관찰자는 변경 순서대로 목록을 받습니다.
 * 스냅샷 병합과 쓰기 실패 복구는 구독 키의 직렬 레인에서 실행됩니다.</p>
 *
 * <p><strong>쓰기 실패:</strong> TTL을 기다리지 않고 대기 항목(재정렬 플래그)을 즉시 제거하고,
 * 실패한 생성은 로컬에서 제거한 뒤 마지막 원격 스냅샷으로 다시 병합합니다.</p>
 *
 * @param <T> 엔티티 타입
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class CollectionSynchronizer<T extends SyncEntity> implements SyncedCollection<T>, SnapshotCallback<T> {

    private static final Logger log = LoggerFactory.getLogger(CollectionSynchronizer.class);

    private final SubscriptionRegistry registry;
    private final RemoteStore remoteStore;
    private final PendingMutationTracker tracker;
    private final SnapshotReconciler reconciler;
    private final KeyedSerialExecutor lanes;
    private final QueryDescriptor query;
    private final SubscriptionKey key;
    private final DocumentCodec<T> codec;
    private final Object stateLock = new Object();
    private final List<CollectionObserver<T>> observers;
    private final AtomicBoolean closed;

    private volatile List<T> current;
    private volatile List<RemoteDocument<T>> lastRemote;

    /**
     * 생성자.
     *
     * <p>생성만으로는 구독하지 않습니다. {@link #open(SubscriptionKind, SubscriptionPriority)}를 호출해야 합니다.</p>
     */
    public CollectionSynchronizer(SubscriptionRegistry registry, RemoteStore remoteStore,
                                  PendingMutationTracker tracker, KeyedSerialExecutor lanes,
                                  QueryDescriptor query, DocumentCodec<T> codec) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (remoteStore == null) {
            throw new IllegalArgumentException("remoteStore cannot be null");
        }
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        if (lanes == null) {
            throw new IllegalArgumentException("lanes cannot be null");
        }
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.registry = registry;
        this.remoteStore = remoteStore;
        this.tracker = tracker;
        this.reconciler = new SnapshotReconciler(tracker);
        this.lanes = lanes;
        this.query = query;
        this.key = query.toKey();
        this.codec = codec;
        this.observers = new CopyOnWriteArrayList<>();
        this.closed = new AtomicBoolean();
        this.current = List.of();
    }

    /**
     * 레지스트리에 구독.
     *
     * @return 구독 핸들 (거부된 경우 관찰자에게 SubscriptionFailed가 전달됨)
     */
    public SubscriptionHandle open(SubscriptionKind kind, SubscriptionPriority priority) {
        requireOpen();
        return registry.subscribe(query, kind, priority, codec, this);
    }

    // ============================================================
    // SnapshotCallback (구독 키 레인에서 호출)
    // ============================================================

    @Override
    public void onSnapshot(List<RemoteDocument<T>> documents) {
        if (closed.get()) {
            return;
        }
        synchronized (stateLock) {
            lastRemote = documents;
            ReconciledList<T> result = reconciler.reconcile(key, current, documents);
            log.debug("Reconciled {}: size={} keptLocal={} takenRemote={} retained={} appended={} suppressed={} held={}",
                key, result.size(), result.keptLocal(), result.takenRemote(), result.retained(),
                result.appended(), result.suppressed(), result.heldForPending());
            replace(result.entities());
        }
    }

    @Override
    public void onFailure(SyncFailure failure) {
        notifyFailure(failure);
    }

    // ============================================================
    // SyncedCollection
    // ============================================================

    @Override
    public SubscriptionKey key() {
        return key;
    }

    @Override
    public List<T> current() {
        return current;
    }

    @Override
    public void addObserver(CollectionObserver<T> observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        synchronized (stateLock) {
            observers.add(observer);
            notifyChange(observer, current);
        }
    }

    @Override
    public void removeObserver(CollectionObserver<T> observer) {
        observers.remove(observer);
    }

    @Override
    public CompletableFuture<Void> create(T entity) {
        requireOpen();
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        PendingMutation mark;
        synchronized (stateLock) {
            if (indexOf(current, entity.id()) >= 0) {
                throw new IllegalArgumentException("entity already exists: " + entity.id());
            }
            mark = tracker.markPending(entity.id(), MutationKind.CREATE);
            List<T> next = new ArrayList<>(current);
            next.add(entity);
            replace(sortUnlessReordering(next));
        }
        return commit(List.of(DocumentWrite.set(query.collectionPath(), entity.id(), codec.encode(entity))),
            entity.id(), mark);
    }

    @Override
    public CompletableFuture<Void> update(T entity) {
        requireOpen();
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        PendingMutation mark;
        synchronized (stateLock) {
            int index = indexOf(current, entity.id());
            if (index < 0) {
                throw new IllegalArgumentException("entity not found: " + entity.id());
            }
            mark = tracker.markPending(entity.id(), MutationKind.UPDATE);
            List<T> next = new ArrayList<>(current);
            next.set(index, entity);
            replace(sortUnlessReordering(next));
        }
        return commit(List.of(DocumentWrite.set(query.collectionPath(), entity.id(), codec.encode(entity))),
            entity.id(), mark);
    }

    @Override
    public CompletableFuture<Void> delete(EntityId entityId) {
        requireOpen();
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        PendingMutation mark;
        synchronized (stateLock) {
            mark = tracker.markPending(entityId, MutationKind.DELETE);
            int index = indexOf(current, entityId);
            if (index >= 0) {
                List<T> next = new ArrayList<>(current);
                next.remove(index);
                replace(next);
            }
        }
        return commit(List.of(DocumentWrite.delete(query.collectionPath(), entityId)), entityId, mark);
    }

    @Override
    public CompletableFuture<Void> reorder(List<T> reordered) {
        requireOpen();
        if (reordered == null) {
            throw new IllegalArgumentException("reordered cannot be null");
        }
        List<DocumentWrite> writes = new ArrayList<>(reordered.size());
        PendingMutation mark;
        synchronized (stateLock) {
            requireSameMembers(reordered);
            mark = tracker.markReorderPending(key);
            for (T entity : reordered) {
                writes.add(DocumentWrite.set(query.collectionPath(), entity.id(), codec.encode(entity)));
            }
            replace(reordered);
        }
        if (writes.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return commit(writes, null, mark);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        registry.unsubscribe(key);
        observers.clear();
        log.debug("Synced collection closed: {}", key);
    }

    // ============================================================
    // 원격 쓰기
    // ============================================================

    private CompletableFuture<Void> commit(List<DocumentWrite> writes, EntityId entityId, PendingMutation mark) {
        CompletableFuture<Void> result;
        try {
            result = remoteStore.commit(writes);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.whenComplete((ignored, error) -> {
            if (error != null) {
                onWriteFailed(entityId, mark, unwrap(error));
            }
        });
    }

    /**
     * 쓰기 실패 복구.
     *
     * <pre>
     * 1. 이 쓰기가 등록한 대기 항목(또는 재정렬 플래그)만 즉시 제거
     *    (같은 엔티티에 더 최근 쓰기가 등록되어 있으면 그 항목은 유지)
     * 2. (레인) 실패한 생성은 로컬 목록에서 제거 (더 최근 쓰기가 대기 중이면 유지)
     * 3. (레인) 마지막 원격 스냅샷으로 재병합 후 게시
     * 4. (레인) 관찰자에게 WriteFailed 전달
     * </pre>
     */
    private void onWriteFailed(EntityId entityId, PendingMutation mark, Throwable error) {
        MutationKind kind = mark.kind();
        FailureReason reason = error instanceof RemoteStoreException
            ? ((RemoteStoreException) error).getReason()
            : FailureReason.UNKNOWN;
        String message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : error.getClass().getSimpleName();
        log.warn("Write failed on {}: {} {} ({}): {}", key, kind, entityId, reason, message);

        if (kind == MutationKind.REORDER_BATCH) {
            tracker.clearReorder(key, mark);
        } else {
            tracker.clear(entityId, mark);
        }

        WriteFailed failure = new WriteFailed(entityId, kind, reason, message);
        try {
            lanes.submit(key, () -> {
                restoreAfterFailure(entityId, kind);
                notifyFailure(failure);
            });
        } catch (IllegalStateException e) {
            log.warn("Write failure recovery for {} dropped: {}", key, e.getMessage());
        }
    }

    private void restoreAfterFailure(EntityId entityId, MutationKind kind) {
        if (closed.get()) {
            return;
        }
        synchronized (stateLock) {
            List<T> base = current;
            if (kind == MutationKind.CREATE && !tracker.isActive(entityId)) {
                int index = indexOf(base, entityId);
                if (index >= 0) {
                    List<T> next = new ArrayList<>(base);
                    next.remove(index);
                    base = next;
                }
            }
            List<RemoteDocument<T>> remote = lastRemote;
            if (remote != null) {
                base = reconciler.reconcile(key, base, remote).entities();
            }
            replace(base);
        }
    }

    // ============================================================
    // 내부 처리 (stateLock 보유)
    // ============================================================

    private void replace(List<T> next) {
        List<T> snapshot = List.copyOf(next);
        current = snapshot;
        for (CollectionObserver<T> observer : observers) {
            notifyChange(observer, snapshot);
        }
    }

    private List<T> sortUnlessReordering(List<T> entities) {
        if (!tracker.isReorderActive(key)) {
            entities.sort(SyncEntity.ORDERING);
        }
        return entities;
    }

    private void requireSameMembers(List<T> reordered) {
        Set<EntityId> expected = new HashSet<>();
        for (T entity : current) {
            expected.add(entity.id());
        }
        Set<EntityId> actual = new HashSet<>();
        for (T entity : reordered) {
            if (entity == null || !actual.add(entity.id())) {
                throw new IllegalArgumentException("reordered list contains null or duplicate entities");
            }
        }
        if (!expected.equals(actual)) {
            throw new IllegalArgumentException("reordered list must contain exactly the current entities");
        }
    }

    private void requireOpen() {
        if (closed.get()) {
            throw new IllegalStateException("collection is closed: " + key);
        }
    }

    private void notifyChange(CollectionObserver<T> observer, List<T> entities) {
        try {
            observer.onChange(entities);
        } catch (RuntimeException e) {
            log.error("Collection observer failed for {}", key, e);
        }
    }

    private void notifyFailure(SyncFailure failure) {
        for (CollectionObserver<T> observer : observers) {
            try {
                observer.onFailure(failure);
            } catch (RuntimeException e) {
                log.error("Collection observer failed on failure for {}", key, e);
            }
        }
    }

    private static int indexOf(List<? extends SyncEntity> entities, EntityId id) {
        for (int i = 0; i < entities.size(); i++) {
            if (entities.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
