package com.ryuqq.livesync.adapter.runner;

import com.ryuqq.livesync.application.registry.RegistryStatistics;
import com.ryuqq.livesync.application.registry.SnapshotCallback;
import com.ryuqq.livesync.application.registry.SubscriptionHandle;
import com.ryuqq.livesync.application.registry.SubscriptionMetadata;
import com.ryuqq.livesync.application.registry.SubscriptionOptimizer;
import com.ryuqq.livesync.application.registry.SubscriptionRegistry;
import com.ryuqq.livesync.core.failure.DecodeFailed;
import com.ryuqq.livesync.core.failure.FailureReason;
import com.ryuqq.livesync.core.failure.SubscriptionFailed;
import com.ryuqq.livesync.core.failure.SyncFailure;
import com.ryuqq.livesync.core.model.QueryDescriptor;
import com.ryuqq.livesync.core.model.RemoteDocument;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;
import com.ryuqq.livesync.core.model.SyncEntity;
import com.ryuqq.livesync.core.spi.DocumentCodec;
import com.ryuqq.livesync.core.spi.FeedListener;
import com.ryuqq.livesync.core.spi.FeedRegistration;
import com.ryuqq.livesync.core.spi.RawDocument;
import com.ryuqq.livesync.core.spi.RemoteStore;
import com.ryuqq.livesync.core.spi.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 기본 SubscriptionRegistry 구현.
 *
 * <p>구독 키당 하나의 {@link Entry}를 {@link ConcurrentHashMap}에 보관합니다.
 * 키별 원자성은 {@link ConcurrentHashMap#compute}로 보장하며, 원격 subscribe 호출은
 * 맵 잠금 밖에서 Entry를 처음 만든 스레드만 수행합니다.</p>
 *
 * <p><strong>구독 흐름:</strong></p>
 * <pre>
 * 1. compute(key):
 *    - 활성 Entry 존재 → 구독자 추가 + touch → REUSED
 *    - 없음 → 새 Entry(OPENING) 생성 + 구독자 추가
 * 2. (생성 스레드만) remoteStore.subscribe(query, listener)
 *    - 동기 거부 → Entry 제거 + 모든 구독자에 SubscriptionFailed → REJECTED
 *    - 성공 → FeedRegistration 바인딩 → CREATED
 * 3. 활성 수 > highWaterMark → 최적화기 호출
 * </pre>
 *
 * <p><strong>전달:</strong> 피드 스냅샷은 {@link KeyedSerialExecutor}의 키별 레인에서 구독자마다
 * 코덱으로 디코딩되어 전달됩니다. 전달 직전에 Entry의 closed 플래그를 확인하므로
 * unsubscribe 반환 이후에는 스냅샷이 전달되지 않습니다.</p>
 *
 * <p><strong>재사용 구독자:</strong> 이미 스냅샷을 받은 피드에 새 구독자가 붙으면
 * 마지막 스냅샷을 해당 구독자에게만 한 번 재전달합니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultSubscriptionRegistry.class);

    private final RemoteStore remoteStore;
    private final KeyedSerialExecutor delivery;
    private final RegistryConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<SubscriptionKey, Entry> entries;
    private volatile SubscriptionOptimizer optimizer;
    private volatile boolean shutdown;

    /**
     * 생성자.
     *
     * @param remoteStore 원격 저장소
     * @param delivery 키별 직렬 전달 실행기
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultSubscriptionRegistry(RemoteStore remoteStore, KeyedSerialExecutor delivery,
                                       RegistryConfig config, Clock clock) {
        if (remoteStore == null) {
            throw new IllegalArgumentException("remoteStore cannot be null");
        }
        if (delivery == null) {
            throw new IllegalArgumentException("delivery cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.remoteStore = remoteStore;
        this.delivery = delivery;
        this.config = config;
        this.clock = clock;
        this.entries = new ConcurrentHashMap<>();
    }

    @Override
    public <T extends SyncEntity> SubscriptionHandle subscribe(
        QueryDescriptor query,
        SubscriptionKind kind,
        SubscriptionPriority priority,
        DocumentCodec<T> codec,
        SnapshotCallback<T> callback
    ) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("registry is shut down");
        }

        SubscriptionKey key = query.toKey();
        Subscriber<T> subscriber = new Subscriber<>(key, codec, callback);
        AtomicBoolean created = new AtomicBoolean();

        Entry entry = entries.compute(key, (k, existing) -> {
            Instant now = clock.instant();
            if (existing != null && !existing.isClosed()) {
                existing.touch(now);
                existing.attach(subscriber);
                return existing;
            }
            created.set(true);
            Entry fresh = new Entry(k, query, kind, priority, now);
            fresh.attach(subscriber);
            return fresh;
        });

        if (!created.get()) {
            log.debug("Subscription reused: {} ({} subscribers)", key, entry.subscriberCount());
            return SubscriptionHandle.reused(key, entry.kind, entry.priority);
        }
        return open(entry);
    }

    private SubscriptionHandle open(Entry entry) {
        SubscriptionKey key = entry.key;
        FeedRegistration registration;
        try {
            registration = remoteStore.subscribe(entry.query, new EntryListener(entry));
        } catch (RemoteStoreException e) {
            fail(entry, new SubscriptionFailed(key, e.getReason(), messageOf(e)));
            return SubscriptionHandle.rejected(key, entry.kind, entry.priority);
        } catch (RuntimeException e) {
            log.error("Unexpected error while opening feed for {}", key, e);
            fail(entry, new SubscriptionFailed(key, FailureReason.UNKNOWN, messageOf(e)));
            return SubscriptionHandle.rejected(key, entry.kind, entry.priority);
        }

        if (!entry.bind(registration)) {
            closeQuietly(key, registration);
            if (entry.isFailed()) {
                return SubscriptionHandle.rejected(key, entry.kind, entry.priority);
            }
            return SubscriptionHandle.created(key, entry.kind, entry.priority);
        }

        int active = entries.size();
        log.info("Subscription created: {} ({}, {}), active={}", key, entry.kind, entry.priority, active);
        if (active > config.highWaterMark()) {
            notifyOptimizer(active);
        }
        return SubscriptionHandle.created(key, entry.kind, entry.priority);
    }

    private void notifyOptimizer(int active) {
        SubscriptionOptimizer current = optimizer;
        log.warn("Active subscriptions {} exceed high-water mark {}", active, config.highWaterMark());
        if (current == null) {
            return;
        }
        try {
            current.onHighWaterMarkExceeded(active);
        } catch (RuntimeException e) {
            log.error("Subscription optimizer failed", e);
        }
    }

    @Override
    public boolean unsubscribe(SubscriptionKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Entry entry = entries.remove(key);
        if (entry == null) {
            return false;
        }
        close(entry);
        log.info("Subscription removed: {} ({}, accessed {} times)", key, entry.kind, entry.accessCount.get());
        return true;
    }

    @Override
    public int unsubscribe(Collection<SubscriptionKey> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        int removed = 0;
        for (SubscriptionKey key : keys) {
            if (unsubscribe(key)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int unsubscribeAll() {
        int removed = unsubscribe(new ArrayList<>(entries.keySet()));
        log.info("All subscriptions removed: {}", removed);
        return removed;
    }

    @Override
    public int unsubscribeByKind(SubscriptionKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        List<SubscriptionKey> keys = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.kind == kind) {
                keys.add(entry.key);
            }
        }
        int removed = unsubscribe(keys);
        log.info("Subscriptions of kind {} removed: {}", kind, removed);
        return removed;
    }

    @Override
    public boolean isActive(SubscriptionKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Entry entry = entries.get(key);
        return entry != null && !entry.isClosed();
    }

    @Override
    public List<SubscriptionMetadata> metadata() {
        List<SubscriptionMetadata> result = new ArrayList<>();
        for (Entry entry : entries.values()) {
            result.add(entry.metadata());
        }
        return List.copyOf(result);
    }

    @Override
    public Optional<SubscriptionMetadata> metadata(SubscriptionKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(entries.get(key)).map(Entry::metadata);
    }

    @Override
    public RegistryStatistics statistics() {
        Map<SubscriptionKind, Integer> byKind = new EnumMap<>(SubscriptionKind.class);
        int total = 0;
        for (Entry entry : entries.values()) {
            byKind.merge(entry.kind, 1, Integer::sum);
            total++;
        }
        return new RegistryStatistics(total, byKind, total * config.memoryPerSubscriptionMb());
    }

    @Override
    public void setOptimizer(SubscriptionOptimizer optimizer) {
        this.optimizer = optimizer;
    }

    /**
     * 새 구독을 거부하고 모든 구독을 해제합니다.
     *
     * @return 해제된 구독 수
     */
    public int shutdown() {
        shutdown = true;
        return unsubscribeAll();
    }

    // ============================================================
    // 내부 처리
    // ============================================================

    /**
     * 피드 실패 처리: 맵에서 제거하고 피드를 닫은 뒤 모든 구독자에게 실패 전달.
     */
    private void fail(Entry entry, SubscriptionFailed failure) {
        List<Subscriber<?>> targets = entry.markFailed();
        if (targets == null) {
            return;
        }
        entries.remove(entry.key, entry);
        closeQuietly(entry.key, entry.unbind());
        log.warn("Subscription failed: {} ({}): {}", entry.key, failure.reason(), failure.message());
        submit(entry.key, () -> {
            for (Subscriber<?> subscriber : targets) {
                subscriber.notifyFailure(failure);
            }
        });
    }

    private void close(Entry entry) {
        entry.close();
        closeQuietly(entry.key, entry.unbind());
    }

    private void submit(SubscriptionKey key, Runnable task) {
        try {
            delivery.submit(key, task);
        } catch (IllegalStateException e) {
            log.warn("Delivery for {} dropped: {}", key, e.getMessage());
        }
    }

    private static void closeQuietly(SubscriptionKey key, FeedRegistration registration) {
        if (registration == null) {
            return;
        }
        try {
            registration.remove();
        } catch (RuntimeException e) {
            log.warn("Failed to close feed for {}", key, e);
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * 원격 피드 이벤트를 Entry로 전달하는 리스너.
     */
    private final class EntryListener implements FeedListener {

        private final Entry entry;

        private EntryListener(Entry entry) {
            this.entry = entry;
        }

        @Override
        public void onSnapshot(List<RawDocument> documents) {
            if (entry.isClosed()) {
                return;
            }
            entry.touch(clock.instant());
            entry.publish(List.copyOf(documents));
        }

        @Override
        public void onError(RemoteStoreException error) {
            fail(entry, new SubscriptionFailed(entry.key, error.getReason(), messageOf(error)));
        }
    }

    /**
     * 구독 키 하나의 상태: 메타데이터, 구독자 목록, 피드 등록, 마지막 스냅샷.
     *
     * <p>스냅샷 게시와 구독자 추가는 Entry 모니터 안에서 레인에 제출되므로,
     * 각 구독자가 받는 스냅샷 순서는 피드 순서와 같습니다.</p>
     */
    private final class Entry {

        private final SubscriptionKey key;
        private final QueryDescriptor query;
        private final SubscriptionKind kind;
        private final SubscriptionPriority priority;
        private final Instant createdAt;
        private final AtomicLong accessCount;
        private final List<Subscriber<?>> subscribers;
        private volatile Instant lastAccessedAt;
        private volatile boolean closed;
        private volatile boolean failed;
        private FeedRegistration registration;
        private List<RawDocument> lastSnapshot;

        private Entry(SubscriptionKey key, QueryDescriptor query, SubscriptionKind kind,
                      SubscriptionPriority priority, Instant now) {
            this.key = key;
            this.query = query;
            this.kind = kind;
            this.priority = priority;
            this.createdAt = now;
            this.lastAccessedAt = now;
            this.accessCount = new AtomicLong(1);
            this.subscribers = new CopyOnWriteArrayList<>();
        }

        boolean isClosed() {
            return closed;
        }

        boolean isFailed() {
            return failed;
        }

        int subscriberCount() {
            return subscribers.size();
        }

        void touch(Instant now) {
            lastAccessedAt = now;
            accessCount.incrementAndGet();
        }

        synchronized void attach(Subscriber<?> subscriber) {
            subscribers.add(subscriber);
            List<RawDocument> replay = lastSnapshot;
            if (replay != null) {
                submit(key, () -> deliver(List.of(subscriber), replay));
            }
        }

        synchronized void publish(List<RawDocument> documents) {
            if (closed) {
                return;
            }
            lastSnapshot = documents;
            List<Subscriber<?>> targets = List.copyOf(subscribers);
            submit(key, () -> deliver(targets, documents));
        }

        private void deliver(List<Subscriber<?>> targets, List<RawDocument> documents) {
            for (Subscriber<?> subscriber : targets) {
                if (closed) {
                    return;
                }
                subscriber.deliver(documents);
            }
        }

        synchronized boolean bind(FeedRegistration registration) {
            if (closed) {
                return false;
            }
            this.registration = registration;
            return true;
        }

        synchronized FeedRegistration unbind() {
            FeedRegistration current = registration;
            registration = null;
            return current;
        }

        synchronized void close() {
            closed = true;
            lastSnapshot = null;
        }

        /**
         * 실패로 닫기. 이미 닫힌 경우 null 반환.
         */
        synchronized List<Subscriber<?>> markFailed() {
            if (closed) {
                return null;
            }
            closed = true;
            failed = true;
            lastSnapshot = null;
            return List.copyOf(subscribers);
        }

        SubscriptionMetadata metadata() {
            return new SubscriptionMetadata(key, kind, priority, query.collectionPath(),
                createdAt, lastAccessedAt, accessCount.get());
        }
    }

    /**
     * 구독자 한 명: 코덱과 콜백.
     */
    private static final class Subscriber<T extends SyncEntity> {

        private final SubscriptionKey key;
        private final DocumentCodec<T> codec;
        private final SnapshotCallback<T> callback;

        private Subscriber(SubscriptionKey key, DocumentCodec<T> codec, SnapshotCallback<T> callback) {
            this.key = key;
            this.codec = codec;
            this.callback = callback;
        }

        void deliver(List<RawDocument> documents) {
            List<RemoteDocument<T>> decoded = new ArrayList<>(documents.size());
            for (RawDocument document : documents) {
                T entity;
                try {
                    entity = codec.decode(document);
                } catch (RuntimeException e) {
                    log.warn("Failed to decode {} for {}", document.id(), key, e);
                    notifyFailure(new DecodeFailed(key, document.id(), messageOf(e)));
                    return;
                }
                if (entity == null || !document.id().equals(entity.id())) {
                    notifyFailure(new DecodeFailed(key, document.id(), "decoded entity id does not match document id"));
                    return;
                }
                decoded.add(new RemoteDocument<>(document.id(), entity, document.hasPendingWrites()));
            }
            try {
                callback.onSnapshot(decoded);
            } catch (RuntimeException e) {
                log.error("Snapshot callback failed for {}", key, e);
            }
        }

        void notifyFailure(SyncFailure failure) {
            try {
                callback.onFailure(failure);
            } catch (RuntimeException e) {
                log.error("Failure callback failed for {}", key, e);
            }
        }
    }
}
