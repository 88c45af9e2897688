package com.ryuqq.livesync.adapter.runner;

import com.ryuqq.livesync.application.collection.SyncedCollection;
import com.ryuqq.livesync.application.registry.RegistryStatistics;
import com.ryuqq.livesync.application.registry.SubscriptionRegistry;
import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.QueryDescriptor;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;
import com.ryuqq.livesync.core.model.SyncEntity;
import com.ryuqq.livesync.core.pending.MutationKind;
import com.ryuqq.livesync.core.pending.PendingMutation;
import com.ryuqq.livesync.core.spi.DocumentCodec;
import com.ryuqq.livesync.core.spi.PendingMutationTracker;
import com.ryuqq.livesync.core.spi.RemoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * LiveSync 구성 루트.
 *
 * <p>레지스트리, 대기 변경 추적기, 리소스 거버너, 전달 실행기를 명시적으로 조립하고
 * 수명 주기를 관리합니다. 전역 싱글톤이 아니며 애플리케이션이 직접 생성/종료합니다.</p>
 *
 * <p><strong>수명 주기:</strong></p>
 * <pre>
 * NEW ──start()──→ RUNNING ──shutdown()──→ STOPPED
 * </pre>
 * <ul>
 *   <li>start(): 주기 거버너 시작 (설정된 경우)</li>
 *   <li>shutdown(): 스케줄러 중지 → 모든 구독 해제 → 전달 실행기 종료</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LiveSyncEngine engine = LiveSyncEngine.builder(remoteStore, new InMemoryPendingMutationTracker())
 *     .registryConfig(new RegistryConfig().withHighWaterMark(20))
 *     .periodicGovernor(true)
 *     .build();
 * engine.start();
 *
 * SyncedCollection&lt;Task&gt; tasks = engine.collection(
 *     QueryDescriptor.tasks("p1", "ph1", "l1"), SubscriptionKind.TASK, taskCodec);
 * tasks.addObserver(list -&gt; render(list));
 * </pre>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class LiveSyncEngine {

    private static final Logger log = LoggerFactory.getLogger(LiveSyncEngine.class);

    enum State { NEW, RUNNING, STOPPED }

    private final RemoteStore remoteStore;
    private final PendingMutationTracker tracker;
    private final KeyedSerialExecutor delivery;
    private final DefaultSubscriptionRegistry registry;
    private final ResourceGovernor governor;
    private final GovernorScheduler scheduler;
    private final boolean periodicGovernor;
    private final AtomicReference<State> state;

    private LiveSyncEngine(Builder builder) {
        this.remoteStore = builder.remoteStore;
        this.tracker = builder.tracker;
        this.delivery = new KeyedSerialExecutor(builder.registryConfig.deliveryThreads());
        this.registry = new DefaultSubscriptionRegistry(remoteStore, delivery, builder.registryConfig, builder.clock);
        this.governor = new ResourceGovernor(registry, builder.governorConfig, builder.clock);
        this.registry.setOptimizer(governor);
        this.scheduler = new GovernorScheduler(governor);
        this.periodicGovernor = builder.periodicGovernor;
        this.state = new AtomicReference<>(State.NEW);
    }

    public static Builder builder(RemoteStore remoteStore, PendingMutationTracker tracker) {
        return new Builder(remoteStore, tracker);
    }

    /**
     * 엔진 시작.
     *
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("engine cannot be started from state " + state.get());
        }
        if (periodicGovernor) {
            scheduler.start();
        }
        log.info("LiveSync engine started (periodicGovernor={})", periodicGovernor);
    }

    /**
     * 엔진 종료. 두 번째 호출부터는 no-op.
     *
     * @throws InterruptedException 실행기 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        scheduler.stop();
        int removed = registry.shutdown();
        delivery.shutdown();
        log.info("LiveSync engine stopped: {} subscriptions removed", removed);
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /**
     * 쿼리에 대한 동기화 컬렉션을 열고 구독.
     *
     * <p>우선순위는 종류의 기본값을 사용합니다.</p>
     */
    public <T extends SyncEntity> SyncedCollection<T> collection(
        QueryDescriptor query, SubscriptionKind kind, DocumentCodec<T> codec) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return collection(query, kind, kind.defaultPriority(), codec);
    }

    /**
     * 쿼리에 대한 동기화 컬렉션을 열고 구독.
     *
     * @throws IllegalStateException 엔진이 실행 중이 아닌 경우
     */
    public <T extends SyncEntity> SyncedCollection<T> collection(
        QueryDescriptor query, SubscriptionKind kind, SubscriptionPriority priority, DocumentCodec<T> codec) {
        requireRunning();
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        CollectionSynchronizer<T> collection =
            new CollectionSynchronizer<>(registry, remoteStore, tracker, delivery, query, codec);
        collection.open(kind, priority);
        return collection;
    }

    // ============================================================
    // 소비자 API 위임
    // ============================================================

    public PendingMutation markPending(EntityId entityId, MutationKind kind) {
        return tracker.markPending(entityId, kind);
    }

    public PendingMutation markReorderPending(SubscriptionKey scope) {
        return tracker.markReorderPending(scope);
    }

    public RegistryStatistics statistics() {
        return registry.statistics();
    }

    public String report() {
        return governor.report();
    }

    public List<SubscriptionKey> onMemoryPressure() {
        return governor.onMemoryPressure();
    }

    public ResourceGovernor.MemoryResponse adjustForMemoryUsage(double usedMemoryMb) {
        return governor.adjustForMemoryUsage(usedMemoryMb);
    }

    public SubscriptionRegistry registry() {
        return registry;
    }

    public ResourceGovernor governor() {
        return governor;
    }

    public PendingMutationTracker tracker() {
        return tracker;
    }

    /**
     * 모든 전달 레인의 현재 작업이 끝나면 완료되는 future. 테스트 동기화용.
     */
    public CompletableFuture<Void> flushDelivery() {
        return delivery.flush();
    }

    private void requireRunning() {
        if (state.get() != State.RUNNING) {
            throw new IllegalStateException("engine is not running: " + state.get());
        }
    }

    /**
     * LiveSyncEngine 빌더.
     */
    public static final class Builder {

        private final RemoteStore remoteStore;
        private final PendingMutationTracker tracker;
        private RegistryConfig registryConfig = new RegistryConfig();
        private GovernorConfig governorConfig = new GovernorConfig();
        private Clock clock = Clock.systemUTC();
        private boolean periodicGovernor;

        private Builder(RemoteStore remoteStore, PendingMutationTracker tracker) {
            if (remoteStore == null) {
                throw new IllegalArgumentException("remoteStore cannot be null");
            }
            if (tracker == null) {
                throw new IllegalArgumentException("tracker cannot be null");
            }
            this.remoteStore = remoteStore;
            this.tracker = tracker;
        }

        public Builder registryConfig(RegistryConfig registryConfig) {
            if (registryConfig == null) {
                throw new IllegalArgumentException("registryConfig cannot be null");
            }
            this.registryConfig = registryConfig;
            return this;
        }

        public Builder governorConfig(GovernorConfig governorConfig) {
            if (governorConfig == null) {
                throw new IllegalArgumentException("governorConfig cannot be null");
            }
            this.governorConfig = governorConfig;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        public Builder periodicGovernor(boolean periodicGovernor) {
            this.periodicGovernor = periodicGovernor;
            return this;
        }

        public LiveSyncEngine build() {
            return new LiveSyncEngine(this);
        }
    }
}
