/**
 * Runner Adapter Layer - LiveSync 런타임 구현체.
 *
 * <p>이 패키지는 application 계층 인터페이스의 구체적인 구현체와 구성 루트를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.livesync.adapter.runner.DefaultSubscriptionRegistry} - 중복 제거 구독 레지스트리</li>
 *   <li>{@link com.ryuqq.livesync.adapter.runner.CollectionSynchronizer} - 낙관적 동기화 컬렉션</li>
 *   <li>{@link com.ryuqq.livesync.adapter.runner.ResourceGovernor} - 유휴/메모리 기반 구독 정리</li>
 *   <li>{@link com.ryuqq.livesync.adapter.runner.GovernorScheduler} - 거버너 주기 실행</li>
 *   <li>{@link com.ryuqq.livesync.adapter.runner.KeyedSerialExecutor} - 구독 키별 직렬 전달 레인</li>
 *   <li>{@link com.ryuqq.livesync.adapter.runner.LiveSyncEngine} - 구성 루트</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultSubscriptionRegistry, CollectionSynchronizer, ResourceGovernor)
 *   ↓ implements
 * application (SubscriptionRegistry, SyncedCollection, SubscriptionOptimizer)
 *   ↓ depends on
 * core (QueryDescriptor, SubscriptionKey, SnapshotReconciler, SyncFailure)
 *   ↓ depends on
 * core/spi (RemoteStore, PendingMutationTracker, DocumentCodec)
 * </pre>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.adapter.runner;
