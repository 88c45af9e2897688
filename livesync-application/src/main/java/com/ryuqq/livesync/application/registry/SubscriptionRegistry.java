package com.ryuqq.livesync.application.registry;

import com.ryuqq.livesync.core.model.QueryDescriptor;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;
import com.ryuqq.livesync.core.model.SyncEntity;
import com.ryuqq.livesync.core.spi.DocumentCodec;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 원격 변경 피드 구독 레지스트리.
 *
 * <p>정규화된 쿼리 키({@link SubscriptionKey}) 하나당 원격 피드를 최대 하나만 유지하며,
 * 생성/재사용/해제/통계를 담당합니다.</p>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>중복 제거: 동시에 같은 키로 subscribe를 호출해도 원격 subscribe는 한 번만 호출됨</li>
 *   <li>멱등 해제: 없는 키에 대한 unsubscribe는 no-op</li>
 *   <li>해제 후 무전달: unsubscribe 반환 이후 해당 키의 콜백은 더 이상 스냅샷을 받지 않음</li>
 *   <li>실패 격리: 구독 실패는 해당 키의 콜백에만 전달되며, 레지스트리에 반쯤 열린 구독이 남지 않음</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 모든 메서드는 여러 스레드에서 동시에 호출할 수 있으며,
 * 네트워크 I/O로 블로킹되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SubscriptionHandle handle = registry.subscribe(
 *     QueryDescriptor.tasks("p1", "ph1", "l1"),
 *     SubscriptionKind.TASK,
 *     taskCodec,
 *     callback
 * );
 * ...
 * registry.unsubscribe(handle.getKey());
 * </pre>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface SubscriptionRegistry {

    /**
     * 구독 생성 또는 기존 구독 재사용.
     *
     * <p>같은 키의 활성 구독이 있으면 원격 저장소를 호출하지 않고 메타데이터만 갱신(touch)한 뒤
     * 콜백을 기존 피드에 추가합니다. 없으면 새 원격 피드를 엽니다.</p>
     *
     * <p>원격 저장소가 구독을 즉시 거부하면 callback.onFailure(SubscriptionFailed)가 호출되고
     * 반환된 핸들의 키는 활성 상태가 아닙니다.</p>
     *
     * @param query 구독할 쿼리
     * @param kind 구독 분류
     * @param priority 퇴출 우선순위 (신규 생성 시에만 적용)
     * @param codec 스냅샷 디코딩용 코덱
     * @param callback 스냅샷/실패 수신 콜백
     * @param <T> 엔티티 타입
     * @return 구독 핸들
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 레지스트리가 종료된 경우
     */
    <T extends SyncEntity> SubscriptionHandle subscribe(
        QueryDescriptor query,
        SubscriptionKind kind,
        SubscriptionPriority priority,
        DocumentCodec<T> codec,
        SnapshotCallback<T> callback
    );

    /**
     * 분류별 기본 우선순위로 구독.
     *
     * @see #subscribe(QueryDescriptor, SubscriptionKind, SubscriptionPriority, DocumentCodec, SnapshotCallback)
     */
    default <T extends SyncEntity> SubscriptionHandle subscribe(
        QueryDescriptor query,
        SubscriptionKind kind,
        DocumentCodec<T> codec,
        SnapshotCallback<T> callback
    ) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return subscribe(query, kind, kind.defaultPriority(), codec, callback);
    }

    /**
     * 구독 해제. 없는 키면 no-op.
     *
     * @param key 구독 키
     * @return 실제로 해제된 경우 true
     */
    boolean unsubscribe(SubscriptionKey key);

    /**
     * 여러 구독 일괄 해제.
     *
     * @param keys 구독 키 목록
     * @return 실제로 해제된 수
     */
    int unsubscribe(Collection<SubscriptionKey> keys);

    /**
     * 모든 구독 해제 (로그아웃/종료).
     *
     * @return 해제된 수
     */
    int unsubscribeAll();

    /**
     * 특정 분류의 구독 모두 해제.
     *
     * @param kind 구독 분류
     * @return 해제된 수
     */
    int unsubscribeByKind(SubscriptionKind kind);

    /**
     * 구독 활성 여부.
     */
    boolean isActive(SubscriptionKey key);

    /**
     * 모든 활성 구독의 메타데이터 스냅샷.
     *
     * @return 불변 목록 (순서 보장 없음)
     */
    List<SubscriptionMetadata> metadata();

    /**
     * 단일 구독 메타데이터.
     */
    Optional<SubscriptionMetadata> metadata(SubscriptionKey key);

    /**
     * 현재 구독 통계.
     */
    RegistryStatistics statistics();

    /**
     * 상한(high-water mark) 초과 시 호출될 최적화기 등록.
     *
     * @param optimizer 최적화기 (null이면 해제)
     */
    void setOptimizer(SubscriptionOptimizer optimizer);
}
