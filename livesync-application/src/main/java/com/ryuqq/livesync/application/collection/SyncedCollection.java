package com.ryuqq.livesync.application.collection;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SyncEntity;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 원격 피드와 동기화되는 로컬 엔티티 목록.
 *
 * <p>원격 스냅샷이 도착할 때마다 이전 목록과 병합하여 관찰자에게 게시하며,
 * 낙관적 쓰기(create/update/delete/reorder)를 제공합니다.</p>
 *
 * <p><strong>낙관적 쓰기 흐름:</strong></p>
 * <pre>
 * 1. 로컬 목록 즉시 변경 → 관찰자 게시
 * 2. PendingMutationTracker에 기록
 * 3. RemoteStore.commit 호출
 * 4-a. 성공: 아무것도 하지 않음 (TTL 만료 후 원격 값이 기준)
 * 4-b. 실패: 대기 항목 제거 → 마지막 원격 스냅샷으로 재병합 → 관찰자에 WriteFailed 전달
 * </pre>
 *
 * <p>반환되는 future는 원격 쓰기 결과를 나타내며, 실패 시 RemoteStoreException으로 완료됩니다.
 * 로컬 목록 반영은 메서드 반환 전에 이미 끝나 있습니다.</p>
 *
 * @param <T> 엔티티 타입
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface SyncedCollection<T extends SyncEntity> {

    /**
     * 동기화 대상 구독 키.
     */
    SubscriptionKey key();

    /**
     * 현재 병합 목록.
     *
     * @return 불변 목록
     */
    List<T> current();

    /**
     * 관찰자 등록. 등록 즉시 현재 목록이 한 번 전달됩니다.
     */
    void addObserver(CollectionObserver<T> observer);

    /**
     * 관찰자 해제.
     */
    void removeObserver(CollectionObserver<T> observer);

    /**
     * 낙관적 생성.
     *
     * @param entity 새 엔티티 (식별자는 호출자가 미리 발급)
     * @return 원격 쓰기 완료
     * @throws IllegalArgumentException 같은 식별자가 이미 목록에 있는 경우
     */
    CompletableFuture<Void> create(T entity);

    /**
     * 낙관적 수정.
     *
     * @param entity 수정된 엔티티
     * @return 원격 쓰기 완료
     * @throws IllegalArgumentException 목록에 없는 엔티티인 경우
     */
    CompletableFuture<Void> update(T entity);

    /**
     * 낙관적 삭제. 목록에 없으면 원격 삭제만 수행합니다.
     *
     * @param entityId 삭제할 엔티티
     * @return 원격 쓰기 완료
     */
    CompletableFuture<Void> delete(EntityId entityId);

    /**
     * 낙관적 재정렬.
     *
     * <p>주어진 순서를 그대로 로컬 목록에 반영하고, 각 엔티티의 order가 갱신된 것으로 간주하여
     * 일괄 쓰기를 보냅니다. TTL 동안 원격 order 기준 정렬이 생략됩니다.</p>
     *
     * @param reordered 새 순서의 전체 목록 (order 값이 갱신된 엔티티)
     * @return 원격 쓰기 완료
     */
    CompletableFuture<Void> reorder(List<T> reordered);

    /**
     * 구독 해제 및 관찰자 제거.
     */
    void close();
}
