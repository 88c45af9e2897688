package com.ryuqq.livesync.core.reconcile;

import com.ryuqq.livesync.core.model.SyncEntity;

import java.util.List;

/**
 * 병합 결과 목록과 디버그용 카운터.
 *
 * <p>entities는 식별자 기준으로 중복이 없으며, 재정렬 플래그가 없는 한
 * {@link SyncEntity#ORDERING} 순서로 정렬되어 있습니다.</p>
 *
 * @param entities 병합된 엔티티 목록 (불변)
 * @param keptLocal 활성 CREATE/UPDATE 항목 때문에 로컬 버전을 유지한 수
 * @param takenRemote 원격 버전으로 교체한 수
 * @param retained 원격 스냅샷에 없어 이전 로컬 항목을 그대로 둔 수
 * @param appended 원격에서 새로 나타나 추가된 수
 * @param suppressed hasPendingWrites 또는 활성 DELETE 항목 때문에 무시된 원격 문서 수
 * @param orderPreserved 재정렬 플래그로 인해 정렬을 생략했는지 여부 (보류된 결과는 병합하지 않았으므로 false)
 * @param heldForPending 빈 스냅샷을 활성 항목 때문에 무시하고 이전 목록을 반환했는지 여부
 * @param <T> 엔티티 타입
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record ReconciledList<T extends SyncEntity>(
    List<T> entities,
    int keptLocal,
    int takenRemote,
    int retained,
    int appended,
    int suppressed,
    boolean orderPreserved,
    boolean heldForPending
) {

    public ReconciledList {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        entities = List.copyOf(entities);
    }

    /**
     * 빈 원격 스냅샷을 무시하고 이전 목록을 유지한 결과.
     */
    static <T extends SyncEntity> ReconciledList<T> held(List<T> previous) {
        return new ReconciledList<>(previous, 0, 0, previous.size(), 0, 0, false, true);
    }

    /**
     * 빈 원격 스냅샷을 그대로 반영한 결과.
     */
    static <T extends SyncEntity> ReconciledList<T> cleared() {
        return new ReconciledList<>(List.of(), 0, 0, 0, 0, 0, false, false);
    }

    public int size() {
        return entities.size();
    }
}
