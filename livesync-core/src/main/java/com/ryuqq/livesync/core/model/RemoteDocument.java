package com.ryuqq.livesync.core.model;

/**
 * 원격 스냅샷에 포함된 디코딩된 문서.
 *
 * <p>hasPendingWrites는 원격 저장소가 직접 표시하는 플래그로,
 * 문서가 아직 커밋되지 않은 로컬 쓰기를 반영하고 있음을 의미합니다.
 * SnapshotReconciler는 이런 문서를 병합 대상에서 제외합니다.</p>
 *
 * @param id 문서 ID
 * @param entity 디코딩된 엔티티 (entity.id()는 id와 같아야 함)
 * @param hasPendingWrites 미확정 로컬 쓰기 반영 여부
 * @param <T> 엔티티 타입
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record RemoteDocument<T extends SyncEntity>(
    EntityId id,
    T entity,
    boolean hasPendingWrites
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id/entity가 null이거나 서로 다른 식별자를 가진 경우
     */
    public RemoteDocument {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (!id.equals(entity.id())) {
            throw new IllegalArgumentException("entity id " + entity.id() + " does not match document id " + id);
        }
    }

    /**
     * 확정된(committed) 원격 문서 생성.
     *
     * @param entity 엔티티
     * @param <T> 엔티티 타입
     * @return hasPendingWrites=false 인 RemoteDocument
     */
    public static <T extends SyncEntity> RemoteDocument<T> committed(T entity) {
        return new RemoteDocument<>(entity.id(), entity, false);
    }

    /**
     * 로컬 미확정 쓰기를 반영한 원격 문서 생성.
     *
     * @param entity 엔티티
     * @param <T> 엔티티 타입
     * @return hasPendingWrites=true 인 RemoteDocument
     */
    public static <T extends SyncEntity> RemoteDocument<T> pendingWrite(T entity) {
        return new RemoteDocument<>(entity.id(), entity, true);
    }
}
