package com.ryuqq.livesync.core.pending;

/**
 * 진행 중인 로컬 쓰기의 종류.
 *
 * <p><strong>병합 시 의미:</strong></p>
 * <ul>
 *   <li>CREATE / UPDATE: TTL 동안 로컬 버전이 원격 버전보다 우선</li>
 *   <li>DELETE: TTL 동안 원격 스냅샷에 남아 있는 문서를 무시 (부활 방지)</li>
 *   <li>REORDER_BATCH: 컬렉션 단위 플래그, TTL 동안 원격 order 재정렬 생략</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public enum MutationKind {

    CREATE,
    UPDATE,
    DELETE,
    REORDER_BATCH;

    /**
     * 활성 상태일 때 로컬 버전이 원격 버전을 덮어쓰는 종류인지 확인.
     *
     * @return CREATE 또는 UPDATE인 경우 true
     */
    public boolean isLocallyAuthoritative() {
        return this == CREATE || this == UPDATE;
    }

    /**
     * 엔티티 단위로 기록되는 종류인지 확인.
     *
     * @return REORDER_BATCH가 아닌 경우 true
     */
    public boolean isEntityScoped() {
        return this != REORDER_BATCH;
    }
}
