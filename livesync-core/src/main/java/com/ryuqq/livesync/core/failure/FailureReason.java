package com.ryuqq.livesync.core.failure;

/**
 * 원격 저장소 실패 원인 분류.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public enum FailureReason {

    /**
     * 권한 없음 (보안 규칙 거부).
     */
    PERMISSION_DENIED,

    /**
     * 일시적 네트워크/서비스 장애.
     */
    UNAVAILABLE,

    /**
     * 잘못된 쿼리 (인덱스 누락, 잘못된 경로 등).
     */
    INVALID_QUERY,

    /**
     * 문서 충돌 또는 존재하지 않는 문서에 대한 쓰기.
     */
    CONFLICT,

    /**
     * 분류 불가.
     */
    UNKNOWN;

    /**
     * 동일 요청을 나중에 다시 시도하면 성공할 가능성이 있는지 확인.
     *
     * <p>이 계층은 재시도하지 않으며, 호출자의 재시도 정책 판단용으로만 제공됩니다.</p>
     *
     * @return UNAVAILABLE인 경우 true
     */
    public boolean isTransient() {
        return this == UNAVAILABLE;
    }
}
