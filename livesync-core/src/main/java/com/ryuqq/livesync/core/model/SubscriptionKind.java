package com.ryuqq.livesync.core.model;

/**
 * 구독 대상 도메인 분류.
 *
 * <p>분류별 기본 우선순위 테이블을 가지며, 통계/리포트와 분류 단위 일괄 해제에 사용됩니다.</p>
 *
 * <p><strong>기본 우선순위:</strong></p>
 * <pre>
 * PROJECT   → HIGH
 * PHASE     → MEDIUM
 * TASK_LIST → MEDIUM
 * TASK      → LOW   (빈번한 변경)
 * SUBTASK   → LOW
 * FAMILY    → MEDIUM
 * USER      → MEDIUM
 * </pre>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public enum SubscriptionKind {

    PROJECT(SubscriptionPriority.HIGH),
    PHASE(SubscriptionPriority.MEDIUM),
    TASK_LIST(SubscriptionPriority.MEDIUM),
    TASK(SubscriptionPriority.LOW),
    SUBTASK(SubscriptionPriority.LOW),
    FAMILY(SubscriptionPriority.MEDIUM),
    USER(SubscriptionPriority.MEDIUM);

    private final SubscriptionPriority defaultPriority;

    SubscriptionKind(SubscriptionPriority defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    /**
     * 분류별 기본 우선순위 조회.
     *
     * @return 기본 우선순위
     */
    public SubscriptionPriority defaultPriority() {
        return defaultPriority;
    }
}
