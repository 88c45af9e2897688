package com.ryuqq.livesync.core.model;

/**
 * 구독 우선순위.
 *
 * <p>ResourceGovernor의 퇴출(eviction) 대상 판별에 사용됩니다.
 * {@link #LOW} 우선순위 구독만 유휴 퇴출 및 메모리 압박 퇴출의 대상이 됩니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public enum SubscriptionPriority {

    /**
     * 낮음 (자주 변경되는 하위 데이터, 퇴출 대상).
     */
    LOW,

    /**
     * 보통 (기본값).
     */
    MEDIUM,

    /**
     * 높음 (최상위 데이터, 퇴출되지 않음).
     */
    HIGH;

    /**
     * 리소스 압박 시 퇴출 가능한 우선순위인지 확인.
     *
     * @return LOW인 경우 true
     */
    public boolean isEvictable() {
        return this == LOW;
    }
}
