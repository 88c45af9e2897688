package com.ryuqq.livesync.application.registry;

import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;

import java.time.Duration;
import java.time.Instant;

/**
 * 구독 메타데이터의 읽기 전용 스냅샷.
 *
 * @param key 구독 키
 * @param kind 구독 분류
 * @param priority 퇴출 우선순위
 * @param queryPath 쿼리 컬렉션 경로 (진단용)
 * @param createdAt 생성 시각
 * @param lastAccessedAt 마지막 접근 시각 (스냅샷 수신 또는 재구독)
 * @param accessCount 접근 횟수
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record SubscriptionMetadata(
    SubscriptionKey key,
    SubscriptionKind kind,
    SubscriptionPriority priority,
    String queryPath,
    Instant createdAt,
    Instant lastAccessedAt,
    long accessCount
) {

    public SubscriptionMetadata {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (createdAt == null || lastAccessedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        if (accessCount < 0) {
            throw new IllegalArgumentException("accessCount cannot be negative, but was: " + accessCount);
        }
    }

    /**
     * 마지막 접근 이후 경과 시간.
     *
     * @param now 현재 시각
     * @return 경과 시간 (음수가 되지 않음)
     */
    public Duration idleTime(Instant now) {
        Duration idle = Duration.between(lastAccessedAt, now);
        return idle.isNegative() ? Duration.ZERO : idle;
    }
}
