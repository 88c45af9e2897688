package com.ryuqq.livesync.core.pending;

import com.ryuqq.livesync.core.model.EntityId;

/**
 * 원격 확인을 기다리는 로컬 쓰기 한 건.
 *
 * <p>엔티티 단위 항목은 entityId를 가지며, REORDER_BATCH 항목은 entityId 없이
 * 컬렉션 단위 플래그로만 사용됩니다.</p>
 *
 * <p><strong>만료 규칙:</strong> {@code now - registeredAtMillis < ttlMillis} 인 동안 활성.
 * 조회 시 지연 평가되며, 별도 sweep에서도 동일한 {@link #isActive(long, long)}를 사용합니다.</p>
 *
 * @param entityId 대상 엔티티 (REORDER_BATCH는 null)
 * @param kind 쓰기 종류
 * @param registeredAtMillis 등록 시각 (epoch millis)
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record PendingMutation(
    EntityId entityId,
    MutationKind kind,
    long registeredAtMillis
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 kind와 entityId 유무가 맞지 않는 경우
     */
    public PendingMutation {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.isEntityScoped() && entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null for " + kind);
        }
        if (!kind.isEntityScoped() && entityId != null) {
            throw new IllegalArgumentException("REORDER_BATCH must not carry an entityId");
        }
        if (registeredAtMillis < 0) {
            throw new IllegalArgumentException("registeredAtMillis cannot be negative, but was: " + registeredAtMillis);
        }
    }

    /**
     * 엔티티 단위 항목 생성.
     */
    public static PendingMutation forEntity(EntityId entityId, MutationKind kind, long nowMillis) {
        return new PendingMutation(entityId, kind, nowMillis);
    }

    /**
     * 컬렉션 재정렬 플래그 생성.
     */
    public static PendingMutation reorder(long nowMillis) {
        return new PendingMutation(null, MutationKind.REORDER_BATCH, nowMillis);
    }

    /**
     * 주어진 시각에 아직 유효한지 확인.
     *
     * @param nowMillis 현재 시각 (epoch millis)
     * @param ttlMillis TTL (밀리초)
     * @return 만료되지 않았으면 true
     */
    public boolean isActive(long nowMillis, long ttlMillis) {
        return nowMillis - registeredAtMillis < ttlMillis;
    }
}
