package com.ryuqq.livesync.application.registry;

import com.ryuqq.livesync.core.model.SubscriptionKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 레지스트리 통계.
 *
 * <p>estimatedMemoryMb는 {@code totalActive × 구독당 추정 메모리}로 계산되는 휴리스틱 값입니다.</p>
 *
 * @param totalActive 활성 구독 수
 * @param byKind 분류별 활성 구독 수 (0인 분류는 포함하지 않음)
 * @param estimatedMemoryMb 추정 메모리 (MB)
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record RegistryStatistics(
    int totalActive,
    Map<SubscriptionKind, Integer> byKind,
    double estimatedMemoryMb
) {

    public RegistryStatistics {
        if (totalActive < 0) {
            throw new IllegalArgumentException("totalActive cannot be negative, but was: " + totalActive);
        }
        if (byKind == null) {
            throw new IllegalArgumentException("byKind cannot be null");
        }
        byKind = byKind.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(byKind));
    }

    /**
     * 분류별 활성 구독 수.
     *
     * @return 해당 분류가 없으면 0
     */
    public int count(SubscriptionKind kind) {
        return byKind.getOrDefault(kind, 0);
    }
}
