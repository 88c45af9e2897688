package com.ryuqq.livesync.application.registry;

/**
 * 활성 구독 수가 상한을 넘었을 때 레지스트리가 호출하는 최적화기.
 *
 * <p>레지스트리 내부 잠금 밖에서 호출되므로, 구현체는 레지스트리의 unsubscribe를 호출해도 됩니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SubscriptionOptimizer {

    /**
     * 상한 초과 알림.
     *
     * @param activeCount 현재 활성 구독 수
     */
    void onHighWaterMarkExceeded(int activeCount);
}
