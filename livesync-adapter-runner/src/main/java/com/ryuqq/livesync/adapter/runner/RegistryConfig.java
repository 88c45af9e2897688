package com.ryuqq.livesync.adapter.runner;

/**
 * SubscriptionRegistry 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>highWaterMark: 이 수를 넘으면 최적화기 호출 (기본 15)</li>
 *   <li>memoryPerSubscriptionMb: 구독당 추정 메모리 (기본 0.5MB)</li>
 *   <li>deliveryThreads: 스냅샷 전달 스레드 수 (기본 4)</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 * @param highWaterMark 활성 구독 상한 (1 이상)
 * @param memoryPerSubscriptionMb 구독당 추정 메모리 (0 이상)
 * @param deliveryThreads 전달 스레드 수 (1 이상)
 */
public record RegistryConfig(
    int highWaterMark,
    double memoryPerSubscriptionMb,
    int deliveryThreads
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: highWaterMark=15, memoryPerSubscriptionMb=0.5, deliveryThreads=4</p>
     */
    public RegistryConfig() {
        this(15, 0.5, 4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RegistryConfig {
        if (highWaterMark <= 0) {
            throw new IllegalArgumentException(
                "highWaterMark must be positive (current: " + highWaterMark + ")"
            );
        }
        if (memoryPerSubscriptionMb < 0 || Double.isNaN(memoryPerSubscriptionMb)) {
            throw new IllegalArgumentException(
                "memoryPerSubscriptionMb must not be negative (current: " + memoryPerSubscriptionMb + ")"
            );
        }
        if (deliveryThreads <= 0) {
            throw new IllegalArgumentException(
                "deliveryThreads must be positive (current: " + deliveryThreads + ")"
            );
        }
    }

    public RegistryConfig withHighWaterMark(int highWaterMark) {
        return new RegistryConfig(highWaterMark, memoryPerSubscriptionMb, deliveryThreads);
    }

    public RegistryConfig withMemoryPerSubscriptionMb(double memoryPerSubscriptionMb) {
        return new RegistryConfig(highWaterMark, memoryPerSubscriptionMb, deliveryThreads);
    }

    public RegistryConfig withDeliveryThreads(int deliveryThreads) {
        return new RegistryConfig(highWaterMark, memoryPerSubscriptionMb, deliveryThreads);
    }
}
