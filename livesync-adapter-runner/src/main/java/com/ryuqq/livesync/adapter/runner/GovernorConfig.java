package com.ryuqq.livesync.adapter.runner;

/**
 * ResourceGovernor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>idleThresholdMs: 유휴 퇴출 임계값 (기본 300000ms = 5분)</li>
 *   <li>scanIntervalMs: 주기 최적화 간격 (기본 60000ms = 1분)</li>
 *   <li>moderateMemoryMb: 이 값을 넘으면 optimize (기본 150MB)</li>
 *   <li>criticalMemoryMb: 이 값을 넘으면 메모리 압박 처리 (기본 200MB)</li>
 * </ul>
 *
 * <p>유휴 퇴출은 LOW 우선순위 구독에만 적용됩니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 * @param idleThresholdMs 유휴 임계값 (밀리초, 양수)
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수)
 * @param moderateMemoryMb 최적화 임계 메모리 (MB, 양수)
 * @param criticalMemoryMb 압박 임계 메모리 (MB, moderateMemoryMb 이상)
 */
public record GovernorConfig(
    long idleThresholdMs,
    long scanIntervalMs,
    double moderateMemoryMb,
    double criticalMemoryMb
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: idleThresholdMs=300000ms (5분), scanIntervalMs=60000ms (1분),
     * moderateMemoryMb=150, criticalMemoryMb=200</p>
     */
    public GovernorConfig() {
        this(300000, 60000, 150, 200);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GovernorConfig {
        if (idleThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "idleThresholdMs must be positive (current: " + idleThresholdMs + ")"
            );
        }
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (!(moderateMemoryMb > 0)) {
            throw new IllegalArgumentException(
                "moderateMemoryMb must be positive (current: " + moderateMemoryMb + ")"
            );
        }
        if (!(criticalMemoryMb >= moderateMemoryMb)) {
            throw new IllegalArgumentException(
                "criticalMemoryMb must be >= moderateMemoryMb (current: " + criticalMemoryMb + ")"
            );
        }
    }

    /**
     * idleThresholdMs만 변경한 새 인스턴스 생성.
     */
    public GovernorConfig withIdleThresholdMs(long idleThresholdMs) {
        return new GovernorConfig(idleThresholdMs, scanIntervalMs, moderateMemoryMb, criticalMemoryMb);
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public GovernorConfig withScanIntervalMs(long scanIntervalMs) {
        return new GovernorConfig(idleThresholdMs, scanIntervalMs, moderateMemoryMb, criticalMemoryMb);
    }

    /**
     * 메모리 임계값만 변경한 새 인스턴스 생성.
     */
    public GovernorConfig withMemoryThresholds(double moderateMemoryMb, double criticalMemoryMb) {
        return new GovernorConfig(idleThresholdMs, scanIntervalMs, moderateMemoryMb, criticalMemoryMb);
    }
}
