package com.ryuqq.livesync.adapter.runner;

import com.ryuqq.livesync.application.registry.RegistryStatistics;
import com.ryuqq.livesync.application.registry.SubscriptionMetadata;
import com.ryuqq.livesync.application.registry.SubscriptionOptimizer;
import com.ryuqq.livesync.application.registry.SubscriptionRegistry;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ResourceGovernor 컴포넌트.
 *
 * <p>활성 구독 수와 메모리 사용을 제한하기 위해 LOW 우선순위 구독을 퇴출합니다.
 * 퇴출은 {@link SubscriptionRegistry#unsubscribe(SubscriptionKey)}로만 수행하며,
 * lastOptimizedAt 외에는 상태를 갖지 않습니다.</p>
 *
 * <p><strong>호출 시점:</strong></p>
 * <ul>
 *   <li>레지스트리 활성 수가 highWaterMark 초과 → {@link #onHighWaterMarkExceeded(int)} → optimize</li>
 *   <li>{@link GovernorScheduler}의 주기 실행 → optimize</li>
 *   <li>OS 메모리 경고 → {@link #onMemoryPressure()}</li>
 *   <li>메모리 사용량 보고 → {@link #adjustForMemoryUsage(double)}</li>
 * </ul>
 *
 * <p><strong>퇴출 규칙:</strong></p>
 * <ul>
 *   <li>optimize: LOW 이면서 마지막 접근 후 idleThreshold를 넘긴 구독</li>
 *   <li>memory pressure: 유휴 시간과 무관하게 모든 LOW 구독, 이후 캐시 정리 훅 실행</li>
 *   <li>MEDIUM/HIGH 구독은 퇴출하지 않음</li>
 * </ul>
 *
 * <p>항목별 퇴출 실패는 로깅 후 다음 항목으로 계속 진행합니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class ResourceGovernor implements SubscriptionOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ResourceGovernor.class);

    /**
     * 메모리 사용량 보고에 대한 처리 결과.
     */
    public enum MemoryResponse {
        NONE,
        OPTIMIZED,
        PRESSURE_HANDLED
    }

    private final SubscriptionRegistry registry;
    private final GovernorConfig config;
    private final Clock clock;
    private final List<Runnable> cacheClearHooks;
    private volatile Instant lastOptimizedAt;

    /**
     * 생성자.
     *
     * @param registry 구독 레지스트리
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ResourceGovernor(SubscriptionRegistry registry, GovernorConfig config, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.config = config;
        this.clock = clock;
        this.cacheClearHooks = new CopyOnWriteArrayList<>();
    }

    /**
     * 유휴 LOW 구독 퇴출.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. registry.metadata() → 활성 구독 스냅샷
     * 2. LOW && idle > idleThresholdMs 인 항목 unsubscribe
     * 3. 하나 이상 퇴출되면 lastOptimizedAt 기록
     * </pre>
     *
     * @return 퇴출된 구독 키
     */
    public List<SubscriptionKey> optimize() {
        log.info("Governor optimize started");

        Instant now = clock.instant();
        List<SubscriptionMetadata> active = registry.metadata();
        List<SubscriptionKey> evicted = new ArrayList<>();
        for (SubscriptionMetadata metadata : active) {
            if (!metadata.priority().isEvictable()) {
                continue;
            }
            if (metadata.idleTime(now).toMillis() > config.idleThresholdMs() && tryEvict(metadata)) {
                evicted.add(metadata.key());
            }
        }

        if (!evicted.isEmpty()) {
            lastOptimizedAt = now;
        }
        log.info("Governor optimize completed: {} evicted out of {} active", evicted.size(), active.size());
        return List.copyOf(evicted);
    }

    /**
     * 메모리 압박 처리: 모든 LOW 구독 퇴출 후 캐시 정리 훅 실행.
     *
     * @return 퇴출된 구독 키
     */
    public List<SubscriptionKey> onMemoryPressure() {
        log.warn("Memory pressure: evicting all LOW priority subscriptions");

        List<SubscriptionMetadata> active = registry.metadata();
        List<SubscriptionKey> evicted = new ArrayList<>();
        for (SubscriptionMetadata metadata : active) {
            if (metadata.priority().isEvictable() && tryEvict(metadata)) {
                evicted.add(metadata.key());
            }
        }

        int hooksRun = 0;
        for (Runnable hook : cacheClearHooks) {
            try {
                hook.run();
                hooksRun++;
            } catch (RuntimeException e) {
                log.error("Cache clear hook failed during memory pressure", e);
            }
        }

        log.info("Memory pressure handled: {} evicted out of {} active, {} cache hooks run",
            evicted.size(), active.size(), hooksRun);
        return List.copyOf(evicted);
    }

    /**
     * 보고된 메모리 사용량에 따라 단계별 정리.
     *
     * <ul>
     *   <li>criticalMemoryMb 초과 → {@link #onMemoryPressure()}</li>
     *   <li>moderateMemoryMb 초과 → {@link #optimize()}</li>
     *   <li>그 외 → 아무것도 하지 않음</li>
     * </ul>
     *
     * @param usedMemoryMb 현재 메모리 사용량 (MB)
     * @return 수행한 처리
     */
    public MemoryResponse adjustForMemoryUsage(double usedMemoryMb) {
        if (usedMemoryMb > config.criticalMemoryMb()) {
            onMemoryPressure();
            return MemoryResponse.PRESSURE_HANDLED;
        }
        if (usedMemoryMb > config.moderateMemoryMb()) {
            optimize();
            return MemoryResponse.OPTIMIZED;
        }
        return MemoryResponse.NONE;
    }

    /**
     * 레지스트리 상한 초과 시 optimize 실행.
     */
    @Override
    public void onHighWaterMarkExceeded(int activeCount) {
        log.info("High-water mark exceeded with {} active subscriptions, optimizing", activeCount);
        optimize();
    }

    /**
     * 메모리 압박 시 실행할 보조 캐시 정리 훅 등록.
     */
    public void addCacheClearHook(Runnable hook) {
        if (hook == null) {
            throw new IllegalArgumentException("hook cannot be null");
        }
        cacheClearHooks.add(hook);
    }

    public void removeCacheClearHook(Runnable hook) {
        cacheClearHooks.remove(hook);
    }

    /**
     * 마지막으로 구독을 퇴출한 최적화 시각.
     */
    public Optional<Instant> lastOptimizedAt() {
        return Optional.ofNullable(lastOptimizedAt);
    }

    public GovernorConfig config() {
        return config;
    }

    /**
     * 사람이 읽을 수 있는 구독 현황 리포트.
     *
     * <p>합계, 추정 메모리, 마지막 최적화 시각, 분류별 수(많은 순),
     * 구독별 마지막 접근 경과 시간과 접근 횟수(최근 접근 순)를 포함합니다.</p>
     *
     * @return 리포트 문자열
     */
    public String report() {
        Instant now = clock.instant();
        RegistryStatistics statistics = registry.statistics();
        List<SubscriptionMetadata> active = new ArrayList<>(registry.metadata());

        StringBuilder report = new StringBuilder();
        report.append("LiveSync Subscription Report\n");
        report.append("============================\n");
        report.append("Total Active Subscriptions: ").append(statistics.totalActive()).append('\n');
        report.append(String.format(Locale.ROOT, "Estimated Memory: %.1fMB\n", statistics.estimatedMemoryMb()));
        Instant optimized = lastOptimizedAt;
        if (optimized != null) {
            report.append("Last Optimized: ").append(optimized).append('\n');
        }

        report.append("\nBy Kind:\n");
        List<Map.Entry<SubscriptionKind, Integer>> byKind = new ArrayList<>(statistics.byKind().entrySet());
        byKind.sort(Map.Entry.<SubscriptionKind, Integer>comparingByValue().reversed()
            .thenComparing(Map.Entry.<SubscriptionKind, Integer>comparingByKey()));
        for (Map.Entry<SubscriptionKind, Integer> entry : byKind) {
            report.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }

        report.append("\nActive Subscriptions:\n");
        active.sort(Comparator.comparing(SubscriptionMetadata::lastAccessedAt).reversed());
        for (SubscriptionMetadata metadata : active) {
            report.append("  [").append(metadata.kind()).append("] ")
                .append(metadata.key().getValue())
                .append(" - Accessed: ").append(metadata.idleTime(now).toSeconds()).append("s ago (")
                .append(metadata.accessCount()).append(" times)\n");
        }
        return report.toString();
    }

    /**
     * 개별 구독 퇴출 시도.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 항목 퇴출을 방해하지 않습니다.</p>
     */
    private boolean tryEvict(SubscriptionMetadata metadata) {
        try {
            boolean removed = registry.unsubscribe(metadata.key());
            if (removed) {
                log.info("Governor evicted {} ({}, idle {}s)", metadata.key(), metadata.kind(),
                    metadata.idleTime(clock.instant()).toSeconds());
            }
            return removed;
        } catch (Exception e) {
            log.error("Failed to evict {} in governor sweep", metadata.key(), e);
            return false;
        }
    }
}
