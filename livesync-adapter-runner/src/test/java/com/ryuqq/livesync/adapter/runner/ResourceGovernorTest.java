package com.ryuqq.livesync.adapter.runner;

import com.ryuqq.livesync.application.registry.RegistryStatistics;
import com.ryuqq.livesync.application.registry.SubscriptionMetadata;
import com.ryuqq.livesync.application.registry.SubscriptionRegistry;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResourceGovernor 유닛 테스트.
 *
 * <p>거버너의 구독 정리 동작을 검증합니다:</p>
 * <ul>
 *   <li>유휴 LOW 구독 퇴출 (임계값 경계)</li>
 *   <li>HIGH/MEDIUM 구독 보존</li>
 *   <li>메모리 압박 처리와 캐시 정리 훅</li>
 *   <li>메모리 사용량 단계별 처리</li>
 *   <li>리포트 형식</li>
 *   <li>예외 발생 시에도 계속 진행</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceGovernorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SubscriptionRegistry registry;

    private ResourceGovernor governor;

    @BeforeEach
    void setUp() {
        governor = new ResourceGovernor(registry, new GovernorConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ============================================================
    // 1. 유휴 LOW 구독 퇴출
    // ============================================================

    @Test
    void optimize_300초를_넘긴_LOW_구독은_퇴출함() {
        // given
        SubscriptionMetadata idle = metadata("tasks-a", SubscriptionKind.TASK, SubscriptionPriority.LOW, 301);
        when(registry.metadata()).thenReturn(List.of(idle));
        when(registry.unsubscribe(idle.key())).thenReturn(true);

        // when
        List<SubscriptionKey> evicted = governor.optimize();

        // then
        assertThat(evicted).containsExactly(idle.key());
        verify(registry).unsubscribe(idle.key());
    }

    @Test
    void optimize_임계값_이내의_LOW_구독은_유지함() {
        // given
        SubscriptionMetadata recent = metadata("tasks-a", SubscriptionKind.TASK, SubscriptionPriority.LOW, 299);
        when(registry.metadata()).thenReturn(List.of(recent));

        // when
        List<SubscriptionKey> evicted = governor.optimize();

        // then
        assertThat(evicted).isEmpty();
        verify(registry, never()).unsubscribe(any(SubscriptionKey.class));
    }

    @Test
    void optimize_HIGH_MEDIUM_구독은_유휴시간과_무관하게_유지함() {
        // given
        SubscriptionMetadata project = metadata("projects", SubscriptionKind.PROJECT, SubscriptionPriority.HIGH, 3600);
        SubscriptionMetadata phases = metadata("phases", SubscriptionKind.PHASE, SubscriptionPriority.MEDIUM, 3600);
        when(registry.metadata()).thenReturn(List.of(project, phases));

        // when
        List<SubscriptionKey> evicted = governor.optimize();

        // then
        assertThat(evicted).isEmpty();
        verify(registry, never()).unsubscribe(any(SubscriptionKey.class));
    }

    @Test
    void optimize_TASK_종류라도_HIGH로_등록되면_퇴출하지_않음() {
        // given
        SubscriptionMetadata pinned = metadata("tasks-pinned", SubscriptionKind.TASK, SubscriptionPriority.HIGH, 3600);
        when(registry.metadata()).thenReturn(List.of(pinned));

        // when
        List<SubscriptionKey> evicted = governor.optimize();

        // then
        assertThat(evicted).isEmpty();
    }

    @Test
    void optimize_퇴출이_있을_때만_lastOptimizedAt을_기록함() {
        // given
        SubscriptionMetadata recent = metadata("tasks-a", SubscriptionKind.TASK, SubscriptionPriority.LOW, 10);
        SubscriptionMetadata idle = metadata("tasks-b", SubscriptionKind.TASK, SubscriptionPriority.LOW, 600);
        when(registry.metadata()).thenReturn(List.of(recent)).thenReturn(List.of(recent, idle));
        when(registry.unsubscribe(idle.key())).thenReturn(true);

        // when
        governor.optimize();

        // then
        assertThat(governor.lastOptimizedAt()).isEmpty();

        // when
        governor.optimize();

        // then
        assertThat(governor.lastOptimizedAt()).contains(NOW);
    }

    @Test
    void optimize_이미_해제된_구독은_퇴출_목록에서_제외함() {
        // given
        SubscriptionMetadata idle = metadata("tasks-a", SubscriptionKind.TASK, SubscriptionPriority.LOW, 600);
        when(registry.metadata()).thenReturn(List.of(idle));
        when(registry.unsubscribe(idle.key())).thenReturn(false);

        // when
        List<SubscriptionKey> evicted = governor.optimize();

        // then
        assertThat(evicted).isEmpty();
        assertThat(governor.lastOptimizedAt()).isEmpty();
    }

    // ============================================================
    // 2. 예외 발생 시에도 계속 진행
    // ============================================================

    @Test
    void optimize_개별_퇴출_예외가_발생해도_나머지를_처리함() {
        // given
        SubscriptionMetadata broken = metadata("tasks-broken", SubscriptionKind.TASK, SubscriptionPriority.LOW, 600);
        SubscriptionMetadata idle = metadata("tasks-idle", SubscriptionKind.SUBTASK, SubscriptionPriority.LOW, 600);
        when(registry.metadata()).thenReturn(List.of(broken, idle));
        when(registry.unsubscribe(broken.key())).thenThrow(new IllegalStateException("feed close failed"));
        when(registry.unsubscribe(idle.key())).thenReturn(true);

        // when
        List<SubscriptionKey> evicted = governor.optimize();

        // then
        assertThat(evicted).containsExactly(idle.key());
    }

    // ============================================================
    // 3. 메모리 압박
    // ============================================================

    @Test
    void onMemoryPressure_유휴시간과_무관하게_모든_LOW_구독을_퇴출함() {
        // given
        SubscriptionMetadata fresh = metadata("tasks-a", SubscriptionKind.TASK, SubscriptionPriority.LOW, 0);
        SubscriptionMetadata project = metadata("projects", SubscriptionKind.PROJECT, SubscriptionPriority.HIGH, 0);
        when(registry.metadata()).thenReturn(List.of(fresh, project));
        when(registry.unsubscribe(fresh.key())).thenReturn(true);

        // when
        List<SubscriptionKey> evicted = governor.onMemoryPressure();

        // then
        assertThat(evicted).containsExactly(fresh.key());
        verify(registry, never()).unsubscribe(project.key());
    }

    @Test
    void onMemoryPressure_캐시_정리_훅을_실행하고_실패한_훅은_건너뜀() {
        // given
        when(registry.metadata()).thenReturn(List.of());
        AtomicInteger cleared = new AtomicInteger();
        governor.addCacheClearHook(() -> {
            throw new IllegalStateException("cache busy");
        });
        governor.addCacheClearHook(cleared::incrementAndGet);

        // when
        governor.onMemoryPressure();

        // then
        assertThat(cleared.get()).isEqualTo(1);
    }

    @Test
    void removeCacheClearHook_제거된_훅은_실행되지_않음() {
        // given
        when(registry.metadata()).thenReturn(List.of());
        AtomicInteger cleared = new AtomicInteger();
        Runnable hook = cleared::incrementAndGet;
        governor.addCacheClearHook(hook);
        governor.removeCacheClearHook(hook);

        // when
        governor.onMemoryPressure();

        // then
        assertThat(cleared.get()).isZero();
    }

    // ============================================================
    // 4. 메모리 사용량 단계별 처리
    // ============================================================

    @Test
    void adjustForMemoryUsage_200MB_초과면_메모리_압박_처리() {
        // given
        when(registry.metadata()).thenReturn(List.of());

        // when & then
        assertThat(governor.adjustForMemoryUsage(250)).isEqualTo(ResourceGovernor.MemoryResponse.PRESSURE_HANDLED);
    }

    @Test
    void adjustForMemoryUsage_150MB_초과_200MB_이하면_optimize() {
        // given
        when(registry.metadata()).thenReturn(List.of());

        // when & then
        assertThat(governor.adjustForMemoryUsage(200)).isEqualTo(ResourceGovernor.MemoryResponse.OPTIMIZED);
        assertThat(governor.adjustForMemoryUsage(150.5)).isEqualTo(ResourceGovernor.MemoryResponse.OPTIMIZED);
    }

    @Test
    void adjustForMemoryUsage_150MB_이하면_아무것도_하지_않음() {
        // when
        ResourceGovernor.MemoryResponse response = governor.adjustForMemoryUsage(150);

        // then
        assertThat(response).isEqualTo(ResourceGovernor.MemoryResponse.NONE);
        verify(registry, never()).metadata();
    }

    @Test
    void onHighWaterMarkExceeded_optimize를_실행함() {
        // given
        SubscriptionMetadata idle = metadata("tasks-a", SubscriptionKind.TASK, SubscriptionPriority.LOW, 900);
        when(registry.metadata()).thenReturn(List.of(idle));
        when(registry.unsubscribe(idle.key())).thenReturn(true);

        // when
        governor.onHighWaterMarkExceeded(16);

        // then
        verify(registry).unsubscribe(idle.key());
    }

    // ============================================================
    // 5. 리포트
    // ============================================================

    @Test
    void report_합계_분류별_수_구독별_접근_정보를_포함함() {
        // given
        SubscriptionMetadata project = metadata("projects?~memberIds=s:u1", SubscriptionKind.PROJECT,
            SubscriptionPriority.HIGH, 5);
        SubscriptionMetadata tasksA = metadata("tasks-a", SubscriptionKind.TASK, SubscriptionPriority.LOW, 42);
        SubscriptionMetadata tasksB = metadata("tasks-b", SubscriptionKind.TASK, SubscriptionPriority.LOW, 120);
        when(registry.metadata()).thenReturn(List.of(tasksB, project, tasksA));
        when(registry.statistics()).thenReturn(new RegistryStatistics(3,
            Map.of(SubscriptionKind.PROJECT, 1, SubscriptionKind.TASK, 2), 1.5));

        // when
        String report = governor.report();

        // then
        assertThat(report)
            .startsWith("LiveSync Subscription Report\n")
            .contains("Total Active Subscriptions: 3\n")
            .contains("Estimated Memory: 1.5MB\n")
            .doesNotContain("Last Optimized")
            .contains("By Kind:\n  TASK: 2\n  PROJECT: 1\n")
            .contains("  [PROJECT] projects?~memberIds=s:u1 - Accessed: 5s ago (1 times)\n")
            .contains("  [TASK] tasks-a - Accessed: 42s ago (1 times)\n");

        // 최근 접근 순
        assertThat(report.indexOf("[PROJECT]")).isLessThan(report.indexOf("tasks-a"));
        assertThat(report.indexOf("tasks-a")).isLessThan(report.indexOf("tasks-b"));
    }

    // ============================================================
    // 6. 생성자 검증
    // ============================================================

    @Test
    void constructor_null_인자는_예외() {
        assertThatThrownBy(() -> new ResourceGovernor(null, new GovernorConfig(), Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("registry");
        assertThatThrownBy(() -> new ResourceGovernor(registry, null, Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResourceGovernor(registry, new GovernorConfig(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static SubscriptionMetadata metadata(String key, SubscriptionKind kind,
                                                 SubscriptionPriority priority, long idleSeconds) {
        Instant lastAccessed = NOW.minusSeconds(idleSeconds);
        return new SubscriptionMetadata(SubscriptionKey.of(key), kind, priority, key,
            lastAccessed.minusSeconds(60), lastAccessed, 1);
    }
}
