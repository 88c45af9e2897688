package com.ryuqq.livesync.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ResourceGovernor 주기 실행기.
 *
 * <p>단일 데몬 스레드에서 scanIntervalMs 간격으로 {@link ResourceGovernor#optimize()}를 호출합니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class GovernorScheduler {

    private static final Logger log = LoggerFactory.getLogger(GovernorScheduler.class);

    private final ResourceGovernor governor;
    private final long intervalMs;
    private final AtomicBoolean started;
    private ScheduledExecutorService scheduler;

    public GovernorScheduler(ResourceGovernor governor) {
        if (governor == null) {
            throw new IllegalArgumentException("governor cannot be null");
        }
        this.governor = governor;
        this.intervalMs = governor.config().scanIntervalMs();
        this.started = new AtomicBoolean();
    }

    /**
     * 주기 실행 시작. 이미 시작된 경우 no-op.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "livesync-governor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Governor scheduler started: every {}ms", intervalMs);
    }

    /**
     * 주기 실행 중지. 시작되지 않은 경우 no-op.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public synchronized void stop() throws InterruptedException {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
        log.info("Governor scheduler stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * 예외가 주기 실행을 중단시키지 않도록 감쌉니다.
     */
    private void runOnce() {
        try {
            governor.optimize();
        } catch (RuntimeException e) {
            log.error("Scheduled governor optimize failed", e);
        }
    }
}
