package com.ryuqq.livesync.adapter.runner;

import com.ryuqq.livesync.core.model.SubscriptionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 구독 키별 직렬 실행기.
 *
 * <p>같은 키로 제출된 작업은 제출 순서대로 하나씩 실행되고, 다른 키의 작업은 공유 스레드 풀에서 병렬로 실행됩니다.
 * 키마다 마지막 작업의 future(tail)만 보관하며, 새 작업은 tail 뒤에 연결됩니다.
 * 레인이 비면 tail이 제거되므로 키 수만큼 스레드나 큐가 늘어나지 않습니다.</p>
 *
 * <p><strong>예외 처리:</strong> 작업에서 발생한 예외는 로깅 후 무시되며, 같은 레인의 다음 작업은 계속 실행됩니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class KeyedSerialExecutor {

    private static final Logger log = LoggerFactory.getLogger(KeyedSerialExecutor.class);

    private final ExecutorService pool;
    private final ConcurrentHashMap<SubscriptionKey, CompletableFuture<Void>> tails;
    private volatile boolean shutdown;

    /**
     * 생성자.
     *
     * @param threads 공유 스레드 수
     * @throws IllegalArgumentException threads가 1 미만인 경우
     */
    public KeyedSerialExecutor(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive, but was: " + threads);
        }
        this.pool = Executors.newFixedThreadPool(threads, new DeliveryThreadFactory());
        this.tails = new ConcurrentHashMap<>();
    }

    /**
     * 키의 레인 끝에 작업 추가.
     *
     * @param key 구독 키
     * @param task 작업
     * @return 작업 완료 future (작업 예외와 무관하게 정상 완료)
     * @throws IllegalStateException 종료된 경우
     */
    public CompletableFuture<Void> submit(SubscriptionKey key, Runnable task) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("executor is shut down");
        }

        AtomicReference<CompletableFuture<Void>> submitted = new AtomicReference<>();
        tails.compute(key, (k, tail) -> {
            CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            CompletableFuture<Void> next = previous.thenRunAsync(() -> runSafely(k, task), pool);
            submitted.set(next);
            return next;
        });

        CompletableFuture<Void> next = submitted.get();
        next.whenComplete((ignored, error) -> tails.remove(key, next));
        return next;
    }

    /**
     * 현재 대기 중인 모든 레인의 완료 future.
     *
     * @return 호출 시점의 모든 tail이 끝나면 완료되는 future
     */
    public CompletableFuture<Void> flush() {
        return CompletableFuture.allOf(tails.values().toArray(new CompletableFuture[0]));
    }

    /**
     * 활성 레인 수 (진단용).
     */
    public int activeLanes() {
        return tails.size();
    }

    /**
     * 종료.
     *
     * <p>새 작업을 거부하고, 진행 중인 작업이 끝나기를 최대 5초 기다립니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        shutdown = true;
        pool.shutdown();
        if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
            pool.shutdownNow();
        }
        tails.clear();
    }

    private static void runSafely(SubscriptionKey key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Delivery task failed for {}", key, e);
        }
    }

    private static final class DeliveryThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "livesync-delivery-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
