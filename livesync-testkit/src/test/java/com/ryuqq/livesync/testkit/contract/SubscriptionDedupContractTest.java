package com.ryuqq.livesync.testkit.contract;

import com.ryuqq.livesync.application.collection.SyncedCollection;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for subscription deduplication and teardown.
 *
 * <p>This test validates that equal queries share one remote change feed, and that
 * unsubscribing is idempotent and stops delivery.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Same query opened twice → one remote feed, both collections populated</li>
 *   <li>Concurrent opens of the same query → exactly one remote subscribe</li>
 *   <li>Unsubscribe twice → second call is a no-op</li>
 *   <li>Remote changes after unsubscribe → not delivered</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
class SubscriptionDedupContractTest extends AbstractSyncContractTest {

    @Test
    void testSameQuery_OpenedTwice_SharesOneFeed() {
        // Given
        seedTask("l1", TestTask.of("t1", 1, "first"));

        // When
        SyncedCollection<TestTask> first = openTasks("l1");
        SyncedCollection<TestTask> second = openTasks("l1");

        // Then
        assertEquals(first.key(), second.key(), "Equal queries should map to the same key");
        assertEquals(1, remoteStore.subscribeCallCount(), "Only one remote subscribe should be issued");
        assertEquals(1, remoteStore.openFeedCount(tasksQuery("l1").collectionPath()));
        assertEquals(1, engine.statistics().totalActive());
        assertTitles(first, "first");
        assertTitles(second, "first");
    }

    @Test
    void testSameQuery_OpenedConcurrently_OnlyOneRemoteSubscribe() throws InterruptedException {
        // Given
        int threads = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        AtomicInteger failures = new AtomicInteger(0);

        // When: all threads open the same query at once
        for (int i = 0; i < threads; i++) {
            new Thread(() -> {
                try {
                    startLatch.await();
                    openTasks("l1");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            }).start();
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "All openers should finish");

        // Then
        assertEquals(0, failures.get(), "No opener should fail");
        assertEquals(1, remoteStore.subscribeCallCount(), "Concurrent opens must not duplicate the feed");
        assertEquals(1, engine.statistics().totalActive());
        assertTrue(engine.registry().metadata(tasksQuery("l1").toKey()).orElseThrow().accessCount() >= threads,
            "Every open should be counted as an access");
    }

    @Test
    void testUnsubscribe_CalledTwice_SecondIsNoOp() {
        // Given
        SyncedCollection<TestTask> tasks = openTasks("l1");
        SubscriptionKey key = tasks.key();
        assertSubscribed(key);

        // When
        boolean first = engine.registry().unsubscribe(key);
        boolean second = engine.registry().unsubscribe(key);

        // Then
        assertTrue(first, "First unsubscribe should remove the subscription");
        assertFalse(second, "Second unsubscribe should report nothing removed");
        assertNotSubscribed(key);
        assertEquals(0, remoteStore.openFeedCount());
    }

    @Test
    void testUnsubscribe_RemoteChangesAfterwards_NotDelivered() {
        // Given
        seedTask("l1", TestTask.of("t1", 1, "first"));
        SyncedCollection<TestTask> tasks = openTasks("l1");
        assertTitles(tasks, "first");

        // When
        tasks.close();
        seedTask("l1", TestTask.of("t2", 2, "second"));
        awaitDelivery();

        // Then
        assertNotSubscribed(tasks.key());
        assertTitles(tasks, "first");
    }

    @Test
    void testResubscribe_AfterUnsubscribe_OpensFreshFeed() {
        // Given
        seedTask("l1", TestTask.of("t1", 1, "first"));
        SyncedCollection<TestTask> original = openTasks("l1");
        original.close();

        // When
        seedTask("l1", TestTask.of("t2", 2, "second"));
        SyncedCollection<TestTask> reopened = openTasks("l1");

        // Then
        assertEquals(2, remoteStore.subscribeCallCount(), "A closed feed should not be reused");
        awaitTitles(reopened, "first", "second");
    }
}
