package com.ryuqq.livesync.testkit.contract;

import com.ryuqq.livesync.adapter.inmemory.pending.InMemoryPendingMutationTracker;
import com.ryuqq.livesync.adapter.inmemory.store.InMemoryRemoteStore;
import com.ryuqq.livesync.adapter.runner.GovernorConfig;
import com.ryuqq.livesync.adapter.runner.LiveSyncEngine;
import com.ryuqq.livesync.adapter.runner.RegistryConfig;
import com.ryuqq.livesync.application.collection.SyncedCollection;
import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.QueryDescriptor;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.spi.PendingMutationTracker;
import com.ryuqq.livesync.core.spi.RawDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class wires a {@link LiveSyncEngine} over in-memory SPI implementations
 * and a {@link MutableClock}, and provides helpers for sync scenarios.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryRemoteStore: Remote document store with change feeds, held writes and failure injection</li>
 *   <li>InMemoryPendingMutationTracker: Pending-write tracking with a 5 second TTL</li>
 *   <li>MutableClock: Manually advanced time shared by tracker, registry and governor</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractSyncContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         seedTask("l1", TestTask.of("t1", 1, "first"));
 *         SyncedCollection&lt;TestTask&gt; tasks = openTasks("l1");
 *         awaitTitles(tasks, "first");
 *     }
 * }
 * </pre>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public abstract class AbstractSyncContractTest {

    /**
     * Pending-write TTL used by the contract fixture.
     */
    protected static final Duration TTL = PendingMutationTracker.DEFAULT_TTL;

    protected static final String PROJECT_ID = "p1";
    protected static final String PHASE_ID = "ph1";

    protected MutableClock clock;
    protected InMemoryRemoteStore remoteStore;
    protected InMemoryPendingMutationTracker tracker;
    protected LiveSyncEngine engine;

    private final List<SyncedCollection<?>> opened = new CopyOnWriteArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all SPI implementations and starts the engine.</p>
     */
    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        remoteStore = new InMemoryRemoteStore();
        tracker = new InMemoryPendingMutationTracker(clock, TTL);
        engine = LiveSyncEngine.builder(remoteStore, tracker)
            .clock(clock)
            .registryConfig(registryConfig())
            .governorConfig(governorConfig())
            .build();
        engine.start();
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Closes opened collections, shuts the engine down and clears all in-memory state.</p>
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        for (SyncedCollection<?> collection : opened) {
            collection.close();
        }
        opened.clear();
        if (engine != null) {
            engine.shutdown();
        }
        if (remoteStore != null) {
            remoteStore.clear();
        }
        if (tracker != null) {
            tracker.clear();
        }
    }

    /**
     * Registry configuration for the fixture. Override to change the high-water mark.
     */
    protected RegistryConfig registryConfig() {
        return new RegistryConfig();
    }

    /**
     * Governor configuration for the fixture.
     */
    protected GovernorConfig governorConfig() {
        return new GovernorConfig();
    }

    /**
     * Returns the tasks query of a task list in the fixture project.
     */
    protected QueryDescriptor tasksQuery(String listId) {
        return QueryDescriptor.tasks(PROJECT_ID, PHASE_ID, listId);
    }

    /**
     * Opens a synced task collection and waits for its initial snapshot.
     *
     * @param listId the task list ID
     * @return the opened collection (closed automatically after the test)
     */
    protected SyncedCollection<TestTask> openTasks(String listId) {
        return open(tasksQuery(listId), SubscriptionKind.TASK);
    }

    /**
     * Opens a synced collection of {@link TestTask} documents at the kind's default priority.
     *
     * @param query the query to subscribe to
     * @param kind the subscription kind
     * @return the opened collection (closed automatically after the test)
     */
    protected SyncedCollection<TestTask> open(QueryDescriptor query, SubscriptionKind kind) {
        SyncedCollection<TestTask> collection = engine.collection(query, kind, new TestTaskCodec());
        opened.add(collection);
        awaitDelivery();
        return collection;
    }

    /**
     * Writes a task as if another client had committed it.
     */
    protected void seedTask(String listId, TestTask task) {
        remoteStore.put(tasksQuery(listId).collectionPath(), task.id(), task.fields());
    }

    /**
     * Pushes a snapshot built from the given tasks to every feed of the list.
     *
     * @param listId the task list ID
     * @param pendingWrites whether the documents carry the hasPendingWrites flag
     * @param tasks the snapshot contents, in delivery order
     */
    protected void pushTasks(String listId, boolean pendingWrites, TestTask... tasks) {
        List<RawDocument> documents = new ArrayList<>(tasks.length);
        for (TestTask task : tasks) {
            documents.add(new RawDocument(task.id(), task.fields(), pendingWrites));
        }
        remoteStore.pushSnapshot(tasksQuery(listId).collectionPath(), documents);
        awaitDelivery();
    }

    /**
     * Waits until every delivery lane has drained the work queued so far.
     */
    protected void awaitDelivery() {
        try {
            engine.flushDelivery().get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Delivery wait interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Delivery did not drain", e);
        }
    }

    /**
     * Waits until the collection shows exactly the given titles, in order.
     */
    protected void awaitTitles(SyncedCollection<TestTask> collection, String... titles) {
        List<String> expected = List.of(titles);
        await().atMost(Duration.ofSeconds(5)).until(() -> titlesOf(collection).equals(expected));
    }

    /**
     * Asserts that the collection currently shows exactly the given titles, in order.
     */
    protected void assertTitles(SyncedCollection<TestTask> collection, String... titles) {
        assertEquals(List.of(titles), titlesOf(collection),
            String.format("Unexpected contents of %s", collection.key()));
    }

    /**
     * Asserts that the registry holds an active subscription for the key.
     */
    protected void assertSubscribed(SubscriptionKey key) {
        assertTrue(engine.registry().isActive(key),
            String.format("Expected an active subscription for %s", key));
    }

    /**
     * Asserts that the registry holds no subscription for the key.
     */
    protected void assertNotSubscribed(SubscriptionKey key) {
        assertFalse(engine.registry().isActive(key),
            String.format("Expected no subscription for %s", key));
    }

    /**
     * Asserts that the tracker holds no active entry for the entity.
     */
    protected void assertNotPending(EntityId entityId) {
        assertFalse(tracker.isActive(entityId),
            String.format("Expected no pending mutation for %s", entityId));
    }

    protected static List<String> titlesOf(SyncedCollection<TestTask> collection) {
        List<String> titles = new ArrayList<>();
        for (TestTask task : collection.current()) {
            titles.add(task.title());
        }
        return titles;
    }
}
