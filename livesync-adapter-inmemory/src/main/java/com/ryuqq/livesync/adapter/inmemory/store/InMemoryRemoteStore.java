package com.ryuqq.livesync.adapter.inmemory.store;

import com.ryuqq.livesync.core.failure.FailureReason;
import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.QueryDescriptor;
import com.ryuqq.livesync.core.spi.DocumentWrite;
import com.ryuqq.livesync.core.spi.FeedListener;
import com.ryuqq.livesync.core.spi.FeedRegistration;
import com.ryuqq.livesync.core.spi.RawDocument;
import com.ryuqq.livesync.core.spi.RemoteStore;
import com.ryuqq.livesync.core.spi.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link RemoteStore} for testing and reference purposes.
 *
 * <p>This implementation keeps every collection in memory and pushes a full snapshot
 * to each matching feed after every change. It also simulates the behaviours of a
 * hosted document store that the sync layer has to absorb.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Equality, array-contains and orderBy query evaluation</li>
 *   <li>Single-document feeds</li>
 *   <li>Write lag: {@link #holdWrites()} queues commits until {@link #flushHeldWrites()}</li>
 *   <li>Latency compensation: held writes are echoed to feeds with {@code hasPendingWrites=true}</li>
 *   <li>Failure injection: rejected subscriptions, failing commits, terminated feeds</li>
 *   <li>Server-side writes from "another device" via {@link #put} and {@link #remove}</li>
 * </ul>
 *
 * <p><strong>Delivery:</strong> snapshots are delivered synchronously on the thread that caused
 * the change, while holding the store lock, so each feed observes changes in commit order.
 * Listeners must not block.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRemoteStore store = new InMemoryRemoteStore();
 * store.put("projects/p1/phases", EntityId.of("ph1"), Map.of("order", 0, "name", "Plan"));
 *
 * store.holdWrites();
 * store.commit(List.of(DocumentWrite.set("projects/p1/phases", id, fields)));
 * // feeds receive an echo with hasPendingWrites=true
 * store.flushHeldWrites();
 * // feeds receive the committed snapshot
 * </pre>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public class InMemoryRemoteStore implements RemoteStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteStore.class);

    private final Object lock = new Object();

    /**
     * collectionPath → (documentId → fields), insertion ordered.
     */
    private final Map<String, Map<EntityId, Map<String, Object>>> collections;

    private final List<Feed> feeds;
    private final Map<String, FailureReason> rejectedPaths;
    private final Deque<HeldBatch> heldBatches;
    private final AtomicInteger subscribeCalls;
    private final AtomicInteger commitCalls;

    private boolean holdWrites;
    private boolean latencyCompensation;
    private FailureReason nextCommitFailure;

    /**
     * Creates an empty store with latency compensation enabled.
     */
    public InMemoryRemoteStore() {
        this.collections = new HashMap<>();
        this.feeds = new CopyOnWriteArrayList<>();
        this.rejectedPaths = new ConcurrentHashMap<>();
        this.heldBatches = new ArrayDeque<>();
        this.subscribeCalls = new AtomicInteger();
        this.commitCalls = new AtomicInteger();
        this.latencyCompensation = true;
    }

    // ============================================================
    // RemoteStore
    // ============================================================

    /**
     * {@inheritDoc}
     *
     * <p>The initial snapshot is delivered before this method returns.</p>
     */
    @Override
    public FeedRegistration subscribe(QueryDescriptor query, FeedListener listener) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        subscribeCalls.incrementAndGet();

        FailureReason rejection = rejectedPaths.get(query.collectionPath());
        if (rejection != null) {
            throw new RemoteStoreException(rejection, "subscription rejected for " + query.collectionPath());
        }

        Feed feed = new Feed(query, listener);
        synchronized (lock) {
            feeds.add(feed);
            deliver(feed, snapshot(query));
        }
        return feed;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Completes immediately unless writes are held or a failure was injected.</p>
     */
    @Override
    public CompletableFuture<Void> commit(List<DocumentWrite> writes) {
        if (writes == null || writes.isEmpty()) {
            throw new IllegalArgumentException("writes cannot be null or empty");
        }
        commitCalls.incrementAndGet();
        List<DocumentWrite> batch = List.copyOf(writes);

        synchronized (lock) {
            if (nextCommitFailure != null) {
                FailureReason reason = nextCommitFailure;
                nextCommitFailure = null;
                log.debug("Injected commit failure: {}", reason);
                return CompletableFuture.failedFuture(
                    new RemoteStoreException(reason, "commit rejected: " + reason));
            }
            if (holdWrites) {
                CompletableFuture<Void> future = new CompletableFuture<>();
                heldBatches.addLast(new HeldBatch(batch, future));
                if (latencyCompensation) {
                    notifyPaths(pathsOf(batch));
                }
                return future;
            }
            apply(batch);
            notifyPaths(pathsOf(batch));
        }
        return CompletableFuture.completedFuture(null);
    }

    // ============================================================
    // Write lag simulation
    // ============================================================

    /**
     * Queues subsequent commits until {@link #flushHeldWrites()} or {@link #failHeldWrites}.
     */
    public void holdWrites() {
        synchronized (lock) {
            holdWrites = true;
        }
    }

    /**
     * Applies every held batch in order, notifies feeds and completes the held futures.
     *
     * <p>Stops holding subsequent writes.</p>
     *
     * @return the number of batches applied
     */
    public int flushHeldWrites() {
        List<CompletableFuture<Void>> completed = new ArrayList<>();
        synchronized (lock) {
            holdWrites = false;
            Set<String> paths = new LinkedHashSet<>();
            while (!heldBatches.isEmpty()) {
                HeldBatch held = heldBatches.pollFirst();
                apply(held.writes());
                paths.addAll(pathsOf(held.writes()));
                completed.add(held.future());
            }
            notifyPaths(paths);
        }
        completed.forEach(f -> f.complete(null));
        return completed.size();
    }

    /**
     * Discards every held batch and completes the held futures exceptionally.
     *
     * <p>Feeds that saw latency-compensated echoes receive the committed state again.
     * Stops holding subsequent writes.</p>
     *
     * @param reason the failure reason reported to the writers
     * @return the number of batches rejected
     */
    public int failHeldWrites(FailureReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        List<CompletableFuture<Void>> rejected = new ArrayList<>();
        synchronized (lock) {
            holdWrites = false;
            Set<String> paths = new LinkedHashSet<>();
            while (!heldBatches.isEmpty()) {
                HeldBatch held = heldBatches.pollFirst();
                paths.addAll(pathsOf(held.writes()));
                rejected.add(held.future());
            }
            if (latencyCompensation) {
                notifyPaths(paths);
            }
        }
        rejected.forEach(f -> f.completeExceptionally(new RemoteStoreException(reason, "commit rejected: " + reason)));
        return rejected.size();
    }

    /**
     * Enables or disables echoing held writes to feeds with {@code hasPendingWrites=true}.
     */
    public void setLatencyCompensation(boolean enabled) {
        synchronized (lock) {
            latencyCompensation = enabled;
        }
    }

    // ============================================================
    // Failure injection
    // ============================================================

    /**
     * Makes every subsequent subscribe on the given collection path throw.
     *
     * @param collectionPath the collection path
     * @param reason the failure reason
     */
    public void rejectSubscriptions(String collectionPath, FailureReason reason) {
        if (collectionPath == null || reason == null) {
            throw new IllegalArgumentException("collectionPath and reason cannot be null");
        }
        rejectedPaths.put(collectionPath, reason);
    }

    /**
     * Lifts a rejection set with {@link #rejectSubscriptions}.
     */
    public void acceptSubscriptions(String collectionPath) {
        rejectedPaths.remove(collectionPath);
    }

    /**
     * Makes the next commit fail without applying any write.
     *
     * @param reason the failure reason
     */
    public void failNextCommit(FailureReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        synchronized (lock) {
            nextCommitFailure = reason;
        }
    }

    /**
     * Terminates every open feed on the given path with an error.
     *
     * @param collectionPath the collection path
     * @param reason the failure reason
     * @return the number of feeds terminated
     */
    public int failFeeds(String collectionPath, FailureReason reason) {
        if (collectionPath == null || reason == null) {
            throw new IllegalArgumentException("collectionPath and reason cannot be null");
        }
        int terminated = 0;
        synchronized (lock) {
            for (Feed feed : feeds) {
                if (!feed.query.collectionPath().equals(collectionPath)) {
                    continue;
                }
                feed.remove();
                terminated++;
                try {
                    feed.listener.onError(new RemoteStoreException(reason, "feed terminated: " + collectionPath));
                } catch (RuntimeException e) {
                    log.error("Feed listener failed on error for {}", collectionPath, e);
                }
            }
        }
        return terminated;
    }

    /**
     * Pushes an arbitrary snapshot to every open feed on the given path.
     *
     * <p>Used to simulate stale or out-of-order snapshots. The documents are delivered
     * verbatim, without query evaluation, and the stored state is not changed.</p>
     *
     * @param collectionPath the collection path
     * @param documents the documents to deliver
     */
    public void pushSnapshot(String collectionPath, List<RawDocument> documents) {
        if (collectionPath == null || documents == null) {
            throw new IllegalArgumentException("collectionPath and documents cannot be null");
        }
        List<RawDocument> copy = List.copyOf(documents);
        synchronized (lock) {
            for (Feed feed : feeds) {
                if (feed.query.collectionPath().equals(collectionPath)) {
                    deliver(feed, copy);
                }
            }
        }
    }

    // ============================================================
    // Server-side writes
    // ============================================================

    /**
     * Writes a document as if another client had committed it. Ignores held writes.
     *
     * @param collectionPath the collection path
     * @param id the document ID
     * @param fields the fields to merge
     */
    public void put(String collectionPath, EntityId id, Map<String, Object> fields) {
        List<DocumentWrite> batch = List.of(DocumentWrite.set(collectionPath, id, fields));
        synchronized (lock) {
            apply(batch);
            notifyPaths(pathsOf(batch));
        }
    }

    /**
     * Deletes a document as if another client had committed it. Ignores held writes.
     */
    public void remove(String collectionPath, EntityId id) {
        List<DocumentWrite> batch = List.of(DocumentWrite.delete(collectionPath, id));
        synchronized (lock) {
            apply(batch);
            notifyPaths(pathsOf(batch));
        }
    }

    /**
     * Returns the committed documents of a collection in insertion order.
     */
    public List<RawDocument> documents(String collectionPath) {
        synchronized (lock) {
            Map<EntityId, Map<String, Object>> docs = collections.getOrDefault(collectionPath, Collections.emptyMap());
            List<RawDocument> result = new ArrayList<>(docs.size());
            docs.forEach((id, fields) -> result.add(new RawDocument(id, fields, false)));
            return result;
        }
    }

    // ============================================================
    // Diagnostics
    // ============================================================

    /**
     * Returns the number of feeds currently open.
     */
    public int openFeedCount() {
        return feeds.size();
    }

    /**
     * Returns the number of feeds currently open on the given path.
     */
    public int openFeedCount(String collectionPath) {
        int count = 0;
        for (Feed feed : feeds) {
            if (feed.query.collectionPath().equals(collectionPath)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of subscribe calls received, including rejected ones.
     */
    public int subscribeCallCount() {
        return subscribeCalls.get();
    }

    /**
     * Returns the number of commit calls received.
     */
    public int commitCallCount() {
        return commitCalls.get();
    }

    /**
     * Clears every document, feed, held write and injected failure.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        synchronized (lock) {
            collections.clear();
            feeds.clear();
            rejectedPaths.clear();
            heldBatches.clear();
            holdWrites = false;
            nextCommitFailure = null;
            subscribeCalls.set(0);
            commitCalls.set(0);
        }
    }

    // ============================================================
    // Internals (caller holds lock)
    // ============================================================

    private void apply(List<DocumentWrite> batch) {
        for (DocumentWrite write : batch) {
            Map<EntityId, Map<String, Object>> docs =
                collections.computeIfAbsent(write.collectionPath(), p -> new LinkedHashMap<>());
            if (write.type() == DocumentWrite.Type.DELETE) {
                docs.remove(write.entityId());
            } else {
                docs.computeIfAbsent(write.entityId(), id -> new LinkedHashMap<>()).putAll(write.fields());
            }
        }
    }

    private void notifyPaths(Collection<String> paths) {
        for (Feed feed : feeds) {
            if (paths.contains(feed.query.collectionPath())) {
                deliver(feed, snapshot(feed.query));
            }
        }
    }

    private void deliver(Feed feed, List<RawDocument> documents) {
        if (!feed.open) {
            return;
        }
        try {
            feed.listener.onSnapshot(documents);
        } catch (RuntimeException e) {
            log.error("Feed listener failed for {}", feed.query.toKey(), e);
        }
    }

    private List<RawDocument> snapshot(QueryDescriptor query) {
        Map<EntityId, RawDocument> view = new LinkedHashMap<>();
        collections.getOrDefault(query.collectionPath(), Collections.emptyMap())
            .forEach((id, fields) -> view.put(id, new RawDocument(id, fields, false)));

        if (latencyCompensation) {
            for (HeldBatch held : heldBatches) {
                for (DocumentWrite write : held.writes()) {
                    if (!write.collectionPath().equals(query.collectionPath())) {
                        continue;
                    }
                    if (write.type() == DocumentWrite.Type.DELETE) {
                        view.remove(write.entityId());
                    } else {
                        RawDocument existing = view.get(write.entityId());
                        Map<String, Object> merged = new LinkedHashMap<>();
                        if (existing != null) {
                            merged.putAll(existing.fields());
                        }
                        merged.putAll(write.fields());
                        view.put(write.entityId(), new RawDocument(write.entityId(), merged, true));
                    }
                }
            }
        }

        List<RawDocument> result = new ArrayList<>();
        for (RawDocument doc : view.values()) {
            if (matches(query, doc)) {
                result.add(doc);
            }
        }
        if (query.orderBy() != null) {
            result.sort(byField(query.orderBy()));
        }
        return result;
    }

    private static boolean matches(QueryDescriptor query, RawDocument doc) {
        if (query.isDocument()) {
            return doc.id().getValue().equals(query.documentId());
        }
        for (Map.Entry<String, Object> filter : query.equalityFilters().entrySet()) {
            if (!valueEquals(filter.getValue(), doc.get(filter.getKey()))) {
                return false;
            }
        }
        for (Map.Entry<String, Object> filter : query.arrayContainsFilters().entrySet()) {
            Object field = doc.get(filter.getKey());
            if (!(field instanceof Collection)) {
                return false;
            }
            boolean found = false;
            for (Object element : (Collection<?>) field) {
                if (valueEquals(filter.getValue(), element)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return ((Number) expected).doubleValue() == ((Number) actual).doubleValue();
        }
        return Objects.equals(expected, actual);
    }

    private static Comparator<RawDocument> byField(String field) {
        Comparator<RawDocument> byValue = (a, b) -> compareValues(a.get(field), b.get(field));
        return byValue.thenComparing(RawDocument::id);
    }

    /**
     * Orders field values: booleans, then numbers, then strings, then anything else
     * by its string form. Missing values sort last.
     */
    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        int rank = Integer.compare(typeRank(a), typeRank(b));
        if (rank != 0) {
            return rank;
        }
        if (a instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        if (a instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static int typeRank(Object value) {
        if (value instanceof Boolean) {
            return 0;
        }
        if (value instanceof Number) {
            return 1;
        }
        if (value instanceof String) {
            return 2;
        }
        return 3;
    }

    private static Set<String> pathsOf(List<DocumentWrite> batch) {
        Set<String> paths = new LinkedHashSet<>();
        for (DocumentWrite write : batch) {
            paths.add(write.collectionPath());
        }
        return paths;
    }

    /**
     * Open change feed.
     */
    private final class Feed implements FeedRegistration {

        private final QueryDescriptor query;
        private final FeedListener listener;
        private volatile boolean open = true;

        private Feed(QueryDescriptor query, FeedListener listener) {
            this.query = query;
            this.listener = listener;
        }

        @Override
        public void remove() {
            open = false;
            feeds.remove(this);
        }
    }

    private record HeldBatch(List<DocumentWrite> writes, CompletableFuture<Void> future) {
    }
}
