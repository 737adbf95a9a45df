package org.wikidata.query.rdf.entitystore.storage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.wikidata.query.rdf.entitystore.exception.ContainedException;
import org.wikidata.query.rdf.entitystore.exception.FatalException;
import org.wikidata.query.rdf.entitystore.model.RecordKind;

/**
 * Keeps the inserted batches in memory. Can be told to fail, or to hold inserts until released.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<RecordKind, List<List<Map<String, Object>>>> batches = new EnumMap<>(RecordKind.class);
    private int indexCreations;
    private int containedFailures;
    private boolean unreachable;
    private CountDownLatch hold;

    public InMemoryRecordStore() {
        for (RecordKind kind : RecordKind.values()) batches.put(kind, new ArrayList<>());
    }

    @Override
    public synchronized void createIndexes() {
        if (unreachable) throw new FatalException("Store unreachable");
        indexCreations++;
    }

    @Override
    public void insert(RecordKind kind, List<Map<String, Object>> documents) {
        CountDownLatch latch;
        synchronized (this) {
            latch = hold;
        }
        if (latch != null) {
            try {
                if (!latch.await(10, TimeUnit.SECONDS)) throw new IllegalStateException("Insert held for too long");
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ie);
            }
        }
        synchronized (this) {
            if (unreachable) throw new FatalException("Store unreachable");
            if (containedFailures > 0) {
                containedFailures--;
                throw new ContainedException("Insert of " + documents.size() + " " + kind.getCollection() + " failed");
            }
            batches.get(kind).add(new ArrayList<>(documents));
        }
    }

    /**
     * The next {@code times} inserts fail with a {@link ContainedException}.
     */
    public synchronized InMemoryRecordStore failNext(int times) {
        containedFailures = times;
        return this;
    }

    public synchronized InMemoryRecordStore unreachable() {
        unreachable = true;
        return this;
    }

    /**
     * Inserts wait until the returned latch is counted down.
     */
    public synchronized CountDownLatch hold() {
        hold = new CountDownLatch(1);
        return hold;
    }

    public synchronized List<List<Map<String, Object>>> batches(RecordKind kind) {
        return new ArrayList<>(batches.get(kind));
    }

    public synchronized List<Map<String, Object>> documents(RecordKind kind) {
        List<Map<String, Object>> documents = new ArrayList<>();
        for (List<Map<String, Object>> batch : batches.get(kind)) documents.addAll(batch);
        return documents;
    }

    public synchronized int indexCreations() {
        return indexCreations;
    }
}
