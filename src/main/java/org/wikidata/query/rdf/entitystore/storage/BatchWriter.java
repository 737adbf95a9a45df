package org.wikidata.query.rdf.entitystore.storage;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.exception.ContainedException;
import org.wikidata.query.rdf.entitystore.exception.FatalException;
import org.wikidata.query.rdf.entitystore.model.DerivedRecord;
import org.wikidata.query.rdf.entitystore.model.RecordKind;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Buffers derived records per kind and writes them to a {@link RecordStore} in bulk.
 * <p>
 * A buffer is flushed as soon as it holds {@code batchSize} records. Flushes run one at a time on a dedicated thread,
 * so appending threads never wait for the store. {@link #close()} flushes what is left and waits for every flush.
 * <p>
 * A failed flush is logged and its records are lost, the following ones go on.
 * If the store becomes unreachable, the next {@link #append(DerivedRecord)} or {@link #close()} fails
 * with the {@link FatalException} the store threw.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class BatchWriter implements Closeable {

    public static final int DEFAULT_BATCH_SIZE = 100;

    private static final Logger log = LoggerFactory.getLogger(BatchWriter.class);

    private final RecordStore store;
    private final int batchSize;
    private final Map<RecordKind, List<Map<String, Object>>> buffers = new EnumMap<>(RecordKind.class);
    private final List<Future<?>> inFlight = new ArrayList<>();
    private final ExecutorService flusher;
    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong failedFlushes = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private volatile FatalException fatal;
    private boolean closed;

    public BatchWriter(RecordStore store, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("The batch size must be positive, got " + batchSize);
        this.store = store;
        this.batchSize = batchSize;
        for (RecordKind kind : RecordKind.values()) buffers.put(kind, new ArrayList<>(batchSize));
        ThreadFactory tf = new ThreadFactoryBuilder().setNameFormat("batch-writer-flush-%d").build();
        this.flusher = Executors.newSingleThreadExecutor(tf);
    }

    /**
     * Buffer a record, flushing its buffer if it is full.
     *
     * @throws FatalException if a previous flush found the store unreachable
     * @throws IllegalStateException if the writer is closed
     */
    public synchronized void append(DerivedRecord record) {
        checkUsable();
        List<Map<String, Object>> buffer = buffers.get(record.getKind());
        buffer.add(record.toDocument());
        if (buffer.size() >= batchSize) flush(record.getKind());
    }

    /**
     * Buffer several records at once, so no flush happens in between.
     */
    public synchronized void appendAll(Collection<? extends DerivedRecord> records) {
        for (DerivedRecord record : records) append(record);
    }

    /**
     * Hand the buffer of a kind to the flush thread, without waiting for the write. Empty buffers are ignored.
     */
    public synchronized void flush(RecordKind kind) {
        List<Map<String, Object>> buffer = buffers.get(kind);
        if (buffer.isEmpty()) return;
        buffers.put(kind, new ArrayList<>(batchSize));
        pruneCompleted();
        inFlight.add(flusher.submit(() -> write(kind, buffer)));
    }

    public synchronized void flushAll() {
        for (RecordKind kind : RecordKind.values()) flush(kind);
    }

    private void write(RecordKind kind, List<Map<String, Object>> documents) {
        try {
            store.insert(kind, documents);
            flushes.incrementAndGet();
            written.addAndGet(documents.size());
            log.debug("Flushed {} {}", documents.size(), kind.getCollection());
        } catch (ContainedException ce) {
            failedFlushes.incrementAndGet();
            log.error("Failed flushing " + documents.size() + " " + kind.getCollection(), ce);
        } catch (FatalException fe) {
            failedFlushes.incrementAndGet();
            if (fatal == null) fatal = fe;
            log.error("The store is unreachable, " + documents.size() + " " + kind.getCollection() + " were not written", fe);
        }
    }

    private void pruneCompleted() {
        Iterator<Future<?>> futures = inFlight.iterator();
        while (futures.hasNext()) {
            if (futures.next().isDone()) futures.remove();
        }
    }

    /**
     * Wait for the flushes submitted so far.
     */
    public void awaitInFlight() throws InterruptedException {
        List<Future<?>> pending;
        synchronized (this) {
            pending = new ArrayList<>(inFlight);
        }
        for (Future<?> future : pending) {
            try {
                future.get();
            } catch (ExecutionException ee) {
                // write() handles store failures, anything else is a bug
                throw new IllegalStateException("Unexpected flush failure", ee.getCause());
            }
        }
        synchronized (this) {
            pruneCompleted();
        }
    }

    public synchronized int bufferSize(RecordKind kind) {
        return buffers.get(kind).size();
    }

    /**
     * @return how many flushes completed successfully
     */
    public long flushes() {
        return flushes.get();
    }

    public long failedFlushes() {
        return failedFlushes.get();
    }

    /**
     * @return how many records were written, all kinds together
     */
    public long written() {
        return written.get();
    }

    private void checkUsable() {
        if (closed) throw new IllegalStateException("The batch writer is closed");
        if (fatal != null) throw fatal;
    }

    /**
     * Flush the non-empty buffers once and wait for every flush to complete.
     *
     * @throws FatalException if the store was found unreachable
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            if (fatal == null) flushAll();
            closed = true;
        }
        try {
            awaitInFlight();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the last flushes");
        } finally {
            flusher.shutdown();
        }
        try {
            if (!flusher.awaitTermination(1, TimeUnit.MINUTES)) log.warn("The flush thread did not stop in time");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        log.info("{} records written in {} flushes, {} flushes failed", written.get(), flushes.get(), failedFlushes.get());
        if (fatal != null) throw fatal;
    }
}
