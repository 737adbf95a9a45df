package org.wikidata.query.rdf.entitystore.ingestion;

import java.util.Iterator;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.exception.FatalException;
import org.wikidata.query.rdf.entitystore.storage.BatchWriter;
import org.wikidata.query.rdf.entitystore.storage.ErrorSink;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Feeds dump lines to a pool of workers that classify entities and hand their records to a {@link BatchWriter}.
 * <p>
 * Lines that are not JSON objects are skipped silently. An entity that fails to classify goes to the {@link ErrorSink}
 * and none of its records is written. Any {@link FatalException}, from the dump or from the store, stops the run.
 * <p>
 * The work queue is bounded: when it is full the reading thread classifies the line itself,
 * which slows the reading down to the pace of the workers.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class IngestionPipeline {

    public static final int DEFAULT_WORKERS = 16;
    /**
     * Queued lines per worker.
     */
    static final int QUEUE_DEPTH = 4;

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final EntityClassifier classifier;
    private final BatchWriter writer;
    private final ErrorSink errors;
    private final int workers;

    private final AtomicLong entities = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicReference<FatalException> fatal = new AtomicReference<>();

    public IngestionPipeline(EntityClassifier classifier, BatchWriter writer, ErrorSink errors, int workers) {
        if (workers < 1) throw new IllegalArgumentException("At least one worker is needed, got " + workers);
        this.classifier = classifier;
        this.writer = writer;
        this.errors = errors;
        this.workers = workers;
    }

    /**
     * Process every line, then flush the writer and wait for the last writes. The writer is closed afterwards.
     *
     * @throws FatalException if the dump can't be read or the store can't be reached
     */
    public IngestionReport run(Iterator<DumpLine> lines) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        ThreadFactory tf = new ThreadFactoryBuilder().setNameFormat("entity-classifier-%d").build();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(workers * QUEUE_DEPTH), tf, new ThreadPoolExecutor.CallerRunsPolicy());
        long read = 0;
        try {
            while (fatal.get() == null && lines.hasNext()) {
                DumpLine line = lines.next();
                read++;
                pool.execute(() -> process(line));
            }
            pool.shutdown();
            awaitWorkers(pool);
        } catch (FatalException fe) {
            fatal.compareAndSet(null, fe);
        } finally {
            if (!pool.isTerminated()) pool.shutdownNow();
        }
        FatalException failure = fatal.get();
        if (failure != null) {
            closeQuietly();
            throw failure;
        }
        writer.close();
        IngestionReport report = new IngestionReport(read, entities.get(), skipped.get(), failed.get(), writer.written(),
            writer.failedFlushes(), stopwatch.elapsed());
        log.info("Ingestion completed: {}", report);
        return report;
    }

    @SuppressWarnings("IllegalCatch")
    void process(DumpLine line) {
        if (fatal.get() != null) return;
        RawEntity entity = RawEntity.parse(line.text());
        if (entity == null) {
            skipped.incrementAndGet();
            return;
        }
        ClassifiedEntity classified;
        try {
            classified = classifier.classify(line.getIndex(), entity);
        } catch (RuntimeException re) {
            failed.incrementAndGet();
            log.debug("Failed classifying the entity at line {}", line.getIndex(), re);
            errors.record(idOrNull(entity), line.getIndex(), re);
            return;
        }
        try {
            writer.appendAll(classified.records());
            entities.incrementAndGet();
        } catch (FatalException fe) {
            fatal.compareAndSet(null, fe);
        }
    }

    @SuppressWarnings("IllegalCatch")
    private static String idOrNull(RawEntity entity) {
        try {
            return entity.getId();
        } catch (RuntimeException re) {
            return null;
        }
    }

    private static void awaitWorkers(ThreadPoolExecutor pool) {
        try {
            while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for {} queued lines to be classified", pool.getQueue().size());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FatalException("Interrupted while waiting for the workers", ie);
        }
    }

    private void closeQuietly() {
        try {
            writer.close();
        } catch (FatalException fe) {
            log.debug("The writer failed to close after a fatal error", fe);
        }
    }
}
