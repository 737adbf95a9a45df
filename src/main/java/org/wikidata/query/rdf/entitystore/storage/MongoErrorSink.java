package org.wikidata.query.rdf.entitystore.storage;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.common.Config;
import org.wikidata.query.rdf.entitystore.model.ErrorRecord;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;

/**
 * Stores errors in a MongoDB collection, on a dedicated thread.
 * Errors that can't be stored are only logged.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class MongoErrorSink implements ErrorSink {

    private static final Logger log = LoggerFactory.getLogger(MongoErrorSink.class);

    private final MongoCollection<Document> collection;
    private final ExecutorService writer;
    private final AtomicLong stored = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public MongoErrorSink(MongoCollection<Document> collection) {
        this.collection = collection;
        ThreadFactory tf = new ThreadFactoryBuilder().setNameFormat("error-sink-%d").setDaemon(true).build();
        this.writer = Executors.newSingleThreadExecutor(tf);
    }

    /**
     * A sink writing to {@link Config#ERROR_LOG_DATABASE}.{@link Config#ERROR_LOG_COLLECTION}.
     */
    public static MongoErrorSink fromConfig(MongoClient client) {
        return new MongoErrorSink(client.getDatabase(Config.ERROR_LOG_DATABASE).getCollection(Config.ERROR_LOG_COLLECTION));
    }

    @Override
    public void record(ErrorRecord error) {
        try {
            writer.execute(() -> store(error));
        } catch (RejectedExecutionException ree) {
            dropped.incrementAndGet();
            log.warn("Error sink closed, dropping {}", error);
        }
    }

    private void store(ErrorRecord error) {
        try {
            collection.insertOne(new Document(error.toDocument()));
            stored.incrementAndGet();
        } catch (MongoException me) {
            dropped.incrementAndGet();
            log.warn("Could not store " + error, me);
        }
    }

    public long stored() {
        return stored.get();
    }

    public long dropped() {
        return dropped.get();
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Gave up waiting for the pending errors to be stored");
                writer.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        log.info("{} errors stored, {} dropped", stored.get(), dropped.get());
    }
}
