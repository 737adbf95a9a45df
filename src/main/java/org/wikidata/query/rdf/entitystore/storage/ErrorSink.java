package org.wikidata.query.rdf.entitystore.storage;

import java.io.Closeable;

import org.wikidata.query.rdf.entitystore.model.ErrorRecord;

/**
 * Where failures to derive an entity end up.
 * Implementations must neither block nor throw: a sink that can't store an error logs it and moves on.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public interface ErrorSink extends Closeable {

    void record(ErrorRecord error);

    /**
     * Record the failure to derive the entity at the given position of the dump.
     *
     * @param entity the entity identifier, null if it couldn't be read
     */
    default void record(String entity, long sequence, Throwable failure) {
        record(ErrorRecord.of(entity, sequence, failure));
    }

    /**
     * Wait for the pending errors to be stored. Does not throw.
     */
    @Override
    void close();
}
