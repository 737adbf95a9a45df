package org.wikidata.query.rdf.entitystore.storage;

import java.util.ArrayList;
import java.util.List;

import org.wikidata.query.rdf.entitystore.model.ErrorRecord;

/**
 * Collects errors in memory.
 */
public class InMemoryErrorSink implements ErrorSink {

    private final List<ErrorRecord> errors = new ArrayList<>();
    private boolean closed;

    @Override
    public synchronized void record(ErrorRecord error) {
        errors.add(error);
    }

    public synchronized List<ErrorRecord> errors() {
        return new ArrayList<>(errors);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }
}
