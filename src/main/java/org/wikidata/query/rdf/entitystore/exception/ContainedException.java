package org.wikidata.query.rdf.entitystore.exception;

/**
 * A single operation failed, e.g., a remote query or a batch insert, but the rest of the run should proceed.
 */
public class ContainedException extends RuntimeException {
    public ContainedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContainedException(String message) {
        super(message);
    }
}
