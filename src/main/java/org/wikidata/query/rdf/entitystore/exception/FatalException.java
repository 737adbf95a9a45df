package org.wikidata.query.rdf.entitystore.exception;

/**
 * The run failed and can't go on: the dump can't be read or the database can't be reached.
 */
public class FatalException extends RuntimeException {
    public FatalException(String message, Throwable cause) {
        super(message, cause);
    }

    public FatalException(String message) {
        super(message);
    }
}
