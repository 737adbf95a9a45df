package org.wikidata.query.rdf.entitystore.exception;

/**
 * The operation failed but may succeed if repeated later.
 */
public class RetryableException extends Exception {
    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }

    public RetryableException(String message) {
        super(message);
    }
}
