package org.wikidata.query.rdf.entitystore.exception;

/**
 * The remote service answered with HTTP 429 Too Many Requests.
 */
public class RateLimitedException extends RetryableException {
    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
