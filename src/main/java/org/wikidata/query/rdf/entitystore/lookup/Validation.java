package org.wikidata.query.rdf.entitystore.lookup;

/**
 * Outcome of the validation of a request parameter: either a normalized value or an error for the client.
 *
 * @param <T> type of the normalized value
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class Validation<T> {

    public static final int BAD_REQUEST = 400;
    public static final int FORBIDDEN = 403;

    private final boolean valid;
    private final T value;
    private final String error;
    private final int status;

    private Validation(boolean valid, T value, String error, int status) {
        this.valid = valid;
        this.value = value;
        this.error = error;
        this.status = status;
    }

    /**
     * @param value the normalized value, may be null when the parameter has no value
     */
    public static <T> Validation<T> valid(T value) {
        return new Validation<>(true, value, null, 200);
    }

    public static <T> Validation<T> invalid(String error, int status) {
        return new Validation<>(false, null, error, status);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the normalized value, null if the parameter is invalid
     */
    public T getValue() {
        return value;
    }

    /**
     * @return the message for the client, null if the parameter is valid
     */
    public String getError() {
        return error;
    }

    /**
     * @return the HTTP status to answer with if the parameter is invalid
     */
    public int getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return valid ? "valid: " + value : "invalid (" + status + "): " + error;
    }
}
