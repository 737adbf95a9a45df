package org.wikidata.query.rdf.entitystore.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Throwables;

/**
 * A failure while deriving the records of an entity. Written to the error log, never read back by the ingestion.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class ErrorRecord {

    public static final String ERROR_FIELD = "error";
    public static final String TRACEBACK_FIELD = "traceback_str";

    private final String entity;
    private final long sequence;
    private final String message;
    private final String context;

    public ErrorRecord(String entity, long sequence, String message, String context) {
        this.entity = entity;
        this.sequence = sequence;
        this.message = message;
        this.context = context;
    }

    /**
     * @param entity the entity identifier, null if the failure happened before it could be read
     */
    public static ErrorRecord of(String entity, long sequence, Throwable error) {
        return new ErrorRecord(entity, sequence, String.valueOf(error), Throwables.getStackTraceAsString(error));
    }

    public String getEntity() {
        return entity;
    }

    public long getSequence() {
        return sequence;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the stack trace of the failure
     */
    public String getContext() {
        return context;
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(DerivedRecord.ENTITY_FIELD, entity);
        document.put(DerivedRecord.SEQUENCE_FIELD, sequence);
        document.put(ERROR_FIELD, message);
        document.put(TRACEBACK_FIELD, context);
        return document;
    }

    @Override
    public String toString() {
        return "ErrorRecord[" + entity + ", " + message + "]";
    }
}
