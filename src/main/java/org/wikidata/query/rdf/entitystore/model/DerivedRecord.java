package org.wikidata.query.rdf.entitystore.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A record derived from one dump entity. All the records of an entity share its identifier and its sequence index.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public abstract class DerivedRecord {

    public static final String SEQUENCE_FIELD = "id_entity";
    public static final String ENTITY_FIELD = "entity";

    private final long sequence;
    private final String entity;

    protected DerivedRecord(long sequence, String entity) {
        this.sequence = sequence;
        this.entity = Objects.requireNonNull(entity, "entity");
    }

    public abstract RecordKind getKind();

    /**
     * Position of the entity line in the dump. Changes if the dump is reordered, so it does not identify an entity.
     */
    public long getSequence() {
        return sequence;
    }

    public String getEntity() {
        return entity;
    }

    /**
     * @return the record as a document made of strings, numbers, lists and maps only
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(SEQUENCE_FIELD, sequence);
        document.put(ENTITY_FIELD, entity);
        addFields(document);
        return document;
    }

    protected abstract void addFields(Map<String, Object> document);

    @Override
    public String toString() {
        return getKind() + "[" + sequence + ", " + entity + "]";
    }
}
