package org.wikidata.query.rdf.entitystore.model;

import java.util.Map;

/**
 * The instance of (P31) and occupation (P106) values of an entity, also stored in its {@link ItemRecord},
 * kept apart for lookups that only need types.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class TypeRecord extends DerivedRecord {

    public static final String TYPES_FIELD = "types";

    private final TypeSet types;

    public TypeRecord(long sequence, String entity, TypeSet types) {
        super(sequence, entity);
        this.types = types;
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.TYPES;
    }

    public TypeSet getTypes() {
        return types;
    }

    @Override
    protected void addFields(Map<String, Object> document) {
        document.put(TYPES_FIELD, types.toDocument());
    }
}
