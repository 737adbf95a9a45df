package org.wikidata.query.rdf.entitystore.model;

/**
 * The kinds of records derived from a dump entity, each stored in its own collection.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public enum RecordKind {
    ITEMS("items"),
    OBJECTS("objects"),
    LITERALS("literals"),
    TYPES("types");

    private final String collection;

    RecordKind(String collection) {
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }
}
