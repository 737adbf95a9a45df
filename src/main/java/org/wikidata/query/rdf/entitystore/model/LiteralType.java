package org.wikidata.query.rdf.entitystore.model;

import com.google.common.collect.ImmutableMap;

/**
 * Categories of literal claim values.
 * See <a href="https://www.wikidata.org/wiki/Special:ListDatatypes">the Wikidata datatypes</a>.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public enum LiteralType {
    STRING,
    NUMBER,
    DATETIME,
    GEOSHAPE,
    MATH,
    MUSICAL_NOTATION,
    TABULAR_DATA;

    private static final ImmutableMap<String, LiteralType> DATATYPES = ImmutableMap.<String, LiteralType>builder()
        .put("external-id", STRING)
        .put("quantity", NUMBER)
        .put("globe-coordinate", STRING)
        .put("string", STRING)
        .put("monolingualtext", STRING)
        .put("commonsMedia", STRING)
        .put("time", DATETIME)
        .put("url", STRING)
        .put("geo-shape", GEOSHAPE)
        .put("math", MATH)
        .put("musical-notation", MUSICAL_NOTATION)
        .put("tabular-data", TABULAR_DATA)
        .build();

    /**
     * @param datatype a claim datatype, e.g., {@code quantity}
     * @return the literal category, {@link #STRING} for datatypes without a specific one
     */
    public static LiteralType forDatatype(String datatype) {
        return DATATYPES.getOrDefault(datatype, STRING);
    }
}
