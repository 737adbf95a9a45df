package org.wikidata.query.rdf.entitystore.ingestion;

import java.util.Map;

import org.wikidata.query.rdf.entitystore.common.WikidataVocabulary;

/**
 * The main snak of a dump statement: a predicate, a datatype and, unless it is a "some value" or "no value" snak, a value.
 * The value is kept as decoded: a string or a map, depending on the datatype.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class Claim {

    private final String predicate;
    private final String datatype;
    private final Object value;

    Claim(String predicate, String datatype, Object value) {
        this.predicate = predicate;
        this.datatype = datatype;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    static Claim fromJson(String predicate, Map<String, Object> statement) {
        Map<String, Object> snak = (Map<String, Object>) statement.getOrDefault("mainsnak", statement);
        String datatype = (String) snak.get("datatype");
        Map<String, Object> datavalue = (Map<String, Object>) snak.get("datavalue");
        return new Claim(predicate, datatype, datavalue == null ? null : datavalue.get("value"));
    }

    public String getPredicate() {
        return predicate;
    }

    public String getDatatype() {
        return datatype;
    }

    public Object getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isEntityReference() {
        return WikidataVocabulary.ITEM_DATATYPE.equals(datatype) || WikidataVocabulary.PROPERTY_DATATYPE.equals(datatype);
    }

    /**
     * The identifier an entity reference points to. Older dumps only carry {@code entity-type} and {@code numeric-id}.
     *
     * @return the identifier, e.g., {@code Q5}, or null if the value is not an entity reference
     */
    public String referencedId() {
        if (!(value instanceof Map)) return null;
        Map<?, ?> reference = (Map<?, ?>) value;
        Object id = reference.get("id");
        if (id != null) return id.toString();
        Object numericId = reference.get("numeric-id");
        if (numericId == null) return null;
        String prefix = WikidataVocabulary.PROPERTY_TYPE.equals(reference.get("entity-type"))
            ? WikidataVocabulary.PROPERTY_PREFIX : WikidataVocabulary.ITEM_PREFIX;
        return prefix + numericId;
    }

    @Override
    public String toString() {
        return predicate + " (" + datatype + "): " + value;
    }
}
