package org.wikidata.query.rdf.entitystore.statistics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * How many times a predicate is used, with its English label.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class PredicateSummary {

    public static final String LITERAL_TYPE_FIELD = "literalType";
    public static final String PREDICATE_FIELD = "predicate";
    public static final String LABEL_FIELD = "label";
    public static final String COUNT_FIELD = "count";

    private final String literalType;
    private final String predicate;
    private final String label;
    private final long count;

    /**
     * @param literalType null for object predicates
     */
    public PredicateSummary(String literalType, String predicate, String label, long count) {
        this.literalType = literalType;
        this.predicate = predicate;
        this.label = label;
        this.count = count;
    }

    public String getLiteralType() {
        return literalType;
    }

    public String getPredicate() {
        return predicate;
    }

    public String getLabel() {
        return label;
    }

    public long getCount() {
        return count;
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(LITERAL_TYPE_FIELD, literalType);
        document.put(PREDICATE_FIELD, predicate);
        document.put(LABEL_FIELD, label);
        document.put(COUNT_FIELD, count);
        return document;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PredicateSummary other = (PredicateSummary) o;
        return count == other.count && Objects.equals(literalType, other.literalType) && Objects.equals(predicate, other.predicate)
            && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(literalType, predicate, label, count);
    }

    @Override
    public String toString() {
        return (literalType == null ? "" : literalType + "/") + predicate + " (" + label + "): " + count;
    }
}
