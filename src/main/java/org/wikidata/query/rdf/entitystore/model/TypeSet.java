package org.wikidata.query.rdf.entitystore.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.wikidata.query.rdf.entitystore.common.WikidataVocabulary;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Explicit types of an entity: the values of its instance of (P31) and occupation (P106) claims.
 * Stored under the single key {@code P31}, e.g., <code>{"P31": ["Q5", "Q82955"]}</code>.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class TypeSet {

    public static final String KEY = WikidataVocabulary.INSTANCE_OF;

    private final ImmutableSet<String> values;

    public TypeSet(Collection<String> values) {
        this.values = ImmutableSet.copyOf(values);
    }

    public ImmutableSet<String> getValues() {
        return values;
    }

    public Map<String, List<String>> toDocument() {
        return ImmutableMap.of(KEY, new ArrayList<>(values));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeSet && values.equals(((TypeSet) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return toDocument().toString();
    }
}
