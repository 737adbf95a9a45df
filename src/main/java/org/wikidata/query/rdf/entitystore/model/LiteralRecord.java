package org.wikidata.query.rdf.entitystore.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * The literal values of an entity, grouped by {@link LiteralType} and then by predicate.
 * Every literal type is present, possibly with no predicates.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class LiteralRecord extends DerivedRecord {

    public static final String LITERALS_FIELD = "literals";

    private final ImmutableMap<LiteralType, ImmutableMap<String, ImmutableList<String>>> literals;

    public LiteralRecord(long sequence, String entity, Map<LiteralType, ? extends Map<String, ? extends List<String>>> literals) {
        super(sequence, entity);
        Map<LiteralType, ImmutableMap<String, ImmutableList<String>>> copy = new EnumMap<>(LiteralType.class);
        for (LiteralType type : LiteralType.values()) {
            Map<String, ? extends List<String>> byPredicate = literals.get(type);
            if (byPredicate == null) {
                copy.put(type, ImmutableMap.of());
            } else {
                ImmutableMap.Builder<String, ImmutableList<String>> values = ImmutableMap.builder();
                byPredicate.forEach((predicate, list) -> values.put(predicate, ImmutableList.copyOf(list)));
                copy.put(type, values.build());
            }
        }
        this.literals = Maps.immutableEnumMap(copy);
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.LITERALS;
    }

    public ImmutableMap<LiteralType, ImmutableMap<String, ImmutableList<String>>> getLiterals() {
        return literals;
    }

    /**
     * @return predicate to values for one literal type, empty if there are none
     */
    public ImmutableMap<String, ImmutableList<String>> get(LiteralType type) {
        return literals.get(type);
    }

    public boolean isEmpty() {
        return literals.values().stream().allMatch(Map::isEmpty);
    }

    @Override
    protected void addFields(Map<String, Object> document) {
        Map<String, Object> literalsDocument = new LinkedHashMap<>();
        literals.forEach((type, byPredicate) -> {
            Map<String, List<String>> values = new LinkedHashMap<>();
            byPredicate.forEach((predicate, list) -> values.put(predicate, new ArrayList<>(list)));
            literalsDocument.put(type.name(), values);
        });
        document.put(LITERALS_FIELD, literalsDocument);
    }
}
