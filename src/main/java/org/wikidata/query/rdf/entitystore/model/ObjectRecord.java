package org.wikidata.query.rdf.entitystore.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The entities an entity points to, each with the properties linking them.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class ObjectRecord extends DerivedRecord {

    public static final String OBJECTS_FIELD = "objects";

    private final ImmutableMap<String, ImmutableSet<String>> objects;

    public ObjectRecord(long sequence, String entity, Map<String, ? extends Set<String>> objects) {
        super(sequence, entity);
        ImmutableMap.Builder<String, ImmutableSet<String>> builder = ImmutableMap.builder();
        objects.forEach((object, predicates) -> builder.put(object, ImmutableSet.copyOf(predicates)));
        this.objects = builder.build();
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.OBJECTS;
    }

    /**
     * @return related entity identifier to the predicates linking it
     */
    public ImmutableMap<String, ImmutableSet<String>> getObjects() {
        return objects;
    }

    @Override
    protected void addFields(Map<String, Object> document) {
        Map<String, List<String>> objectsDocument = new LinkedHashMap<>();
        objects.forEach((object, predicates) -> objectsDocument.put(object, new ArrayList<>(predicates)));
        document.put(OBJECTS_FIELD, objectsDocument);
    }
}
