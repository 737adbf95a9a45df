package org.wikidata.query.rdf.entitystore.ingestion;

import org.wikidata.query.rdf.entitystore.model.DerivedRecord;
import org.wikidata.query.rdf.entitystore.model.ItemRecord;
import org.wikidata.query.rdf.entitystore.model.LiteralRecord;
import org.wikidata.query.rdf.entitystore.model.ObjectRecord;
import org.wikidata.query.rdf.entitystore.model.TypeRecord;

import com.google.common.collect.ImmutableList;

/**
 * The four records derived from one entity. They are written together or not at all.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class ClassifiedEntity {

    private final ItemRecord item;
    private final ObjectRecord objects;
    private final LiteralRecord literals;
    private final TypeRecord types;

    public ClassifiedEntity(ItemRecord item, ObjectRecord objects, LiteralRecord literals, TypeRecord types) {
        this.item = item;
        this.objects = objects;
        this.literals = literals;
        this.types = types;
    }

    public ItemRecord getItem() {
        return item;
    }

    public ObjectRecord getObjects() {
        return objects;
    }

    public LiteralRecord getLiterals() {
        return literals;
    }

    public TypeRecord getTypes() {
        return types;
    }

    /**
     * @return one record per kind, in collection order
     */
    public ImmutableList<DerivedRecord> records() {
        return ImmutableList.of(item, objects, literals, types);
    }
}
