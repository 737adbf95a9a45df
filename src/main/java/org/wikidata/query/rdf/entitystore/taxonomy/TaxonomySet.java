package org.wikidata.query.rdf.entitystore.taxonomy;

import java.util.Collection;
import java.util.Objects;

import com.google.common.collect.ImmutableSet;

/**
 * A named set of class identifiers, e.g., every subclass of organization that is not a subclass of country.
 * Immutable.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class TaxonomySet {

    private final String name;
    private final ImmutableSet<String> members;

    public TaxonomySet(String name, Collection<String> members) {
        this.name = Objects.requireNonNull(name, "name");
        this.members = ImmutableSet.copyOf(members);
    }

    public static TaxonomySet empty(String name) {
        return new TaxonomySet(name, ImmutableSet.of());
    }

    public String getName() {
        return name;
    }

    public ImmutableSet<String> getMembers() {
        return members;
    }

    public boolean contains(String classId) {
        return members.contains(classId);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return name + " (" + members.size() + " classes)";
    }
}
