package org.wikidata.query.rdf.entitystore.taxonomy;

import com.google.common.collect.ImmutableSet;

/**
 * Roots and exclusions of the taxonomy sets used for NER typing.
 * A set is the subclass closure of its roots minus the subclass closure of each exclusion.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public enum TaxonomyDefinition {

    /**
     * Organization (Q43229), excluding country (Q6256), city (Q515), capital (Q5119),
     * administrative territorial entity of a single country (Q15916867), family (Q8436),
     * sports league (Q623109) and venue (Q17350442).
     */
    ORGANIZATION(ImmutableSet.of("Q43229"),
        ImmutableSet.of("Q6256", "Q515", "Q5119", "Q15916867", "Q8436", "Q623109", "Q17350442")),
    /**
     * Geographic location (Q2221906), excluding food (Q2095), educational institution (Q2385804),
     * government agency (Q327333), international organization (Q484652) and time zone (Q12143).
     */
    LOCATION(ImmutableSet.of("Q2221906"),
        ImmutableSet.of("Q2095", "Q2385804", "Q327333", "Q484652", "Q12143"));

    private final ImmutableSet<String> roots;
    private final ImmutableSet<String> exclusions;

    TaxonomyDefinition(ImmutableSet<String> roots, ImmutableSet<String> exclusions) {
        this.roots = roots;
        this.exclusions = exclusions;
    }

    public ImmutableSet<String> getRoots() {
        return roots;
    }

    public ImmutableSet<String> getExclusions() {
        return exclusions;
    }
}
