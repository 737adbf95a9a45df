package org.wikidata.query.rdf.entitystore.model;

import java.util.Locale;

/**
 * Coarse category of an entity: a property is a predicate, an item with a subclass of (P279) claim is a type,
 * anything else is an entity.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public enum EntityCategory {
    ENTITY,
    TYPE,
    PREDICATE;

    /**
     * @return the stored value, e.g., {@code entity}
     */
    public String value() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
