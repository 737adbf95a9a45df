package org.wikidata.query.rdf.entitystore.model;

/**
 * Named entity types assigned from instance of (P31) values.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public enum NerType {
    /** Instance of human (Q5). */
    PERS,
    /** Instance of a geographic location class. */
    LOC,
    /** Instance of an organization class. */
    ORG,
    /** Instance of anything else. */
    OTHERS
}
