package org.wikidata.query.rdf.entitystore.common;

/**
 * SPARQL templates sent to the Wikidata Query Service.
 * Fill the place holders with {@link String#replace(CharSequence, CharSequence)}.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class SparqlQueries {

    /* Query place holders */
    public static final String ROOTS_PLACE_HOLDER = "${ROOTS}";
    public static final String PID_PLACE_HOLDER = "${PID}";
    /* Result variables */
    public static final String NODE_VARIABLE = "node";
    public static final String LABEL_VARIABLE = "nodeLabel";

    private static final String PREFIXES =
        "PREFIX wikibase: <http://wikiba.se/ontology#> " +
            "PREFIX bd: <http://www.bigdata.com/rdf#> " +
            "PREFIX wd: <" + WikidataVocabulary.ENTITY_NAMESPACE + "> " +
            "PREFIX wdt: <" + WikidataVocabulary.DIRECT_PROPERTY_NAMESPACE + "> ";
    private static final String LABEL_SERVICE =
        "  SERVICE wikibase:label { bd:serviceParam wikibase:language \"[AUTO_LANGUAGE],en\" . }";

    // Everything that reaches a root by zero or more hops, e.g., all the subclasses of organization
    public static final String BACKWARD_CLOSURE_QUERY =
        PREFIXES +
            "SELECT DISTINCT ?" + NODE_VARIABLE + " " +
            "WHERE {" +
            "  VALUES ?root { " + ROOTS_PLACE_HOLDER + " }" +
            "  ?" + NODE_VARIABLE + " (wdt:" + PID_PLACE_HOLDER + ")* ?root ." +
            "}";
    public static final String BACKWARD_CLOSURE_WITH_LABELS_QUERY =
        PREFIXES +
            "SELECT DISTINCT ?" + NODE_VARIABLE + " ?" + LABEL_VARIABLE + " " +
            "WHERE {" +
            "  VALUES ?root { " + ROOTS_PLACE_HOLDER + " }" +
            "  ?" + NODE_VARIABLE + " (wdt:" + PID_PLACE_HOLDER + ")* ?root ." +
            LABEL_SERVICE +
            "}";
    // Everything a root reaches by zero or more hops, e.g., all the superclasses of a type
    public static final String FORWARD_CLOSURE_QUERY =
        PREFIXES +
            "SELECT DISTINCT ?" + NODE_VARIABLE + " " +
            "WHERE {" +
            "  VALUES ?root { " + ROOTS_PLACE_HOLDER + " }" +
            "  ?root (wdt:" + PID_PLACE_HOLDER + ")* ?" + NODE_VARIABLE + " ." +
            "}";
    public static final String FORWARD_CLOSURE_WITH_LABELS_QUERY =
        PREFIXES +
            "SELECT DISTINCT ?" + NODE_VARIABLE + " ?" + LABEL_VARIABLE + " " +
            "WHERE {" +
            "  VALUES ?root { " + ROOTS_PLACE_HOLDER + " }" +
            "  ?root (wdt:" + PID_PLACE_HOLDER + ")* ?" + NODE_VARIABLE + " ." +
            LABEL_SERVICE +
            "}";

    private SparqlQueries() {
    }
}
