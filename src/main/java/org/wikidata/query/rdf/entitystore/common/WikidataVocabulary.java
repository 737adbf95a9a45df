package org.wikidata.query.rdf.entitystore.common;

import java.util.regex.Pattern;

/**
 * Wikidata identifiers, namespaces and dump keys used by the entity store.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class WikidataVocabulary {

    public static final String ENTITY_NAMESPACE = "http://www.wikidata.org/entity/";
    public static final String DIRECT_PROPERTY_NAMESPACE = "http://www.wikidata.org/prop/direct/";
    public static final String WIKIDATA_PAGE_PREFIX = "http://www.wikidata.org/wiki/";
    public static final String DBPEDIA_RESOURCE_PREFIX = "http://dbpedia.org/resource/";

    /**
     * Property identifiers start with this prefix, item identifiers with {@code Q}.
     */
    public static final String PROPERTY_PREFIX = "P";
    public static final String ITEM_PREFIX = "Q";

    public static final String INSTANCE_OF = "P31";
    public static final String SUBCLASS_OF = "P279";
    public static final String OCCUPATION = "P106";
    public static final String HUMAN = "Q5";

    /* Dump values of the "type" key */
    public static final String ITEM_TYPE = "item";
    public static final String PROPERTY_TYPE = "property";

    /* Datatypes of claims whose value points to another entity */
    public static final String ITEM_DATATYPE = "wikibase-item";
    public static final String PROPERTY_DATATYPE = "wikibase-property";

    public static final String ENGLISH = "en";
    public static final String ENGLISH_WIKIPEDIA = "enwiki";

    private static final Pattern ENTITY_ID = Pattern.compile("^[QP]\\d+$");

    private WikidataVocabulary() {
    }

    /**
     * Strip the entity namespace from a concept URI.
     *
     * @return the entity identifier, e.g., {@code Q5}, or null if the URI is not an item or property URI
     */
    public static String entityIdFromUri(String uri) {
        if (uri == null || !uri.startsWith(ENTITY_NAMESPACE)) return null;
        String id = uri.substring(ENTITY_NAMESPACE.length());
        return ENTITY_ID.matcher(id).matches() ? id : null;
    }

    public static boolean isProperty(String entityId) {
        return entityId.startsWith(PROPERTY_PREFIX);
    }
}
