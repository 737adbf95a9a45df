package org.wikidata.query.rdf.entitystore.ingestion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.simple.parser.ContainerFactory;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.wikidata.query.rdf.entitystore.common.WikidataVocabulary;

/**
 * An entity as found in one line of a Wikidata JSON dump.
 * See <a href="https://doc.wikimedia.org/Wikibase/master/php/docs_topics_json.html">the JSON format documentation</a>.
 * <p>
 * Accessors read the decoded JSON lazily: an unexpected shape surfaces as a {@link ClassCastException}
 * when the offending key is read.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class RawEntity {

    /**
     * Keep the key order of the dump.
     */
    private static final ContainerFactory ORDERED_CONTAINERS = new ContainerFactory() {
        @Override
        public Map createObjectContainer() {
            return new LinkedHashMap();
        }

        @Override
        public List creatArrayContainer() {
            return new ArrayList();
        }
    };

    private final Map<String, Object> json;

    RawEntity(Map<String, Object> json) {
        this.json = json;
    }

    /**
     * Decode a dump line. The dump is a single JSON array with one entity per line, so the trailing comma
     * is dropped before parsing. The opening and closing bracket lines are not entities.
     *
     * @return the entity, or null if the line is not a JSON object
     */
    @SuppressWarnings("unchecked")
    public static RawEntity parse(String line) {
        String trimmed = line.trim();
        if (trimmed.endsWith(",")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        Object parsed;
        try {
            // JSONParser keeps state, so every line gets its own
            parsed = new JSONParser().parse(trimmed, ORDERED_CONTAINERS);
        } catch (ParseException pe) {
            return null;
        }
        return parsed instanceof Map ? new RawEntity((Map<String, Object>) parsed) : null;
    }

    /**
     * @return the identifier, e.g., {@code Q42}, or null if the entity has none
     */
    public String getId() {
        return (String) json.get("id");
    }

    /**
     * @return {@code item} or {@code property}
     */
    public String getType() {
        return (String) json.get("type");
    }

    public boolean isItem() {
        return WikidataVocabulary.ITEM_TYPE.equals(getType());
    }

    /**
     * @return language to label
     */
    public Map<String, String> getLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : this.<Map<String, Object>>section("labels").entrySet()) {
            labels.put(entry.getKey(), (String) entry.getValue().get("value"));
        }
        return labels;
    }

    /**
     * @return language to aliases, without duplicates, in dump order
     */
    public Map<String, Set<String>> getAliases() {
        Map<String, Set<String>> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, List<Map<String, Object>>> entry : this.<List<Map<String, Object>>>section("aliases").entrySet()) {
            Set<String> values = new LinkedHashSet<>();
            for (Map<String, Object> alias : entry.getValue()) values.add((String) alias.get("value"));
            aliases.put(entry.getKey(), values);
        }
        return aliases;
    }

    /**
     * @return the English description, the empty string if there is none
     */
    public String getEnglishDescription() {
        Map<String, Object> description = this.<Map<String, Object>>section("descriptions").get(WikidataVocabulary.ENGLISH);
        if (description == null) return "";
        Object value = description.get("value");
        return value == null ? "" : (String) value;
    }

    public int getSitelinkCount() {
        return section("sitelinks").size();
    }

    /**
     * @return the title of the English Wikipedia article, null if there is no such sitelink
     */
    public String getEnglishWikipediaTitle() {
        Map<String, Object> sitelink = this.<Map<String, Object>>section("sitelinks").get(WikidataVocabulary.ENGLISH_WIKIPEDIA);
        return sitelink == null ? null : (String) sitelink.get("title");
    }

    /**
     * @return predicate to claims, in dump order
     */
    public Map<String, List<Claim>> getClaims() {
        Map<String, List<Claim>> claims = new LinkedHashMap<>();
        for (Map.Entry<String, List<Map<String, Object>>> entry : this.<List<Map<String, Object>>>section("claims").entrySet()) {
            List<Claim> predicateClaims = new ArrayList<>();
            for (Map<String, Object> statement : entry.getValue()) predicateClaims.add(Claim.fromJson(entry.getKey(), statement));
            claims.put(entry.getKey(), predicateClaims);
        }
        return claims;
    }

    public boolean hasPredicate(String predicate) {
        return section("claims").containsKey(predicate);
    }

    /**
     * Some entities, e.g., redirects or properties without sitelinks, lack whole sections.
     * An empty JSON array stands for an empty section as well.
     */
    @SuppressWarnings("unchecked")
    private <V> Map<String, V> section(String key) {
        Object section = json.get(key);
        if (section instanceof Map) return (Map<String, V>) section;
        return Collections.emptyMap();
    }
}
