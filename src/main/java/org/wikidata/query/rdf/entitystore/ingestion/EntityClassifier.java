package org.wikidata.query.rdf.entitystore.ingestion;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.simple.JSONValue;
import org.wikidata.query.rdf.entitystore.common.WikidataVocabulary;
import org.wikidata.query.rdf.entitystore.model.EntityCategory;
import org.wikidata.query.rdf.entitystore.model.ItemRecord;
import org.wikidata.query.rdf.entitystore.model.LiteralRecord;
import org.wikidata.query.rdf.entitystore.model.LiteralType;
import org.wikidata.query.rdf.entitystore.model.NerType;
import org.wikidata.query.rdf.entitystore.model.ObjectRecord;
import org.wikidata.query.rdf.entitystore.model.TypeRecord;
import org.wikidata.query.rdf.entitystore.model.TypeSet;
import org.wikidata.query.rdf.entitystore.taxonomy.SuperclassCache;
import org.wikidata.query.rdf.entitystore.taxonomy.Taxonomy;

import com.google.common.collect.ImmutableSet;

/**
 * Turns a dump entity into its item, object, literal and type records.
 * <p>
 * NER types come from the instance of (P31) values of items:
 * <ul>
 * <li>human (Q5) gives {@link NerType#PERS};</li>
 * <li>a class of the location taxonomy gives {@link NerType#LOC};</li>
 * <li>a class of the organization taxonomy gives {@link NerType#ORG};</li>
 * <li>anything else gives {@link NerType#OTHERS}.</li>
 * </ul>
 * Each value is checked in that order and the resulting types are accumulated, so an entity can have several.
 * Thread safe: the taxonomy is immutable and the superclass cache is concurrent.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class EntityClassifier {

    /**
     * Lexicographical data claims are not stored.
     */
    static final ImmutableSet<String> UNSUPPORTED_DATATYPES = ImmutableSet.of("wikibase-lexeme", "wikibase-form", "wikibase-sense");

    /**
     * Entity references through these predicates go to the type record instead of the object record.
     */
    static final ImmutableSet<String> TYPE_PREDICATES = ImmutableSet.of(WikidataVocabulary.INSTANCE_OF, WikidataVocabulary.OCCUPATION);

    private final Taxonomy taxonomy;
    private final SuperclassCache superclasses;

    public EntityClassifier(Taxonomy taxonomy, SuperclassCache superclasses) {
        this.taxonomy = taxonomy;
        this.superclasses = superclasses;
    }

    /**
     * @param sequence position of the entity in the dump, shared by all its records
     * @throws RuntimeException if the entity does not have the expected shape; no record is produced then
     */
    public ClassifiedEntity classify(long sequence, RawEntity entity) {
        String id = entity.getId();
        if (id == null) throw new IllegalArgumentException("Entity without identifier at position " + sequence);

        Map<String, Set<String>> objects = new LinkedHashMap<>();
        Map<LiteralType, Map<String, List<String>>> literals = new EnumMap<>(LiteralType.class);
        for (LiteralType type : LiteralType.values()) literals.put(type, new LinkedHashMap<>());
        Set<String> types = new LinkedHashSet<>();
        for (List<Claim> claims : entity.getClaims().values()) {
            for (Claim claim : claims) decompose(claim, objects, literals, types);
        }

        List<String> explicitTypes = new ArrayList<>();
        Set<NerType> nerTypes = new LinkedHashSet<>();
        Set<String> extendedTypes = new LinkedHashSet<>();
        if (entity.isItem()) {
            explicitTypes = instanceOfValues(entity);
            for (String type : explicitTypes) nerTypes.add(nerType(type));
            for (String type : new LinkedHashSet<>(explicitTypes)) extendedTypes.addAll(superclasses.get(type));
        }

        TypeSet typeSet = new TypeSet(types);
        ItemRecord item = ItemRecord.builder(sequence, id)
            .description(entity.getEnglishDescription())
            .labels(entity.getLabels())
            .aliases(entity.getAliases())
            .types(typeSet)
            .popularity(Math.max(1, entity.getSitelinkCount()))
            .category(categorize(entity))
            .nerTypes(nerTypes)
            .urls(urls(id, entity.getEnglishWikipediaTitle()))
            .extendedTypes(extendedTypes)
            .explicitTypes(explicitTypes)
            .build();
        return new ClassifiedEntity(item,
            new ObjectRecord(sequence, id, objects),
            new LiteralRecord(sequence, id, literals),
            new TypeRecord(sequence, id, typeSet));
    }

    /**
     * A predicate if the identifier is a property one, a type if it has a subclass of (P279) claim, an entity otherwise.
     */
    static EntityCategory categorize(RawEntity entity) {
        if (WikidataVocabulary.isProperty(entity.getId())) return EntityCategory.PREDICATE;
        if (entity.hasPredicate(WikidataVocabulary.SUBCLASS_OF)) return EntityCategory.TYPE;
        return EntityCategory.ENTITY;
    }

    NerType nerType(String classId) {
        if (WikidataVocabulary.HUMAN.equals(classId)) return NerType.PERS;
        if (taxonomy.isLocation(classId)) return NerType.LOC;
        if (taxonomy.isOrganization(classId)) return NerType.ORG;
        return NerType.OTHERS;
    }

    /**
     * @return one value per instance of (P31) claim, claims without a value excluded
     */
    private static List<String> instanceOfValues(RawEntity entity) {
        List<String> values = new ArrayList<>();
        List<Claim> claims = entity.getClaims().get(WikidataVocabulary.INSTANCE_OF);
        if (claims == null) return values;
        for (Claim claim : claims) {
            String value = claim.referencedId();
            if (value != null) values.add(value);
        }
        return values;
    }

    private static void decompose(Claim claim, Map<String, Set<String>> objects, Map<LiteralType, Map<String, List<String>>> literals,
                                  Set<String> types) {
        if (!claim.hasValue() || UNSUPPORTED_DATATYPES.contains(claim.getDatatype())) return;
        String predicate = claim.getPredicate();
        if (claim.isEntityReference()) {
            String value = claim.referencedId();
            if (value == null) throw new IllegalArgumentException("Entity reference without identifier: " + claim);
            if (TYPE_PREDICATES.contains(predicate)) {
                types.add(value);
            } else {
                objects.computeIfAbsent(value, k -> new LinkedHashSet<>()).add(predicate);
            }
        } else {
            literals.get(LiteralType.forDatatype(claim.getDatatype()))
                .computeIfAbsent(predicate, k -> new ArrayList<>())
                .add(literalValue(claim));
        }
    }

    /**
     * Quantities keep their amount, times their timestamp, monolingual texts their text
     * and globe coordinates become {@code latitude,longitude} in decimal notation. Other values are kept as strings.
     */
    static String literalValue(Claim claim) {
        Object value = claim.getValue();
        String datatype = claim.getDatatype() == null ? "" : claim.getDatatype();
        switch (datatype) {
        case "globe-coordinate":
            Map<?, ?> coordinate = (Map<?, ?>) value;
            return decimal(coordinate.get("latitude")) + "," + decimal(coordinate.get("longitude"));
        case "quantity":
            return asString(((Map<?, ?>) value).get("amount"));
        case "time":
            return asString(((Map<?, ?>) value).get("time"));
        case "monolingualtext":
            return asString(((Map<?, ?>) value).get("text"));
        default:
            return asString(value);
        }
    }

    /**
     * Numbers in plain decimal notation, e.g., {@code 0.00001} rather than {@code 1.0E-5}.
     */
    private static String decimal(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    private static String asString(Object value) {
        if (value instanceof String) return (String) value;
        return JSONValue.toJSONString(value);
    }

    private static Map<String, String> urls(String id, String englishWikipediaTitle) {
        Map<String, String> urls = new LinkedHashMap<>();
        urls.put("wikidata", WikidataVocabulary.WIKIDATA_PAGE_PREFIX + id);
        if (englishWikipediaTitle != null) {
            String page = englishWikipediaTitle.replace(' ', '_');
            urls.put("wikipedia", "http://" + WikidataVocabulary.ENGLISH + ".wikipedia.org/wiki/" + page);
            urls.put("dbpedia", WikidataVocabulary.DBPEDIA_RESOURCE_PREFIX + page);
        }
        return urls;
    }
}
