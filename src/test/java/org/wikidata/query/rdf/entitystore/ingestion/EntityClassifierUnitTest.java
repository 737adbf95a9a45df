package org.wikidata.query.rdf.entitystore.ingestion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wikidata.query.rdf.entitystore.model.EntityCategory;
import org.wikidata.query.rdf.entitystore.model.ItemRecord;
import org.wikidata.query.rdf.entitystore.model.LiteralRecord;
import org.wikidata.query.rdf.entitystore.model.LiteralType;
import org.wikidata.query.rdf.entitystore.model.NerType;
import org.wikidata.query.rdf.entitystore.model.RecordKind;
import org.wikidata.query.rdf.entitystore.model.TypeSet;
import org.wikidata.query.rdf.entitystore.taxonomy.GraphNode;
import org.wikidata.query.rdf.entitystore.taxonomy.GraphQueryService;
import org.wikidata.query.rdf.entitystore.taxonomy.SuperclassCache;
import org.wikidata.query.rdf.entitystore.taxonomy.Taxonomy;
import org.wikidata.query.rdf.entitystore.taxonomy.TaxonomyResolver;
import org.wikidata.query.rdf.entitystore.taxonomy.TaxonomySet;
import org.wikidata.query.rdf.entitystore.taxonomy.TraversalQuery;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

@RunWith(RandomizedRunner.class)
public class EntityClassifierUnitTest extends RandomizedTest {

    private static final String CITY = "Q515";
    private static final String BUSINESS = "Q4830453";

    private final AtomicInteger superclassQueries = new AtomicInteger();
    private EntityClassifier classifier;

    @Before
    public void setUp() {
        Map<String, List<GraphNode>> superclasses = ImmutableMap.of(
            "Q5", ImmutableList.of(new GraphNode("Q5", "human"), new GraphNode("Q215627", "person")),
            CITY, ImmutableList.of(new GraphNode(CITY, "city"), new GraphNode("Q486972", "human settlement")));
        GraphQueryService service = (TraversalQuery query) -> {
            superclassQueries.incrementAndGet();
            List<GraphNode> nodes = new ArrayList<>();
            for (String root : query.getRoots()) nodes.addAll(superclasses.getOrDefault(root, Collections.<GraphNode>emptyList()));
            return nodes;
        };
        Taxonomy taxonomy = new Taxonomy(new TaxonomySet("location", ImmutableSet.of(CITY)),
            new TaxonomySet("organization", ImmutableSet.of(BUSINESS)));
        classifier = new EntityClassifier(taxonomy, new SuperclassCache(new TaxonomyResolver(service, 0, Duration.ZERO)));
    }

    private ClassifiedEntity classify(EntityJson entity) {
        return classifier.classify(randomIntBetween(0, 1000), entity.parse());
    }

    @Test
    public void testHumanRoundTrip() {
        ClassifiedEntity classified = classify(EntityJson.item("Q42").itemClaim("P31", "Q5"));
        ItemRecord item = classified.getItem();
        assertEquals(EntityCategory.ENTITY, item.getCategory());
        assertThat(item.getNerTypes(), contains(NerType.PERS));
        assertTrue(classified.getObjects().getObjects().isEmpty());
        assertTrue(classified.getLiterals().isEmpty());
        Map<String, List<String>> expectedTypes = ImmutableMap.of("P31", ImmutableList.of("Q5"));
        assertEquals(expectedTypes, classified.getTypes().getTypes().toDocument());
        assertEquals(expectedTypes, item.getTypes().toDocument());
    }

    @Test
    public void testRecordsShareSequenceAndEntity() {
        ClassifiedEntity classified = classifier.classify(7, EntityJson.item("Q42").itemClaim("P31", "Q5").parse());
        assertEquals(4, classified.records().size());
        List<RecordKind> kinds = new ArrayList<>();
        classified.records().forEach(record -> {
            assertEquals(7, record.getSequence());
            assertEquals("Q42", record.getEntity());
            kinds.add(record.getKind());
        });
        assertThat(kinds, contains(RecordKind.ITEMS, RecordKind.OBJECTS, RecordKind.LITERALS, RecordKind.TYPES));
    }

    @Test
    public void testNoInstanceOfGivesNoNerTypeAndNoExtendedType() {
        ItemRecord item = classify(EntityJson.item("Q1").itemClaim("P361", "Q2")).getItem();
        assertThat(item.getNerTypes(), empty());
        assertThat(item.getExtendedTypes(), empty());
        assertThat(item.getExplicitTypes(), empty());
        assertEquals(0, superclassQueries.get());
    }

    @Test
    public void testNerTypesAccumulateInOrder() {
        ItemRecord item = classify(EntityJson.item("Q1")
            .itemClaim("P31", "Q99999")
            .itemClaim("P31", CITY)
            .itemClaim("P31", BUSINESS)
            .itemClaim("P31", "Q5")).getItem();
        assertThat(item.getNerTypes(), contains(NerType.OTHERS, NerType.LOC, NerType.ORG, NerType.PERS));
        assertThat(item.getExplicitTypes(), contains("Q99999", CITY, BUSINESS, "Q5"));
    }

    @Test
    public void testNerTypesAreDistinct() {
        ItemRecord item = classify(EntityJson.item("Q1").itemClaim("P31", "Q5").itemClaim("P31", "Q5")).getItem();
        assertThat(item.getNerTypes(), contains(NerType.PERS));
    }

    @Test
    public void testExtendedTypesUnionSuperclassesOnce() {
        ItemRecord item = classify(EntityJson.item("Q1").itemClaim("P31", "Q5").itemClaim("P31", CITY).itemClaim("P31", "Q5"))
            .getItem();
        assertThat(item.getExtendedTypes(), contains("Q5", "Q215627", CITY, "Q486972"));
        assertEquals(2, superclassQueries.get());
        classify(EntityJson.item("Q2").itemClaim("P31", "Q5"));
        assertEquals("superclasses are cached across entities", 2, superclassQueries.get());
    }

    @Test
    public void testInstanceOfWithoutValueIsIgnored() {
        ItemRecord item = classify(EntityJson.item("Q1").noValueClaim("P31", "wikibase-item")).getItem();
        assertThat(item.getNerTypes(), empty());
        assertThat(item.getTypes().getValues(), empty());
    }

    @Test
    public void testOccupationIsAType() {
        ClassifiedEntity classified = classify(EntityJson.item("Q42")
            .itemClaim("P31", "Q5")
            .itemClaim("P106", "Q36180")
            .itemClaim("P27", "Q145"));
        assertThat(classified.getTypes().getTypes().getValues(), contains("Q5", "Q36180"));
        assertThat("occupation is not a NER type source", classified.getItem().getNerTypes(), contains(NerType.PERS));
        assertEquals(ImmutableMap.of("Q145", ImmutableSet.of("P27")), classified.getObjects().getObjects());
    }

    @Test
    public void testObjectsGroupPredicatesByValue() {
        ClassifiedEntity classified = classify(EntityJson.item("Q1")
            .itemClaim("P27", "Q145")
            .itemClaim("P19", "Q145")
            .itemClaim("P20", "Q84"));
        assertEquals(ImmutableMap.of("Q145", ImmutableSet.of("P27", "P19"), "Q84", ImmutableSet.of("P20")),
            classified.getObjects().getObjects());
    }

    @Test
    public void testLexemeClaimsAreSkipped() {
        Map<String, Object> lexeme = new LinkedHashMap<>();
        lexeme.put("entity-type", "lexeme");
        lexeme.put("numeric-id", 7L);
        lexeme.put("id", "L7");
        ClassifiedEntity classified = classify(EntityJson.item("Q1")
            .claim("P5137", "wikibase-lexeme", lexeme)
            .claim("P5972", "wikibase-sense", "L7-S1")
            .claim("P5830", "wikibase-form", "L7-F1"));
        assertTrue(classified.getObjects().getObjects().isEmpty());
        assertTrue(classified.getLiterals().isEmpty());
    }

    @Test
    public void testLiteralValues() {
        Map<String, Object> quantity = new LinkedHashMap<>();
        quantity.put("amount", "+42");
        quantity.put("unit", "1");
        Map<String, Object> time = new LinkedHashMap<>();
        time.put("time", "+1952-03-11T00:00:00Z");
        time.put("precision", 11L);
        Map<String, Object> text = new LinkedHashMap<>();
        text.put("text", "Douglas Adams");
        text.put("language", "en");
        Map<String, Object> coordinate = new LinkedHashMap<>();
        coordinate.put("latitude", 51.5);
        coordinate.put("longitude", -0.12);
        LiteralRecord literals = classify(EntityJson.item("Q42")
            .claim("P1082", "quantity", quantity)
            .claim("P569", "time", time)
            .claim("P1559", "monolingualtext", text)
            .claim("P625", "globe-coordinate", coordinate)
            .claim("P214", "external-id", "113230702")
            .claim("P856", "url", "https://example.org")
            .claim("P2534", "math", "E=mc^2")).getLiterals();
        assertEquals(ImmutableList.of("+42"), literals.get(LiteralType.NUMBER).get("P1082"));
        assertEquals(ImmutableList.of("+1952-03-11T00:00:00Z"), literals.get(LiteralType.DATETIME).get("P569"));
        assertEquals(ImmutableList.of("Douglas Adams"), literals.get(LiteralType.STRING).get("P1559"));
        assertEquals(ImmutableList.of("51.5,-0.12"), literals.get(LiteralType.STRING).get("P625"));
        assertEquals(ImmutableList.of("113230702"), literals.get(LiteralType.STRING).get("P214"));
        assertEquals(ImmutableList.of("https://example.org"), literals.get(LiteralType.STRING).get("P856"));
        assertEquals(ImmutableList.of("E=mc^2"), literals.get(LiteralType.MATH).get("P2534"));
        assertTrue(literals.get(LiteralType.GEOSHAPE).isEmpty());
    }

    @Test
    public void testCoordinatesInDecimalNotation() {
        Map<String, Object> coordinate = new LinkedHashMap<>();
        coordinate.put("latitude", 0.00001);
        coordinate.put("longitude", 52L);
        Map<String, Object> precise = new LinkedHashMap<>();
        precise.put("latitude", -12.50);
        precise.put("longitude", 1.0E-7);
        LiteralRecord literals = classify(EntityJson.item("Q64")
            .claim("P625", "globe-coordinate", coordinate)
            .claim("P625", "globe-coordinate", precise)).getLiterals();
        assertEquals(ImmutableList.of("0.00001,52", "-12.5,0.0000001"), literals.get(LiteralType.STRING).get("P625"));
    }

    @Test
    public void testLiteralsKeepEveryValueOfAPredicate() {
        LiteralRecord literals = classify(EntityJson.item("Q1")
            .claim("P214", "external-id", "1")
            .claim("P214", "external-id", "2")).getLiterals();
        assertEquals(ImmutableList.of("1", "2"), literals.get(LiteralType.STRING).get("P214"));
    }

    @Test
    public void testItemMetadata() {
        ItemRecord item = classify(EntityJson.item("Q42")
            .label("en", "Douglas Adams")
            .label("it", "Douglas Adams")
            .description("en", "English writer and humourist")
            .description("fr", "écrivain anglais")
            .alias("en", "Douglas Noel Adams")
            .alias("en", "Douglas Noel Adams")
            .alias("en", "DNA")
            .sitelink("enwiki", "Douglas Adams")
            .sitelink("itwiki", "Douglas Adams")
            .sitelink("frwiki", "Douglas Adams")).getItem();
        assertEquals("English writer and humourist", item.getDescription());
        assertEquals(ImmutableMap.of("en", "Douglas Adams", "it", "Douglas Adams"), item.getLabels());
        assertThat(item.getAliases().get("en"), contains("Douglas Noel Adams", "DNA"));
        assertEquals(3, item.getPopularity());
        assertEquals("http://www.wikidata.org/wiki/Q42", item.getUrls().get("wikidata"));
        assertEquals("http://en.wikipedia.org/wiki/Douglas_Adams", item.getUrls().get("wikipedia"));
        assertEquals("http://dbpedia.org/resource/Douglas_Adams", item.getUrls().get("dbpedia"));
    }

    @Test
    public void testEntityWithoutEnglishWikipedia() {
        ItemRecord item = classify(EntityJson.item("Q1").sitelink("itwiki", "Universo")).getItem();
        assertEquals(ImmutableMap.of("wikidata", "http://www.wikidata.org/wiki/Q1"), item.getUrls());
        assertThat(item.getUrls(), not(hasKey("wikipedia")));
        assertEquals("", item.getDescription());
        assertEquals(1, item.getPopularity());
    }

    @Test
    public void testPopularityIsAtLeastOne() {
        assertEquals(1, classify(EntityJson.item("Q1")).getItem().getPopularity());
    }

    @Test
    public void testClassIsAType() {
        ItemRecord item = classify(EntityJson.item(CITY).itemClaim("P279", "Q486972")).getItem();
        assertEquals(EntityCategory.TYPE, item.getCategory());
    }

    @Test
    public void testPropertyIsAPredicateWithoutNerTypes() {
        ClassifiedEntity classified = classify(EntityJson.property("P31").itemClaim("P31", "Q18616576").label("en", "instance of"));
        ItemRecord item = classified.getItem();
        assertEquals(EntityCategory.PREDICATE, item.getCategory());
        assertThat(item.getNerTypes(), empty());
        assertThat(item.getExtendedTypes(), empty());
        assertEquals(new TypeSet(ImmutableList.of("Q18616576")), item.getTypes());
        assertEquals(0, superclassQueries.get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEntityWithoutIdentifierFails() {
        classifier.classify(0, RawEntity.parse("{\"type\": \"item\", \"claims\": {}}"));
    }

    @Test(expected = ClassCastException.class)
    public void testMalformedClaimFails() {
        classifier.classify(0, RawEntity.parse("{\"id\": \"Q1\", \"type\": \"item\", \"claims\": {\"P31\": [\"Q5\"]}}"));
    }
}
