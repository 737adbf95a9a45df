package org.wikidata.query.rdf.entitystore.statistics;

import static org.wikidata.query.rdf.entitystore.common.OptionsUtils.handleOptions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.common.OptionsUtils.BasicOptions;
import org.wikidata.query.rdf.entitystore.common.WikidataVocabulary;
import org.wikidata.query.rdf.entitystore.exception.ContainedException;
import org.wikidata.query.rdf.entitystore.model.DerivedRecord;
import org.wikidata.query.rdf.entitystore.model.ItemRecord;
import org.wikidata.query.rdf.entitystore.model.LiteralRecord;
import org.wikidata.query.rdf.entitystore.model.ObjectRecord;
import org.wikidata.query.rdf.entitystore.model.RecordKind;
import org.wikidata.query.rdf.entitystore.storage.MongoClientFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.lexicalscope.jewel.cli.Option;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;

/**
 * Counts the predicates used in an ingested database and stores the counts with the English label of each predicate.
 * Object predicates go to {@value #OBJECTS_SUMMARY}, literal predicates, split by literal type, to {@value #LITERALS_SUMMARY}.
 * Both collections are replaced on every run.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class SummarizePredicates {

    public static final String OBJECTS_SUMMARY = "objectsSummary";
    public static final String LITERALS_SUMMARY = "literalsSummary";
    public static final String UNKNOWN_LABEL = "Unknown Label";

    static final String ID_FIELD = "_id";
    private static final String PAIRS = "pairs";
    private static final String LITERAL_TYPE = "literalType";
    private static final String PREDICATE_PAIRS = "predicatePairs";

    private static final Logger log = LoggerFactory.getLogger(SummarizePredicates.class);

    /**
     * One count per related entity and predicate.
     */
    static final List<Bson> OBJECTS_PIPELINE = ImmutableList.of(
        Aggregates.project(new Document(PAIRS, new Document("$objectToArray", "$" + ObjectRecord.OBJECTS_FIELD))),
        Aggregates.unwind("$" + PAIRS),
        Aggregates.unwind("$" + PAIRS + ".v"),
        Aggregates.group("$" + PAIRS + ".v", Accumulators.sum(PredicateSummary.COUNT_FIELD, 1)),
        Aggregates.sort(Sorts.descending(PredicateSummary.COUNT_FIELD)));

    /**
     * One count per entity, literal type and predicate.
     */
    static final List<Bson> LITERALS_PIPELINE = ImmutableList.of(
        Aggregates.project(new Document(PAIRS, new Document("$objectToArray", "$" + LiteralRecord.LITERALS_FIELD))),
        Aggregates.unwind("$" + PAIRS),
        Aggregates.project(new Document(LITERAL_TYPE, "$" + PAIRS + ".k")
            .append(PREDICATE_PAIRS, new Document("$objectToArray", "$" + PAIRS + ".v"))),
        Aggregates.unwind("$" + PREDICATE_PAIRS),
        Aggregates.group(new Document(LITERAL_TYPE, "$" + LITERAL_TYPE).append(PredicateSummary.PREDICATE_FIELD, "$" + PREDICATE_PAIRS + ".k"),
            Accumulators.sum(PredicateSummary.COUNT_FIELD, 1)),
        Aggregates.sort(Sorts.descending(PredicateSummary.COUNT_FIELD)));

    private SummarizePredicates() {
    }

    /**
     * Command line options.
     */
    @SuppressWarnings("checkstyle:javadocmethod")
    public interface SummaryOptions extends BasicOptions {
        @Option(shortName = "d", description = "MongoDB database holding the ingested dump")
        String database();
    }

    public static void main(String[] args) {
        SummaryOptions options = handleOptions(SummaryOptions.class, args);
        try (MongoClient client = MongoClientFactory.fromConfig()) {
            MongoDatabase database = client.getDatabase(options.database());
            summarize(database, RecordKind.OBJECTS, OBJECTS_PIPELINE, OBJECTS_SUMMARY);
            summarize(database, RecordKind.LITERALS, LITERALS_PIPELINE, LITERALS_SUMMARY);
        } catch (MongoException | ContainedException e) {
            log.error("Summary of " + options.database() + " failed", e);
            System.exit(1);
        }
    }

    /**
     * Aggregate a collection, label its predicates and replace the summary collection with the result.
     */
    static void summarize(MongoDatabase database, RecordKind kind, List<Bson> pipeline, String summaryCollection) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<Document> aggregated = database.getCollection(kind.getCollection()).aggregate(pipeline).allowDiskUse(true)
            .into(new ArrayList<>());
        Map<String, String> labels = fetchLabels(database.getCollection(RecordKind.ITEMS.getCollection()), predicatesOf(aggregated));
        List<PredicateSummary> summaries = decorate(aggregated, labels);

        MongoCollection<Document> summary = database.getCollection(summaryCollection);
        summary.drop();
        if (!summaries.isEmpty()) {
            List<Document> documents = new ArrayList<>(summaries.size());
            for (PredicateSummary s : summaries) documents.add(new Document(s.toDocument()));
            summary.insertMany(documents);
        }
        summary.createIndex(Indexes.descending(PredicateSummary.COUNT_FIELD));
        log.info("{} predicates of {} summarized in {}", summaries.size(), kind.getCollection(), stopwatch);
    }

    /**
     * @return the predicates of aggregation results, in result order
     */
    static Set<String> predicatesOf(List<Document> aggregated) {
        Set<String> predicates = new LinkedHashSet<>();
        for (Document result : aggregated) predicates.add(predicateOf(result));
        return predicates;
    }

    /**
     * Turn aggregation results into summaries. Results grouped by predicate only are object summaries,
     * results grouped by literal type and predicate are literal summaries.
     *
     * @param labels predicate to English label; predicates without one get {@value #UNKNOWN_LABEL}
     */
    static List<PredicateSummary> decorate(List<Document> aggregated, Map<String, String> labels) {
        List<PredicateSummary> summaries = new ArrayList<>(aggregated.size());
        for (Document result : aggregated) {
            Object id = result.get(ID_FIELD);
            String literalType = id instanceof Map ? (String) ((Map<?, ?>) id).get(LITERAL_TYPE) : null;
            String predicate = predicateOf(result);
            Number count = (Number) result.get(PredicateSummary.COUNT_FIELD);
            summaries.add(new PredicateSummary(literalType, predicate, labels.getOrDefault(predicate, UNKNOWN_LABEL), count.longValue()));
        }
        return summaries;
    }

    private static String predicateOf(Document result) {
        Object id = result.get(ID_FIELD);
        if (id instanceof Map) return (String) ((Map<?, ?>) id).get(PredicateSummary.PREDICATE_FIELD);
        if (id instanceof String) return (String) id;
        throw new ContainedException("Unexpected aggregation result: " + result.toJson());
    }

    /**
     * @return predicate to English label, for the predicates that have one
     */
    static Map<String, String> fetchLabels(MongoCollection<Document> items, Collection<String> predicates) {
        Map<String, String> labels = new HashMap<>();
        if (predicates.isEmpty()) return labels;
        String englishLabel = ItemRecord.LABELS_FIELD + "." + WikidataVocabulary.ENGLISH;
        for (Document item : items.find(Filters.in(DerivedRecord.ENTITY_FIELD, predicates))
                .projection(Projections.include(DerivedRecord.ENTITY_FIELD, englishLabel))) {
            Object itemLabels = item.get(ItemRecord.LABELS_FIELD);
            if (!(itemLabels instanceof Map)) continue;
            Object label = ((Map<?, ?>) itemLabels).get(WikidataVocabulary.ENGLISH);
            if (label != null) labels.put(item.getString(DerivedRecord.ENTITY_FIELD), label.toString());
        }
        return labels;
    }
}
