package org.wikidata.query.rdf.entitystore.ingestion;

import static org.wikidata.query.rdf.entitystore.common.OptionsUtils.databaseOrDefault;
import static org.wikidata.query.rdf.entitystore.common.OptionsUtils.handleOptions;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.exception.FatalException;
import org.wikidata.query.rdf.entitystore.storage.BatchWriter;
import org.wikidata.query.rdf.entitystore.storage.MongoClientFactory;
import org.wikidata.query.rdf.entitystore.storage.MongoErrorSink;
import org.wikidata.query.rdf.entitystore.storage.MongoRecordStore;
import org.wikidata.query.rdf.entitystore.taxonomy.SparqlGraphQueryService;
import org.wikidata.query.rdf.entitystore.taxonomy.SuperclassCache;
import org.wikidata.query.rdf.entitystore.taxonomy.Taxonomy;
import org.wikidata.query.rdf.entitystore.taxonomy.TaxonomyResolver;

import com.mongodb.client.MongoClient;

/**
 * Loads a Wikidata JSON dump into MongoDB: items, objects, literals and types collections, plus the error log.
 * <p>
 * Example: {@code java -cp entity-store.jar org.wikidata.query.rdf.entitystore.ingestion.ParseDump -f latest-all.json.bz2}
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class ParseDump {

    private static final Logger log = LoggerFactory.getLogger(ParseDump.class);

    private ParseDump() {
    }

    public static void main(String[] args) {
        DumpOptions options = handleOptions(DumpOptions.class, args);
        try {
            run(options);
        } catch (FatalException fe) {
            log.error("Ingestion aborted", fe);
            System.exit(1);
        }
        System.exit(0);
    }

    private static void run(DumpOptions options) {
        String database = databaseOrDefault(options.database(), LocalDate.now());
        log.info("Loading {} into the database {}", options.dump(), database);
        try (DumpReader reader = DumpReader.open(options.dump().toPath(), options.progressInterval());
             MongoClient client = MongoClientFactory.fromConfig();
             MongoErrorSink errors = MongoErrorSink.fromConfig(client)) {
            MongoRecordStore store = new MongoRecordStore(client.getDatabase(database));
            store.createIndexes();

            TaxonomyResolver resolver = new TaxonomyResolver(SparqlGraphQueryService.fromConfig(), options.retries(),
                Duration.ofSeconds(options.retryDelay()));
            Taxonomy taxonomy = resolver.build();
            SuperclassCache superclasses = new SuperclassCache(resolver);
            EntityClassifier classifier = new EntityClassifier(taxonomy, superclasses);

            BatchWriter writer = new BatchWriter(store, options.batchSize());
            IngestionReport report = new IngestionPipeline(classifier, writer, errors, options.workers()).run(reader);
            log.info("Done: {}. Mean line size {} bytes. Resolved the superclasses of {} types with {} queries", report,
                Math.round(reader.meanLineSize()), superclasses.size(), superclasses.remoteLookups());
        } catch (IOException ioe) {
            log.warn("Could not close the dump", ioe);
        }
    }
}
