package org.wikidata.query.rdf.entitystore.storage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.exception.ContainedException;
import org.wikidata.query.rdf.entitystore.exception.FatalException;
import org.wikidata.query.rdf.entitystore.model.DerivedRecord;
import org.wikidata.query.rdf.entitystore.model.ItemRecord;
import org.wikidata.query.rdf.entitystore.model.RecordKind;

import com.google.common.collect.ImmutableList;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexModel;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.InsertManyOptions;

/**
 * {@link RecordStore} backed by a MongoDB database, one collection per record kind.
 * <p>
 * Inserts are unordered, so a rejected document doesn't prevent the others from being written.
 * Documents rejected as duplicates of already stored ones, e.g., when a dump is ingested twice into the same database,
 * are skipped with a warning.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class MongoRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(MongoRecordStore.class);

    private final MongoDatabase database;

    public MongoRecordStore(MongoDatabase database) {
        this.database = database;
    }

    /**
     * The indexes of each collection. Items are looked up by identifier, category and popularity,
     * and an entity appears at most once per category. Objects, literals and types hold one record per entity.
     */
    static Map<RecordKind, List<IndexModel>> indexSpecs() {
        Map<RecordKind, List<IndexModel>> specs = new EnumMap<>(RecordKind.class);
        for (RecordKind kind : RecordKind.values()) {
            List<IndexModel> indexes = new ArrayList<>();
            indexes.add(new IndexModel(Indexes.ascending(DerivedRecord.SEQUENCE_FIELD)));
            IndexOptions entityOptions = new IndexOptions().unique(kind != RecordKind.ITEMS);
            indexes.add(new IndexModel(Indexes.ascending(DerivedRecord.ENTITY_FIELD), entityOptions));
            if (kind == RecordKind.ITEMS) {
                indexes.add(new IndexModel(Indexes.ascending(ItemRecord.CATEGORY_FIELD)));
                indexes.add(new IndexModel(Indexes.ascending(ItemRecord.POPULARITY_FIELD)));
                Bson entityAndCategory = Indexes.compoundIndex(Indexes.ascending(DerivedRecord.ENTITY_FIELD),
                    Indexes.ascending(ItemRecord.CATEGORY_FIELD));
                indexes.add(new IndexModel(entityAndCategory, new IndexOptions().unique(true)));
            }
            specs.put(kind, ImmutableList.copyOf(indexes));
        }
        return specs;
    }

    @Override
    public void createIndexes() {
        for (Map.Entry<RecordKind, List<IndexModel>> kindIndexes : indexSpecs().entrySet()) {
            String collection = kindIndexes.getKey().getCollection();
            try {
                List<String> created = database.getCollection(collection).createIndexes(kindIndexes.getValue());
                log.info("Indexes of {}.{}: {}", database.getName(), collection, created);
            } catch (MongoException me) {
                throw new FatalException("Could not create the indexes of " + database.getName() + "." + collection, me);
            }
        }
    }

    @Override
    public void insert(RecordKind kind, List<Map<String, Object>> documents) {
        if (documents.isEmpty()) return;
        List<Document> batch = new ArrayList<>(documents.size());
        for (Map<String, Object> document : documents) batch.add(new Document(document));
        MongoCollection<Document> collection = database.getCollection(kind.getCollection());
        try {
            collection.insertMany(batch, new InsertManyOptions().ordered(false));
        } catch (MongoBulkWriteException bwe) {
            handleBulkWriteFailure(kind, batch.size(), bwe);
        } catch (MongoSocketException | MongoTimeoutException unreachable) {
            throw new FatalException("MongoDB is unreachable, could not write " + batch.size() + " " + kind.getCollection(), unreachable);
        } catch (MongoException me) {
            throw new ContainedException("Could not write " + batch.size() + " " + kind.getCollection(), me);
        }
    }

    private static void handleBulkWriteFailure(RecordKind kind, int batchSize, MongoBulkWriteException bwe) {
        int duplicates = 0;
        for (BulkWriteError error : bwe.getWriteErrors()) {
            if (ErrorCategory.fromErrorCode(error.getCode()) == ErrorCategory.DUPLICATE_KEY) duplicates++;
        }
        if (duplicates == bwe.getWriteErrors().size() && bwe.getWriteConcernError() == null) {
            log.warn("Skipped {} {} out of {} already in the store", duplicates, kind.getCollection(), batchSize);
            return;
        }
        throw new ContainedException(bwe.getWriteErrors().size() + " out of " + batchSize + " " + kind.getCollection()
            + " were not written", bwe);
    }
}
