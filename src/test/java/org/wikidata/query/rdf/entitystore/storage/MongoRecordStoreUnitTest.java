package org.wikidata.query.rdf.entitystore.storage;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;

import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wikidata.query.rdf.entitystore.model.RecordKind;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.model.IndexModel;

@RunWith(RandomizedRunner.class)
public class MongoRecordStoreUnitTest extends RandomizedTest {

    private static BsonDocument keys(IndexModel index) {
        return index.getKeys().toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
    }

    @Test
    public void testEveryCollectionIsIndexedByIdentifierAndSequence() {
        Map<RecordKind, List<IndexModel>> specs = MongoRecordStore.indexSpecs();
        assertEquals(RecordKind.values().length, specs.size());
        for (RecordKind kind : RecordKind.values()) {
            List<IndexModel> indexes = specs.get(kind);
            assertEquals(new BsonDocument("id_entity", new BsonInt32(1)), keys(indexes.get(0)));
            assertEquals(new BsonDocument("entity", new BsonInt32(1)), keys(indexes.get(1)));
        }
        assertThat(specs.get(RecordKind.OBJECTS), hasSize(2));
        assertThat(specs.get(RecordKind.LITERALS), hasSize(2));
        assertThat(specs.get(RecordKind.TYPES), hasSize(2));
    }

    @Test
    public void testItemsAreUniquePerEntityAndCategory() {
        List<IndexModel> indexes = MongoRecordStore.indexSpecs().get(RecordKind.ITEMS);
        assertThat(indexes, hasSize(5));
        assertFalse(indexes.get(1).getOptions().isUnique());
        assertEquals(new BsonDocument("category", new BsonInt32(1)), keys(indexes.get(2)));
        assertEquals(new BsonDocument("popularity", new BsonInt32(1)), keys(indexes.get(3)));
        IndexModel unique = indexes.get(4);
        assertEquals(new BsonDocument("entity", new BsonInt32(1)).append("category", new BsonInt32(1)), keys(unique));
        assertTrue(unique.getOptions().isUnique());
        assertFalse(indexes.get(0).getOptions().isUnique());
    }

    @Test
    public void testOtherKindsHoldOneRecordPerEntity() {
        Map<RecordKind, List<IndexModel>> specs = MongoRecordStore.indexSpecs();
        for (RecordKind kind : new RecordKind[] {RecordKind.OBJECTS, RecordKind.LITERALS, RecordKind.TYPES}) {
            IndexModel entity = specs.get(kind).get(1);
            assertEquals(new BsonDocument("entity", new BsonInt32(1)), keys(entity));
            assertTrue(kind + " should be unique by entity", entity.getOptions().isUnique());
            assertFalse(specs.get(kind).get(0).getOptions().isUnique());
        }
    }
}
