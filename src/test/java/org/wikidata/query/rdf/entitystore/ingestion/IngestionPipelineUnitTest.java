package org.wikidata.query.rdf.entitystore.ingestion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wikidata.query.rdf.entitystore.exception.FatalException;
import org.wikidata.query.rdf.entitystore.model.DerivedRecord;
import org.wikidata.query.rdf.entitystore.model.ErrorRecord;
import org.wikidata.query.rdf.entitystore.model.RecordKind;
import org.wikidata.query.rdf.entitystore.storage.BatchWriter;
import org.wikidata.query.rdf.entitystore.storage.InMemoryErrorSink;
import org.wikidata.query.rdf.entitystore.storage.InMemoryRecordStore;
import org.wikidata.query.rdf.entitystore.taxonomy.GraphNode;
import org.wikidata.query.rdf.entitystore.taxonomy.SuperclassCache;
import org.wikidata.query.rdf.entitystore.taxonomy.Taxonomy;
import org.wikidata.query.rdf.entitystore.taxonomy.TaxonomyResolver;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakLingering;
import com.google.common.collect.AbstractIterator;

@RunWith(RandomizedRunner.class)
@ThreadLeakLingering(linger = 1000)
public class IngestionPipelineUnitTest extends RandomizedTest {

    private EntityClassifier classifier;
    private InMemoryRecordStore store;
    private InMemoryErrorSink errors;

    @Before
    public void setUp() {
        TaxonomyResolver resolver = new TaxonomyResolver(query -> Collections.<GraphNode>emptyList(), 0, Duration.ZERO);
        classifier = new EntityClassifier(Taxonomy.empty(), new SuperclassCache(resolver));
        store = new InMemoryRecordStore();
        errors = new InMemoryErrorSink();
    }

    private IngestionPipeline pipeline(int batchSize) {
        return new IngestionPipeline(classifier, new BatchWriter(store, batchSize), errors, randomIntBetween(1, 8));
    }

    private static Iterator<DumpLine> lines(String... lines) {
        List<DumpLine> dumpLines = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) dumpLines.add(new DumpLine(i, lines[i].getBytes(StandardCharsets.UTF_8)));
        return dumpLines.iterator();
    }

    @Test
    public void testEveryEntityIsWrittenToEveryCollection() {
        int entities = randomIntBetween(1, 300);
        String[] dump = new String[entities + 2];
        dump[0] = "[";
        for (int i = 1; i <= entities; i++) dump[i] = EntityJson.item("Q" + i).itemClaim("P31", "Q5").line();
        dump[entities + 1] = "]";
        IngestionReport report = pipeline(randomIntBetween(1, 100)).run(lines(dump));

        assertEquals(entities + 2, report.getLines());
        assertEquals(entities, report.getEntities());
        assertEquals(2, report.getSkippedLines());
        assertEquals(0, report.getFailedEntities());
        assertEquals(4L * entities, report.getRecordsWritten());
        for (RecordKind kind : RecordKind.values()) assertThat(store.documents(kind), hasSize(entities));
        assertThat(errors.errors(), empty());
    }

    @Test
    public void testMalformedLinesAreSkippedSilently() {
        IngestionReport report = pipeline(10).run(lines("[", "{\"id\": \"Q1\", \"type\":", "not json at all", "]"));
        assertEquals(4, report.getSkippedLines());
        assertEquals(0, report.getEntities());
        for (RecordKind kind : RecordKind.values()) assertThat(store.documents(kind), empty());
        assertThat(errors.errors(), empty());
    }

    @Test
    public void testFailingEntityGoesToTheErrorSink() {
        IngestionReport report = pipeline(10).run(lines(
            "[",
            EntityJson.item("Q1").itemClaim("P31", "Q5").line(),
            "{\"id\": \"Q2\", \"type\": \"item\", \"claims\": {\"P31\": [\"Q5\"]}},",
            EntityJson.item("Q3").line(),
            "]"));
        assertEquals(2, report.getEntities());
        assertEquals(1, report.getFailedEntities());
        List<ErrorRecord> recorded = errors.errors();
        assertThat(recorded, hasSize(1));
        assertEquals("Q2", recorded.get(0).getEntity());
        assertEquals(2, recorded.get(0).getSequence());
        assertTrue(recorded.get(0).getContext().contains("ClassCastException"));

        List<String> written = new ArrayList<>();
        for (Map<String, Object> item : store.documents(RecordKind.ITEMS)) written.add((String) item.get(DerivedRecord.ENTITY_FIELD));
        assertThat(written, containsInAnyOrder("Q1", "Q3"));
        assertThat("no partial record of a failed entity", store.documents(RecordKind.TYPES), hasSize(2));
    }

    @Test
    public void testSequenceIsTheLinePosition() {
        pipeline(1).run(lines("[", EntityJson.item("Q42").line(), "]"));
        List<Map<String, Object>> items = store.documents(RecordKind.ITEMS);
        assertThat(items, hasSize(1));
        assertEquals(1L, items.get(0).get(DerivedRecord.SEQUENCE_FIELD));
    }

    @Test(expected = FatalException.class)
    public void testUnreachableStoreAbortsTheRun() {
        store.unreachable();
        String[] dump = new String[50];
        for (int i = 0; i < dump.length; i++) dump[i] = EntityJson.item("Q" + i).line();
        pipeline(1).run(lines(dump));
    }

    @Test
    public void testUnreadableDumpAbortsTheRun() {
        Iterator<DumpLine> truncated = new AbstractIterator<DumpLine>() {
            private int read;

            @Override
            protected DumpLine computeNext() {
                if (read == 3) throw new FatalException("Truncated archive");
                return new DumpLine(read++, EntityJson.item("Q" + read).line().getBytes(StandardCharsets.UTF_8));
            }
        };
        try {
            pipeline(100).run(truncated);
            fail("The dump can't be read");
        } catch (FatalException expected) {
            assertEquals("Truncated archive", expected.getMessage());
        }
    }

    @Test
    public void testReportCountsLines() {
        IngestionReport report = pipeline(5).run(lines(EntityJson.item("Q1").line()));
        assertEquals(1, report.getLines());
        assertEquals(1, report.getEntities());
        assertTrue(report.toString().startsWith("1 lines processed"));
    }
}
