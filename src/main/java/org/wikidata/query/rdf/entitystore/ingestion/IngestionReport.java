package org.wikidata.query.rdf.entitystore.ingestion;

import java.time.Duration;

/**
 * Counters of a completed ingestion run.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class IngestionReport {

    private final long lines;
    private final long entities;
    private final long skippedLines;
    private final long failedEntities;
    private final long recordsWritten;
    private final long failedFlushes;
    private final Duration elapsed;

    public IngestionReport(long lines, long entities, long skippedLines, long failedEntities, long recordsWritten, long failedFlushes,
                           Duration elapsed) {
        this.lines = lines;
        this.entities = entities;
        this.skippedLines = skippedLines;
        this.failedEntities = failedEntities;
        this.recordsWritten = recordsWritten;
        this.failedFlushes = failedFlushes;
        this.elapsed = elapsed;
    }

    /**
     * @return how many lines were read from the dump
     */
    public long getLines() {
        return lines;
    }

    /**
     * @return how many entities were classified and handed to the writer
     */
    public long getEntities() {
        return entities;
    }

    /**
     * @return how many lines were not entities, e.g., the enclosing brackets of the dump or malformed JSON
     */
    public long getSkippedLines() {
        return skippedLines;
    }

    public long getFailedEntities() {
        return failedEntities;
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }

    public long getFailedFlushes() {
        return failedFlushes;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return lines + " lines processed in " + elapsed.getSeconds() + " seconds: " + entities + " entities, "
            + skippedLines + " skipped lines, " + failedEntities + " failed entities, " + recordsWritten + " records written, "
            + failedFlushes + " failed flushes";
    }
}
