package org.wikidata.query.rdf.entitystore.ingestion;

import java.nio.charset.StandardCharsets;

/**
 * A raw line of the dump with its zero-based position.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class DumpLine {

    private final long index;
    private final byte[] bytes;

    public DumpLine(long index, byte[] bytes) {
        this.index = index;
        this.bytes = bytes;
    }

    public long getIndex() {
        return index;
    }

    /**
     * @return the size of the line in bytes, line terminator excluded
     */
    public int size() {
        return bytes.length;
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
