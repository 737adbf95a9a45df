package org.wikidata.query.rdf.entitystore.ingestion;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.exception.FatalException;

import com.google.common.collect.AbstractIterator;

/**
 * Streams the lines of a Wikidata JSON dump, decompressing it on the fly.
 * Files ending in {@code .bz2} and {@code .gz} are decompressed, anything else is read as is.
 * <p>
 * The number of lines is unknown up front: it is estimated as the archive size divided by the mean line size,
 * starting from {@link #INITIAL_MEAN_LINE_SIZE} and refined as lines are read.
 * Not thread safe: a single thread is expected to consume the lines.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class DumpReader extends AbstractIterator<DumpLine> implements Closeable {

    /**
     * Rough size of an entity line, in bytes, before any line is read.
     */
    public static final int INITIAL_MEAN_LINE_SIZE = 800;
    static final int BUFFER_SIZE = 1 << 16;

    private static final Logger log = LoggerFactory.getLogger(DumpReader.class);

    private final InputStream input;
    private final String name;
    private final long archiveBytes;
    private final long progressInterval;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(INITIAL_MEAN_LINE_SIZE * 4);
    private final byte[] chunk = new byte[BUFFER_SIZE];
    private int position;
    private int limit;
    private long linesRead;
    private long bytesRead;

    DumpReader(InputStream input, String name, long archiveBytes, long progressInterval) {
        this.input = input;
        this.name = name;
        this.archiveBytes = archiveBytes;
        this.progressInterval = progressInterval;
    }

    /**
     * Open a dump archive.
     *
     * @param progressInterval log the progress every that many lines, never if not positive
     * @throws FatalException if the archive can't be opened
     */
    public static DumpReader open(Path dump, long progressInterval) {
        InputStream raw = null;
        try {
            long size = Files.size(dump);
            raw = new BufferedInputStream(Files.newInputStream(dump), BUFFER_SIZE);
            InputStream input = decompress(raw, dump.getFileName().toString());
            log.info("Reading the dump {} ({} bytes)", dump, size);
            return new DumpReader(input, dump.toString(), size, progressInterval);
        } catch (IOException ioe) {
            if (raw != null) {
                try {
                    raw.close();
                } catch (IOException closeFailure) {
                    ioe.addSuppressed(closeFailure);
                }
            }
            throw new FatalException("Could not open the dump " + dump, ioe);
        }
    }

    private static InputStream decompress(InputStream stream, String fileName) throws IOException {
        String lowerCase = fileName.toLowerCase(Locale.ROOT);
        if (lowerCase.endsWith(".bz2")) {
            // Dumps are produced by parallel compressors, so they have several concatenated streams
            return new BZip2CompressorInputStream(stream, true);
        }
        if (lowerCase.endsWith(".gz")) {
            return new GZIPInputStream(stream, BUFFER_SIZE);
        }
        return stream;
    }

    /**
     * @throws FatalException if the archive is truncated or corrupted
     */
    @Override
    protected DumpLine computeNext() {
        line.reset();
        boolean sawByte = false;
        try {
            while (true) {
                if (position >= limit && !fill()) break;
                sawByte = true;
                int newline = indexOfNewline();
                if (newline < 0) {
                    line.write(chunk, position, limit - position);
                    position = limit;
                } else {
                    line.write(chunk, position, newline - position);
                    position = newline + 1;
                    break;
                }
            }
        } catch (IOException ioe) {
            throw new FatalException("Failed reading " + name + " after " + linesRead + " lines", ioe);
        }
        if (!sawByte) return endOfData();
        byte[] bytes = line.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') length--;
        byte[] content = length == bytes.length ? bytes : Arrays.copyOf(bytes, length);
        DumpLine dumpLine = new DumpLine(linesRead, content);
        linesRead++;
        bytesRead += content.length;
        if (progressInterval > 0 && linesRead % progressInterval == 0) {
            log.info("Read {} lines out of about {}", linesRead, estimatedTotal());
        }
        return dumpLine;
    }

    /**
     * @return false at the end of the stream
     */
    private boolean fill() throws IOException {
        int read;
        do {
            read = input.read(chunk, 0, chunk.length);
        } while (read == 0);
        if (read < 0) return false;
        position = 0;
        limit = read;
        return true;
    }

    private int indexOfNewline() {
        for (int i = position; i < limit; i++) {
            if (chunk[i] == '\n') return i;
        }
        return -1;
    }

    public long linesRead() {
        return linesRead;
    }

    /**
     * @return the mean size of the lines read so far, {@link #INITIAL_MEAN_LINE_SIZE} before the first one
     */
    public double meanLineSize() {
        if (linesRead == 0 || bytesRead == 0) return INITIAL_MEAN_LINE_SIZE;
        return (double) bytesRead / linesRead;
    }

    /**
     * @return the estimated number of lines in the dump
     */
    public long estimatedTotal() {
        return Math.round(archiveBytes / meanLineSize());
    }

    @Override
    public void close() throws IOException {
        input.close();
    }
}
