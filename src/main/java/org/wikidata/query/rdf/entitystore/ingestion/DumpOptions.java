package org.wikidata.query.rdf.entitystore.ingestion;

import java.io.File;

import org.wikidata.query.rdf.entitystore.common.OptionsUtils.BasicOptions;

import com.lexicalscope.jewel.cli.Option;

/**
 * Command line options of {@link ParseDump}.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
@SuppressWarnings("checkstyle:javadocmethod")
public interface DumpOptions extends BasicOptions {

    @Option(shortName = "f", description = "Wikidata JSON dump, compressed with bzip2 or gzip, or not compressed")
    File dump();

    @Option(shortName = "d", defaultToNull = true, description = "MongoDB database name. Defaults to 'wikidata' followed by today's date"
        + " as ddMMyyyy")
    String database();

    @Option(defaultValue = "100", description = "How many records of a kind are written at once")
    int batchSize();

    @Option(defaultValue = "16", description = "How many entities are classified in parallel")
    int workers();

    @Option(defaultValue = "3", description = "How many times a rate limited SPARQL query is retried")
    int retries();

    @Option(defaultValue = "5", description = "Seconds to wait before retrying a rate limited SPARQL query")
    int retryDelay();

    @Option(defaultValue = "100000", description = "Log the progress every that many lines, 0 to disable")
    long progressInterval();
}
