package org.wikidata.query.rdf.entitystore.taxonomy;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.http.client.HttpResponseException;
import org.apache.http.client.fluent.Request;
import org.apache.http.client.utils.URIBuilder;
import org.openrdf.OpenRDFException;
import org.openrdf.model.Value;
import org.openrdf.query.BindingSet;
import org.openrdf.query.TupleQueryResult;
import org.openrdf.query.resultio.QueryResultIO;
import org.openrdf.query.resultio.TupleQueryResultFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.common.Config;
import org.wikidata.query.rdf.entitystore.common.SparqlQueries;
import org.wikidata.query.rdf.entitystore.common.WikidataVocabulary;
import org.wikidata.query.rdf.entitystore.exception.ContainedException;
import org.wikidata.query.rdf.entitystore.exception.RateLimitedException;

/**
 * Runs traversal queries against a SPARQL endpoint, typically the Wikidata Query Service.
 * Results are requested in the SPARQL 1.1 JSON format.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class SparqlGraphQueryService implements GraphQueryService {

    public static final String SPARQL_RESULTS_MIME_TYPE = "application/sparql-results+json";
    static final int TOO_MANY_REQUESTS = 429;

    private static final Logger log = LoggerFactory.getLogger(SparqlGraphQueryService.class);

    private final URI endpoint;
    private final int timeoutMillis;

    public SparqlGraphQueryService(URI endpoint, int timeoutMillis) {
        this.endpoint = endpoint;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * A service talking to {@link Config#SPARQL_ENDPOINT}, waiting at most one minute per query,
     * which is also the Wikidata Query Service timeout.
     */
    public static SparqlGraphQueryService fromConfig() {
        return new SparqlGraphQueryService(URI.create(Config.SPARQL_ENDPOINT), 60_000);
    }

    @Override
    public List<GraphNode> reachable(TraversalQuery query) throws RateLimitedException {
        String sparql = query.toSparql();
        log.debug("SPARQL query to be sent to {}: {}", endpoint, sparql);
        URI uri;
        try {
            uri = new URIBuilder(endpoint)
                .setParameter("query", sparql)
                .build();
        } catch (URISyntaxException use) {
            throw new ContainedException("Failed building the URI for the traversal " + query + ". Parse error at index " + use.getIndex(), use);
        }
        InputStream results;
        try {
            results = Request.Get(uri)
                .setHeader("Accept", SPARQL_RESULTS_MIME_TYPE)
                .setHeader("User-Agent", Config.USER_AGENT)
                .connectTimeout(timeoutMillis)
                .socketTimeout(timeoutMillis)
                .execute()
                .returnContent().asStream();
        } catch (HttpResponseException hre) {
            if (hre.getStatusCode() == TOO_MANY_REQUESTS) {
                throw new RateLimitedException("Rate limit hit while resolving the traversal " + query, hre);
            }
            throw new ContainedException("The SPARQL endpoint answered with status " + hre.getStatusCode() + " to the traversal " + query, hre);
        } catch (IOException ioe) {
            throw new ContainedException("An I/O error occurred while sending the traversal " + query + " to " + endpoint, ioe);
        }
        List<GraphNode> nodes = parseResults(results);
        log.debug("Traversal {} reached {} nodes", query, nodes.size());
        return nodes;
    }

    /**
     * Decode SPARQL JSON results into nodes. Bindings that are not Wikidata items or properties,
     * e.g., lexemes or blank nodes, are dropped. The order of the results is kept, duplicates are removed.
     *
     * @throws ContainedException if the results can't be decoded
     */
    static List<GraphNode> parseResults(InputStream results) {
        Set<GraphNode> nodes = new LinkedHashSet<>();
        try {
            TupleQueryResult result = QueryResultIO.parse(results, TupleQueryResultFormat.JSON);
            try {
                while (result.hasNext()) {
                    BindingSet binding = result.next();
                    Value node = binding.getValue(SparqlQueries.NODE_VARIABLE);
                    if (node == null) continue;
                    String id = WikidataVocabulary.entityIdFromUri(node.stringValue());
                    if (id == null) continue;
                    Value label = binding.getValue(SparqlQueries.LABEL_VARIABLE);
                    nodes.add(new GraphNode(id, label == null ? null : label.stringValue()));
                }
            } finally {
                result.close();
            }
        } catch (OpenRDFException ore) {
            throw new ContainedException("Failed decoding the SPARQL results", ore);
        } catch (IOException ioe) {
            throw new ContainedException("An I/O error occurred while reading the SPARQL results", ioe);
        }
        return new ArrayList<>(nodes);
    }
}
