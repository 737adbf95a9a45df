package org.wikidata.query.rdf.entitystore.taxonomy;

import java.util.List;

import org.wikidata.query.rdf.entitystore.exception.ContainedException;
import org.wikidata.query.rdf.entitystore.exception.RateLimitedException;

/**
 * A remote knowledge graph that answers transitive traversal queries.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public interface GraphQueryService {

    /**
     * Fetch every node reachable from the query roots.
     *
     * @throws RateLimitedException if the service asks to slow down: the same query may be retried later
     * @throws ContainedException   on any other failure, including undecodable responses
     */
    List<GraphNode> reachable(TraversalQuery query) throws RateLimitedException;
}
