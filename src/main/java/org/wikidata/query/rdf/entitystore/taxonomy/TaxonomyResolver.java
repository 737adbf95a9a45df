package org.wikidata.query.rdf.entitystore.taxonomy;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.common.WikidataVocabulary;
import org.wikidata.query.rdf.entitystore.exception.RateLimitedException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Resolves class hierarchies through a {@link GraphQueryService}.
 * <p>
 * Failures never propagate: a closure that can't be resolved is empty, and so is a superclass chain.
 * An empty closure lowers the recall of NER typing without stopping the ingestion, so every fallback is logged.
 * Rate limited queries are retried {@code retries} times, waiting {@code retryDelay} before each attempt.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class TaxonomyResolver {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyResolver.class);

    private final GraphQueryService service;
    private final int retries;
    private final Duration retryDelay;

    public TaxonomyResolver(GraphQueryService service, int retries, Duration retryDelay) {
        if (retries < 0) throw new IllegalArgumentException("The number of retries can't be negative: " + retries);
        this.service = service;
        this.retries = retries;
        this.retryDelay = retryDelay;
    }

    /**
     * Build the taxonomy sets listed in {@link TaxonomyDefinition}.
     */
    public Taxonomy build() {
        TaxonomySet locations = resolveDefinition(TaxonomyDefinition.LOCATION);
        TaxonomySet organizations = resolveDefinition(TaxonomyDefinition.ORGANIZATION);
        Taxonomy taxonomy = new Taxonomy(locations, organizations);
        log.info("Taxonomy resolved: {}", taxonomy);
        return taxonomy;
    }

    private TaxonomySet resolveDefinition(TaxonomyDefinition definition) {
        Set<String> members = closure(definition.getRoots(), definition.getExclusions());
        return new TaxonomySet(definition.name().toLowerCase(Locale.ENGLISH), members);
    }

    /**
     * All the subclasses of the roots, the roots included, minus all the subclasses of each exclusion root.
     * Each exclusion is resolved by its own query, so a failed exclusion only removes nothing.
     *
     * @return an immutable set, empty if the roots can't be resolved
     */
    public ImmutableSet<String> closure(Collection<String> roots, Collection<String> excludeRoots) {
        Set<String> included = new LinkedHashSet<>(resolveOrEmpty(roots));
        if (included.isEmpty()) return ImmutableSet.of();
        for (String excludeRoot : excludeRoots) {
            included.removeAll(resolveOrEmpty(Collections.singleton(excludeRoot)));
        }
        return ImmutableSet.copyOf(included);
    }

    /**
     * All the subclasses of the roots, the roots included, with a single query.
     *
     * @return an immutable set, empty if the query fails
     */
    public ImmutableSet<String> resolveOrEmpty(Collection<String> roots) {
        TraversalQuery query = new TraversalQuery(roots, WikidataVocabulary.SUBCLASS_OF, TraversalQuery.Direction.BACKWARD, false);
        List<GraphNode> nodes = queryWithRetries(query);
        if (nodes == null) {
            log.warn("Could not resolve the subclasses of {}. Will use an empty set instead", roots);
            return ImmutableSet.of();
        }
        ImmutableSet.Builder<String> ids = ImmutableSet.builder();
        for (GraphNode node : nodes) ids.add(node.getId());
        ImmutableSet<String> closure = ids.build();
        log.debug("{} has {} subclasses", roots, closure.size());
        return closure;
    }

    /**
     * The transitive superclasses of a type, the type itself included, in the order the service returns them.
     *
     * @return an immutable list without duplicates, empty if the query fails
     */
    public ImmutableList<String> superclasses(String typeId) {
        TraversalQuery query = new TraversalQuery(Collections.singleton(typeId), WikidataVocabulary.SUBCLASS_OF,
            TraversalQuery.Direction.FORWARD, true);
        List<GraphNode> nodes = queryWithRetries(query);
        if (nodes == null) {
            log.warn("Could not resolve the superclasses of {}. Its extended types will be empty", typeId);
            return ImmutableList.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (GraphNode node : nodes) ids.add(node.getId());
        return ImmutableList.copyOf(ids);
    }

    /**
     * @return the query results, null if the query failed or kept being rate limited
     */
    @SuppressWarnings("IllegalCatch")
    private List<GraphNode> queryWithRetries(TraversalQuery query) {
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return service.reachable(query);
            } catch (RateLimitedException rle) {
                if (attempt == retries) {
                    log.warn("Rate limit hit for {} and no retries left", query);
                    return null;
                }
                log.info("Rate limit hit for {}. Retrying in {} ms (attempt {}/{})", query, retryDelay.toMillis(), attempt + 1, retries);
                if (!sleep()) return null;
            } catch (RuntimeException re) {
                log.warn("Traversal " + query + " failed", re);
                return null;
            }
        }
        return null;
    }

    private boolean sleep() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
