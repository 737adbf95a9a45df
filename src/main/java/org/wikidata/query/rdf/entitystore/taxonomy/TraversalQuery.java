package org.wikidata.query.rdf.entitystore.taxonomy;

import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

import org.wikidata.query.rdf.entitystore.common.SparqlQueries;

import com.google.common.collect.ImmutableSet;

/**
 * All the nodes reachable from a set of roots by following one property zero or more times.
 * A {@link Direction#FORWARD} traversal follows the property from subject to value,
 * e.g., the superclasses of a type; a {@link Direction#BACKWARD} one goes from value to subject,
 * e.g., the subclasses of a type.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class TraversalQuery {

    /**
     * Which way the property is followed.
     */
    public enum Direction {
        FORWARD,
        BACKWARD
    }

    private final ImmutableSet<String> roots;
    private final String property;
    private final Direction direction;
    private final boolean withLabels;

    public TraversalQuery(Collection<String> roots, String property, Direction direction, boolean withLabels) {
        if (roots.isEmpty()) throw new IllegalArgumentException("A traversal needs at least a root");
        this.roots = ImmutableSet.copyOf(roots);
        this.property = Objects.requireNonNull(property, "property");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.withLabels = withLabels;
    }

    public ImmutableSet<String> getRoots() {
        return roots;
    }

    public String getProperty() {
        return property;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isWithLabels() {
        return withLabels;
    }

    /**
     * @return the SPARQL query answering this traversal
     */
    public String toSparql() {
        String template;
        if (direction == Direction.FORWARD) {
            template = withLabels ? SparqlQueries.FORWARD_CLOSURE_WITH_LABELS_QUERY : SparqlQueries.FORWARD_CLOSURE_QUERY;
        } else {
            template = withLabels ? SparqlQueries.BACKWARD_CLOSURE_WITH_LABELS_QUERY : SparqlQueries.BACKWARD_CLOSURE_QUERY;
        }
        String values = roots.stream().map(root -> "wd:" + root).collect(Collectors.joining(" "));
        return template
            .replace(SparqlQueries.ROOTS_PLACE_HOLDER, values)
            .replace(SparqlQueries.PID_PLACE_HOLDER, property);
    }

    @Override
    public String toString() {
        return direction + " " + property + " from " + roots;
    }
}
