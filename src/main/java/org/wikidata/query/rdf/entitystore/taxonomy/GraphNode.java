package org.wikidata.query.rdf.entitystore.taxonomy;

import java.util.Objects;

/**
 * A node reached by a traversal query: an entity identifier and, when requested, its label.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class GraphNode {

    private final String id;
    private final String label;

    public GraphNode(String id, String label) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = label;
    }

    public String getId() {
        return id;
    }

    /**
     * @return the label, null if the query did not ask for labels
     */
    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphNode)) return false;
        GraphNode other = (GraphNode) o;
        return id.equals(other.id) && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label);
    }

    @Override
    public String toString() {
        return label == null ? id : id + " (" + label + ")";
    }
}
