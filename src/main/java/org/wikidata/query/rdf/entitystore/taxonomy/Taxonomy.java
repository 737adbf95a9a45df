package org.wikidata.query.rdf.entitystore.taxonomy;

import java.util.Objects;

/**
 * The class sets an entity's instance-of values are checked against to assign location and organization NER types.
 * Built once by {@link TaxonomyResolver#build()} and never changed afterwards.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class Taxonomy {

    private final TaxonomySet locations;
    private final TaxonomySet organizations;

    public Taxonomy(TaxonomySet locations, TaxonomySet organizations) {
        this.locations = Objects.requireNonNull(locations, "locations");
        this.organizations = Objects.requireNonNull(organizations, "organizations");
    }

    /**
     * A taxonomy that classifies nothing as location or organization.
     */
    public static Taxonomy empty() {
        return new Taxonomy(TaxonomySet.empty("location"), TaxonomySet.empty("organization"));
    }

    public TaxonomySet getLocations() {
        return locations;
    }

    public TaxonomySet getOrganizations() {
        return organizations;
    }

    public boolean isLocation(String classId) {
        return locations.contains(classId);
    }

    public boolean isOrganization(String classId) {
        return organizations.contains(classId);
    }

    @Override
    public String toString() {
        return "Taxonomy[" + locations + ", " + organizations + "]";
    }
}
