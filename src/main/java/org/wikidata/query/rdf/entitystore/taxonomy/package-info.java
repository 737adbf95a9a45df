/**
 * Class hierarchies fetched from the Wikidata Query Service: the taxonomy sets used for NER typing
 * and the run-wide cache of superclass chains used for extended types.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
package org.wikidata.query.rdf.entitystore.taxonomy;
