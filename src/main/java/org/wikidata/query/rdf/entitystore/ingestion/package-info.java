/**
 * Ingestion of Wikidata JSON dumps: reading, classification of the entities and the command line entry point.
 *
 * @author Marco Fossati - <a href="https://meta.wikimedia.org/wiki/User:Hjfocs">User:Hjfocs</a>
 * @since 0.1.0
 */
package org.wikidata.query.rdf.entitystore.ingestion;
