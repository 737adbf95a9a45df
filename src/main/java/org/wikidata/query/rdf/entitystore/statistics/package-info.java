/**
 * Statistics over an ingested dump.
 *
 * @author Marco Fossati - <a href="https://meta.wikimedia.org/wiki/User:Hjfocs">User:Hjfocs</a>
 * @since 0.1.0
 */
package org.wikidata.query.rdf.entitystore.statistics;
