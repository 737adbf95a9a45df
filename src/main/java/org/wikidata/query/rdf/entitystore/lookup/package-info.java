/**
 * Request parameter validation for the lookup API.
 */
package org.wikidata.query.rdf.entitystore.lookup;
