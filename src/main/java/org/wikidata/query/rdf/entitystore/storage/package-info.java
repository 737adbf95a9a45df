/**
 * Persistence of the derived records and of the ingestion errors.
 */
package org.wikidata.query.rdf.entitystore.storage;
