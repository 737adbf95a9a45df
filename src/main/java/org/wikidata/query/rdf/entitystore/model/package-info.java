/**
 * Records derived from dump entities: item metadata, object relations, literal relations and type sets,
 * plus the error records written when an entity can't be processed.
 * Each record turns itself into a plain document with {@code toDocument()}, ready for the store.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
package org.wikidata.query.rdf.entitystore.model;
