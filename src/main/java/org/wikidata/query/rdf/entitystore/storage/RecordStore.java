package org.wikidata.query.rdf.entitystore.storage;

import java.util.List;
import java.util.Map;

import org.wikidata.query.rdf.entitystore.exception.ContainedException;
import org.wikidata.query.rdf.entitystore.exception.FatalException;
import org.wikidata.query.rdf.entitystore.model.RecordKind;

/**
 * Destination of the derived records: one collection per {@link RecordKind}.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public interface RecordStore {

    /**
     * Create the lookup indexes of every collection. Indexes that already exist are left as they are.
     *
     * @throws FatalException if the store can't be reached
     */
    void createIndexes();

    /**
     * Bulk insert documents of one kind. A failure may leave some of the documents written.
     *
     * @throws ContainedException if the insert fails
     * @throws FatalException if the store can't be reached anymore
     */
    void insert(RecordKind kind, List<Map<String, Object>> documents);
}
