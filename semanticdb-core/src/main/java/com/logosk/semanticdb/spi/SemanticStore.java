package com.logosk.semanticdb.spi;

import com.logosk.semanticdb.core.EdgeRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable persistence for events, edge records, dialogues and witnesses. The core only
 * depends on these signatures; retries and transactions are the implementation's concern.
 */
public interface SemanticStore {

    void storeEvent(OntologicalEvent event);

    void storeEdgeRecord(EdgeRecord record);

    /**
     * Restores a record previously passed to {@link #storeEdgeRecord(EdgeRecord)} with its
     * full field set.
     */
    Optional<EdgeRecord> loadEdgeRecord(String id);

    void storeDialogue(Dialogue dialogue);

    void storeWitness(WitnessRecord witness);

    /**
     * Rows of {@code table} whose columns equal every given filter value, newest first,
     * at most {@code limit} of them.
     */
    List<Map<String, Object>> query(StoreTable table, Map<String, Object> filters, int limit);
}
