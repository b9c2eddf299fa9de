package com.logosk.semanticdb.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.logosk.semanticdb.core.EdgeRecord;
import com.logosk.semanticdb.spi.Dialogue;
import com.logosk.semanticdb.spi.OntologicalEvent;
import com.logosk.semanticdb.spi.SemanticStore;
import com.logosk.semanticdb.spi.StoreTable;
import com.logosk.semanticdb.spi.WitnessRecord;
import com.logosk.semanticdb.util.JsonUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps every stored row as a plain map, newest last, so tests can inspect what the
 * database handed to its persistence layer.
 */
class InMemorySemanticStoreTestDouble implements SemanticStore {

    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {
    };

    private final Map<StoreTable, List<Map<String, Object>>> tables = new EnumMap<>(StoreTable.class);
    private final Map<String, Map<String, Object>> edgeDocuments = new LinkedHashMap<>();

    InMemorySemanticStoreTestDouble() {
        for (StoreTable table : StoreTable.values()) {
            tables.put(table, new ArrayList<>());
        }
    }

    @Override
    public void storeEvent(OntologicalEvent event) {
        tables.get(StoreTable.ONTOLOGICAL_EVENTS).add(toRow(event));
    }

    @Override
    public void storeEdgeRecord(EdgeRecord record) {
        Map<String, Object> doc = record.toDocument();
        edgeDocuments.put(record.getId(), doc);
        Map<String, Object> row = new LinkedHashMap<>(doc);
        row.put("id", record.getId());
        tables.get(StoreTable.RELATION_TENSORS).add(row);
    }

    @Override
    public Optional<EdgeRecord> loadEdgeRecord(String id) {
        Map<String, Object> doc = edgeDocuments.get(id);
        return doc == null ? Optional.empty() : Optional.of(EdgeRecord.fromDocument(doc));
    }

    @Override
    public void storeDialogue(Dialogue dialogue) {
        tables.get(StoreTable.DIALOGUES).add(toRow(dialogue));
    }

    @Override
    public void storeWitness(WitnessRecord witness) {
        tables.get(StoreTable.WITNESSES).add(toRow(witness));
    }

    @Override
    public List<Map<String, Object>> query(StoreTable table, Map<String, Object> filters, int limit) {
        List<Map<String, Object>> rows = new ArrayList<>(tables.get(table));
        Collections.reverse(rows);
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (out.size() >= limit) {
                break;
            }
            boolean matches = filters == null || filters.entrySet().stream()
                    .allMatch(f -> Objects.equals(row.get(f.getKey()), f.getValue()));
            if (matches) {
                out.add(row);
            }
        }
        return out;
    }

    int count(StoreTable table) {
        return tables.get(table).size();
    }

    private static Map<String, Object> toRow(Object value) {
        return JsonUtils.instance().canonical().convertValue(value, ROW);
    }
}
