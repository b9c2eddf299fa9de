package com.logosk.semanticdb.spi;

import java.util.Locale;

/**
 * The fixed set of tables a {@link SemanticStore} answers queries against.
 */
public enum StoreTable {
    ONTOLOGICAL_EVENTS,
    RELATION_TENSORS,
    DIALOGUES,
    WITNESSES;

    public String tableName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
