package org.morkdb.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The logical database built from a Mork store.
 *
 * Owns the dictionaries and the row and table stores. Once built it is only
 * read, apart from in-place value rewrites on {@link MorkRow}, so it can be
 * shared between reader threads without locking.
 */
public final class MorkDatabase {

    private final DictionaryStore dictionaries;
    private final ObjectStore<MorkRow> rows;
    private final ObjectStore<MorkTable> tables;

    public MorkDatabase(DictionaryStore dictionaries, ObjectStore<MorkRow> rows, ObjectStore<MorkTable> tables) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "Dictionaries cannot be null");
        this.rows = Objects.requireNonNull(rows, "Rows cannot be null");
        this.tables = Objects.requireNonNull(tables, "Tables cannot be null");
    }

    // ==================== Dictionaries ====================

    /**
     * @throws MorkLookupException if the namespace or alias is undefined
     */
    public String lookup(String namespace, String alias) {
        return dictionaries.get(namespace, alias);
    }

    public Set<String> dictionaryNamespaces() {
        return dictionaries.namespaces();
    }

    /**
     * @throws MorkLookupException if the namespace is undefined
     */
    public Map<String, String> dictionary(String namespace) {
        return dictionaries.dictionary(namespace);
    }

    // ==================== Rows ====================

    public List<ObjectStore.Entry<MorkRow>> rows() {
        return rows.entries();
    }

    public Optional<MorkRow> row(String namespace, String id) {
        return rows.find(namespace, id);
    }

    public Optional<MorkRow> row(ObjectKey key) {
        return rows.find(key);
    }

    public int rowCount() {
        return rows.size();
    }

    // ==================== Tables ====================

    public List<ObjectStore.Entry<MorkTable>> tables() {
        return tables.entries();
    }

    public Optional<MorkTable> table(String namespace, String id) {
        return tables.find(namespace, id);
    }

    public int tableCount() {
        return tables.size();
    }

    /**
     * Resolves a table's row keys against the row store.
     *
     * @return The rows in table order
     */
    public List<MorkRow> rowsOf(MorkTable table) {
        List<MorkRow> result = new ArrayList<>(table.size());
        for (ObjectKey key : table.rowKeys()) {
            // Tables are only stored after all their rows exist, and rows are never removed
            result.add(rows.find(key).orElseThrow(
                    () -> new IllegalStateException("Row " + key + " missing from row store")));
        }
        return result;
    }

    /**
     * @return Union of the column names of the table's rows, in first-seen order
     */
    public Set<String> columnNames(MorkTable table) {
        Set<String> columns = new LinkedHashSet<>();
        for (MorkRow row : rowsOf(table)) {
            columns.addAll(row.columnNames());
        }
        return columns;
    }
}
