package org.morkdb.builder;

import org.morkdb.model.MissingRowException;
import org.morkdb.model.MorkBuildException;
import org.morkdb.model.MorkRow;
import org.morkdb.model.MorkTable;
import org.morkdb.model.ObjectKey;
import org.morkdb.model.ObjectStore;
import org.morkdb.syntax.RowNode;
import org.morkdb.syntax.TableEntry;
import org.morkdb.syntax.TableNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds tables and stores them in the table store.
 *
 * A table must name its own namespace. Its rows inherit that namespace when
 * they have none; bare row ids must refer to rows that are already built.
 */
final class TableBuilder {

    private final ReferenceResolver resolver;
    private final ObjectStore<MorkRow> rows;
    private final ObjectStore<MorkTable> tables;
    private final RowBuilder rowBuilder;
    private final BuildDiagnostics diagnostics;

    TableBuilder(ReferenceResolver resolver, ObjectStore<MorkRow> rows, ObjectStore<MorkTable> tables,
            RowBuilder rowBuilder, BuildDiagnostics diagnostics) {
        this.resolver = resolver;
        this.rows = rows;
        this.tables = tables;
        this.rowBuilder = rowBuilder;
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a table, building its inline rows, and stores it.
     *
     * @return The key the table was stored under
     * @throws MissingRowException if a bare row id names a row not built yet
     * @throws MorkBuildException if the table has no namespace or a reference is undefined
     */
    ObjectKey build(TableNode node) {
        ObjectKey tableKey = resolver.resolveKey(node.id(), null)
                .orElseThrow(() -> new MorkBuildException("no namespace determined for table " + node.id()));
        String namespace = tableKey.namespace();

        List<ObjectKey> rowKeys = new ArrayList<>(node.entries().size());
        for (TableEntry entry : node.entries()) {
            if (entry instanceof RowNode row) {
                rowKeys.add(rowBuilder.build(row, namespace));
            } else {
                TableEntry.RowReference reference = (TableEntry.RowReference) entry;
                ObjectKey rowKey = resolver.resolveKey(reference.id(), namespace).orElseThrow();
                if (!rows.contains(rowKey)) {
                    throw new MissingRowException(rowKey, tableKey);
                }
                if (reference.cut()) {
                    diagnostics.warn("ignoring cut marker on row {} in table {}", rowKey, tableKey);
                }
                rowKeys.add(rowKey);
            }
        }

        if (node.truncated()) {
            diagnostics.warn("ignoring truncated marker on table {}", tableKey);
        }
        if (!node.meta().isEmpty()) {
            diagnostics.warn("ignoring meta-table of table {}", tableKey);
        }

        tables.put(tableKey, new MorkTable(rowKeys));
        return tableKey;
    }
}
