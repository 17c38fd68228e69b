package org.morkdb.builder;

import org.morkdb.model.MorkBuildException;
import org.morkdb.model.MorkRow;
import org.morkdb.model.ObjectKey;
import org.morkdb.model.ObjectStore;
import org.morkdb.syntax.CellNode;
import org.morkdb.syntax.RowNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds rows and stores them in the row store.
 */
final class RowBuilder {

    private final ReferenceResolver resolver;
    private final ObjectStore<MorkRow> rows;
    private final BuildDiagnostics diagnostics;

    RowBuilder(ReferenceResolver resolver, ObjectStore<MorkRow> rows, BuildDiagnostics diagnostics) {
        this.resolver = resolver;
        this.rows = rows;
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a row and stores it, replacing any row under the same key.
     *
     * @param defaultNamespace Namespace of the enclosing table, or null at top level
     * @return The key the row was stored under
     * @throws MorkBuildException if no namespace can be determined or a reference is undefined
     */
    ObjectKey build(RowNode node, String defaultNamespace) {
        Map<String, String> cells = new LinkedHashMap<>();
        for (CellNode cell : node.cells()) {
            ReferenceResolver.ResolvedCell resolved = resolver.resolveCell(cell);
            cells.put(resolved.column(), resolved.value());
            if (cell.cut()) {
                diagnostics.warn("ignoring cut marker on cell '{}' of row {}", resolved.column(), node.id());
            }
        }

        ObjectKey key = resolver.resolveKey(node.id(), defaultNamespace)
                .orElseThrow(() -> new MorkBuildException("no namespace determined for row " + node.id()));

        if (node.truncated()) {
            diagnostics.warn("ignoring truncated marker on row {}", key);
        }
        if (node.cut()) {
            diagnostics.warn("ignoring cut marker on row {}", key);
        }
        if (!node.meta().isEmpty()) {
            diagnostics.warn("ignoring meta-row of row {}", key);
        }

        rows.put(key, new MorkRow(cells));
        return key;
    }
}
