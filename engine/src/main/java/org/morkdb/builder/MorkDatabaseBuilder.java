package org.morkdb.builder;

import org.morkdb.model.DictionarySeed;
import org.morkdb.model.DictionaryStore;
import org.morkdb.model.MorkBuildException;
import org.morkdb.model.MorkDatabase;
import org.morkdb.model.MorkRow;
import org.morkdb.model.MorkTable;
import org.morkdb.model.ObjectStore;
import org.morkdb.syntax.CellNode;
import org.morkdb.syntax.CellText;
import org.morkdb.syntax.DictNode;
import org.morkdb.syntax.GroupNode;
import org.morkdb.syntax.MetaNode;
import org.morkdb.syntax.MorkDocument;
import org.morkdb.syntax.MorkItem;
import org.morkdb.syntax.MorkSyntaxParser;
import org.morkdb.syntax.RowNode;
import org.morkdb.syntax.TableNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link MorkDatabase} from a parsed Mork store.
 *
 * Items are processed strictly in file order, since later items may refer to
 * dictionaries and rows defined by earlier ones:
 * - DictNode -> overlay into the dictionary store
 * - RowNode -> row store (no default namespace)
 * - TableNode -> table store, building inline rows on the way
 * - anything else -> skipped with a warning
 *
 * A builder is single-use. Any {@link MorkBuildException} aborts the build and
 * no database is returned.
 */
public final class MorkDatabaseBuilder {

    /** Meta-dict column naming the namespace the dict's cells go to. */
    private static final String META_NAMESPACE_COLUMN = "a";

    private final DictionaryStore dictionaries;
    private final ObjectStore<MorkRow> rows = new ObjectStore<>();
    private final ObjectStore<MorkTable> tables = new ObjectStore<>();
    private final BuildDiagnostics diagnostics = new BuildDiagnostics();
    private final ReferenceResolver resolver;
    private final RowBuilder rowBuilder;
    private final TableBuilder tableBuilder;
    private boolean built;

    public MorkDatabaseBuilder() {
        this(DictionarySeed.DEFAULT);
    }

    public MorkDatabaseBuilder(DictionarySeed seed) {
        this.dictionaries = new DictionaryStore(seed);
        this.resolver = new ReferenceResolver(dictionaries);
        this.rowBuilder = new RowBuilder(resolver, rows, diagnostics);
        this.tableBuilder = new TableBuilder(resolver, rows, tables, rowBuilder, diagnostics);
    }

    /**
     * Builds a database with the default dictionary seed.
     */
    public static MorkDatabase fromSyntax(MorkDocument document) {
        return new MorkDatabaseBuilder().build(document);
    }

    /**
     * Parses Mork text and builds a database from it.
     *
     * @throws org.morkdb.syntax.MorkParseException if the text is not well-formed
     * @throws MorkBuildException if the store cannot be interpreted
     */
    public static MorkDatabase fromSource(String source) {
        return fromSyntax(MorkSyntaxParser.parse(source));
    }

    /**
     * Processes every item of the document and returns the finished database.
     *
     * @throws MorkBuildException if the store cannot be interpreted
     * @throws IllegalStateException if this builder was already used
     */
    public MorkDatabase build(MorkDocument document) {
        Objects.requireNonNull(document, "Document cannot be null");
        if (built) {
            throw new IllegalStateException("MorkDatabaseBuilder instances are single-use");
        }
        built = true;

        for (MorkItem item : document.items()) {
            if (item instanceof DictNode dict) {
                addDict(dict);
            } else if (item instanceof RowNode row) {
                rowBuilder.build(row, null);
            } else if (item instanceof TableNode table) {
                tableBuilder.build(table);
            } else if (item instanceof GroupNode group) {
                diagnostics.warn("skipping group {} with {} items", group.groupId(), group.items().size());
            }
        }

        return new MorkDatabase(dictionaries, rows, tables);
    }

    /**
     * @return Warnings about markers and items that were recognized but not applied
     */
    public List<String> warnings() {
        return diagnostics.warnings();
    }

    private void addDict(DictNode dict) {
        if (dict.meta().size() > 1) {
            throw new MorkBuildException("dictionary has " + dict.meta().size() + " meta-dictionaries");
        }

        Map<String, String> entries = new LinkedHashMap<>();
        for (CellNode cell : dict.cells()) {
            if (!(cell.column() instanceof CellText.Literal alias)) {
                throw new MorkBuildException("dictionary alias must be literal, was " + cell.column());
            }
            entries.put(alias.raw(), resolver.resolveValue(cell.value()));
            if (cell.cut()) {
                diagnostics.warn("ignoring cut marker on dictionary alias '{}'", alias.raw());
            }
        }

        String namespace = dict.meta().isEmpty()
                ? ReferenceResolver.VALUE_NAMESPACE
                : metaNamespace(dict.meta().get(0));
        dictionaries.merge(namespace, entries);
    }

    // Only a literal "a" column names the namespace; other meta cells are never looked up
    private String metaNamespace(MetaNode meta) {
        for (CellNode cell : meta.cells()) {
            if (cell.column() instanceof CellText.Literal column
                    && META_NAMESPACE_COLUMN.equals(EscapeDecoder.decode(column.raw()))) {
                return resolver.resolveValue(cell.value());
            }
        }
        return ReferenceResolver.VALUE_NAMESPACE;
    }
}
