package org.morkdb.syntax.antlr;

import org.antlr.v4.runtime.tree.TerminalNode;

import org.morkdb.syntax.CellNode;
import org.morkdb.syntax.CellText;
import org.morkdb.syntax.DictNode;
import org.morkdb.syntax.GroupNode;
import org.morkdb.syntax.MetaNode;
import org.morkdb.syntax.MorkDocument;
import org.morkdb.syntax.MorkItem;
import org.morkdb.syntax.ObjectId;
import org.morkdb.syntax.ObjectRef;
import org.morkdb.syntax.RowNode;
import org.morkdb.syntax.Scope;
import org.morkdb.syntax.TableEntry;
import org.morkdb.syntax.TableNode;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that builds the Mork syntax tree from the parse tree.
 *
 * Every rule maps to exactly one record; nothing is resolved or decoded here.
 */
public class MorkSyntaxBuilder extends MorkParserBaseVisitor<Object> {

    @Override
    public MorkDocument visitDatabase(MorkParser.DatabaseContext ctx) {
        return new MorkDocument(visitItems(ctx.item()));
    }

    @Override
    public MorkItem visitItem(MorkParser.ItemContext ctx) {
        if (ctx.dict() != null) {
            return visitDict(ctx.dict());
        }
        if (ctx.row() != null) {
            return visitRow(ctx.row());
        }
        if (ctx.table() != null) {
            return visitTable(ctx.table());
        }
        return visitGroup(ctx.group());
    }

    @Override
    public GroupNode visitGroup(MorkParser.GroupContext ctx) {
        // @$${1A{@ -> 1A
        String start = ctx.GROUP_START().getText();
        String groupId = start.substring(4, start.length() - 2);
        boolean aborted = ctx.groupEnd().GROUP_ABORT() != null;
        return new GroupNode(groupId, visitItems(ctx.item()), aborted);
    }

    /**
     * Grammar rule:
     * dict: LANGLE (metaDict | cell)* RANGLE
     */
    @Override
    public DictNode visitDict(MorkParser.DictContext ctx) {
        List<MetaNode> meta = new ArrayList<>();
        for (MorkParser.MetaDictContext metaCtx : ctx.metaDict()) {
            meta.add(new MetaNode(visitCells(metaCtx.cell())));
        }
        return new DictNode(visitCells(ctx.cell()), meta);
    }

    /**
     * Grammar rule:
     * row: LBRACK MINUS? objectId (metaRow | cell)* RBRACK
     */
    @Override
    public RowNode visitRow(MorkParser.RowContext ctx) {
        List<MetaNode> meta = new ArrayList<>();
        for (MorkParser.MetaRowContext metaCtx : ctx.metaRow()) {
            meta.add(new MetaNode(visitCells(metaCtx.cell())));
        }
        return new RowNode(
                visitObjectId(ctx.objectId()),
                visitCells(ctx.cell()),
                ctx.MINUS() != null,
                false,
                meta);
    }

    /**
     * Grammar rule:
     * table: LBRACE MINUS? objectId (metaTable | tableEntry)* RBRACE
     */
    @Override
    public TableNode visitTable(MorkParser.TableContext ctx) {
        List<MetaNode> meta = new ArrayList<>();
        for (MorkParser.MetaTableContext metaCtx : ctx.metaTable()) {
            List<RowNode> rows = new ArrayList<>();
            for (MorkParser.RowContext rowCtx : metaCtx.row()) {
                rows.add(visitRow(rowCtx));
            }
            meta.add(new MetaNode(visitCells(metaCtx.cell()), rows));
        }

        List<TableEntry> entries = new ArrayList<>();
        for (MorkParser.TableEntryContext entryCtx : ctx.tableEntry()) {
            entries.add(visitTableEntry(entryCtx));
        }

        return new TableNode(visitObjectId(ctx.objectId()), entries, ctx.MINUS() != null, meta);
    }

    @Override
    public TableEntry visitTableEntry(MorkParser.TableEntryContext ctx) {
        boolean cut = ctx.MINUS() != null;
        if (ctx.row() != null) {
            RowNode row = visitRow(ctx.row());
            return cut ? row.asCut() : row;
        }
        return new TableEntry.RowReference(visitObjectId(ctx.objectId()), cut);
    }

    /**
     * Grammar rule:
     * objectId: NAME (COLON scope)?
     */
    @Override
    public ObjectId visitObjectId(MorkParser.ObjectIdContext ctx) {
        String id = ctx.NAME().getText();
        if (ctx.scope() == null) {
            return new ObjectId(id);
        }
        return new ObjectId(id, visitScope(ctx.scope()));
    }

    @Override
    public Scope visitScope(MorkParser.ScopeContext ctx) {
        String name = ctx.NAME().getText();
        if (ctx.CARET() != null) {
            return ObjectRef.to(name);
        }
        return new Scope.Named(name);
    }

    @Override
    public CellNode visitLiteralValueCell(MorkParser.LiteralValueCellContext ctx) {
        TerminalNode text = ctx.VALUE_TEXT();
        CellText value = new CellText.Literal(text == null ? "" : text.getText());
        return new CellNode(visitCellColumn(ctx.cellColumn()), value, ctx.CELL_MINUS() != null);
    }

    @Override
    public CellNode visitRefValueCell(MorkParser.RefValueCellContext ctx) {
        return new CellNode(visitCellColumn(ctx.cellColumn()), visitCellRef(ctx.cellRef()),
                ctx.CELL_MINUS() != null);
    }

    @Override
    public CellText visitCellColumn(MorkParser.CellColumnContext ctx) {
        if (ctx.cellRef() != null) {
            return visitCellRef(ctx.cellRef());
        }
        return new CellText.Literal(ctx.CELL_NAME().getText());
    }

    /**
     * Grammar rule:
     * cellRef: CELL_CARET CELL_NAME (CELL_COLON CELL_NAME)?
     */
    @Override
    public ObjectRef visitCellRef(MorkParser.CellRefContext ctx) {
        List<TerminalNode> names = ctx.CELL_NAME();
        String alias = names.get(0).getText();
        if (names.size() > 1) {
            return ObjectRef.to(alias, names.get(1).getText());
        }
        return ObjectRef.to(alias);
    }

    private List<MorkItem> visitItems(List<MorkParser.ItemContext> itemContexts) {
        List<MorkItem> items = new ArrayList<>();
        for (MorkParser.ItemContext itemCtx : itemContexts) {
            items.add(visitItem(itemCtx));
        }
        return items;
    }

    private List<CellNode> visitCells(List<MorkParser.CellContext> cellContexts) {
        List<CellNode> cells = new ArrayList<>();
        for (MorkParser.CellContext cellCtx : cellContexts) {
            cells.add((CellNode) visit(cellCtx));
        }
        return cells;
    }
}
