package org.morkdb.syntax;

/**
 * A top-level item of a Mork store.
 *
 * The set of kinds is closed; consumers dispatch on the concrete record and
 * treat {@link GroupNode} as an item they may skip.
 */
public sealed interface MorkItem permits DictNode, RowNode, TableNode, GroupNode {
}
