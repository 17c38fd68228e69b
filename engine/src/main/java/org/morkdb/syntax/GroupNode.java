package org.morkdb.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A transaction group: <code>@$${id{@ ... @$$}id}@</code>.
 *
 * @param groupId The hex id written in the group brackets
 * @param items   Items enclosed by the group
 * @param aborted Whether the group closed with <code>~abort~</code>
 */
public record GroupNode(String groupId, List<MorkItem> items, boolean aborted) implements MorkItem {

    public GroupNode {
        Objects.requireNonNull(groupId, "Group id cannot be null");
        Objects.requireNonNull(items, "Items cannot be null");
        items = List.copyOf(items);
    }
}
