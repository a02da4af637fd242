/*
 * Markup-Repair - Legacy Markup Tree Normalization
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.repair.walk;

import java.util.List;
import net.boyechko.markup.repair.issue.IssueLoc;
import net.boyechko.markup.repair.tree.MarkupNode;

/**
 * Context passed to visitors for one node. Parent and grandparent reflect the tree as it is at the
 * moment the node is visited, including changes made earlier in the same walk.
 *
 * <p>Visitors that restructure the tree must call {@link #structureChanged()} so the walker
 * re-resolves ancestry for the nodes it visits next.
 */
public record VisitorContext(
        MarkupNode node,
        /** Null for top-level nodes. */
        MarkupNode parent,
        /** Null when the parent is a top-level node or absent. */
        MarkupNode grandparent,
        /** Live list holding {@code node}: the parent's children or the root list. */
        List<MarkupNode> siblings,
        /** Live top-level list. */
        List<MarkupNode> root,
        String path,
        /** Depth in the tree (0 = top-level node). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex,
        Runnable changeSignal) {

    public String tagName() {
        return node.tagName();
    }

    public String parentTag() {
        return parent != null ? parent.tagName() : null;
    }

    public boolean hasTag(String tagName) {
        return node.hasTag(tagName);
    }

    public boolean parentHasTag(String tagName) {
        return parent != null && parent.hasTag(tagName);
    }

    public boolean isTopLevel() {
        return parent == null;
    }

    public IssueLoc location() {
        return IssueLoc.atNode(path, node.tagName());
    }

    public void structureChanged() {
        if (changeSignal != null) {
            changeSignal.run();
        }
    }
}
