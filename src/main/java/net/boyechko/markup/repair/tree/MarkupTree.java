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
package net.boyechko.markup.repair.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/** Static helpers for manipulating and printing markup trees. */
public final class MarkupTree {
    private MarkupTree() {}

    /** Index of {@code node} in {@code siblings} by identity, or -1. */
    public static int indexOf(List<MarkupNode> siblings, MarkupNode node) {
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Replaces {@code oldNode} with {@code newNode} in {@code siblings}, keeping its position.
     *
     * @return false if {@code oldNode} is not in the list
     */
    public static boolean replace(List<MarkupNode> siblings, MarkupNode oldNode, MarkupNode newNode) {
        int index = indexOf(siblings, oldNode);
        if (index < 0) {
            return false;
        }
        siblings.set(index, newNode);
        return true;
    }

    /** Removes {@code node} from {@code siblings} by identity. */
    public static boolean remove(List<MarkupNode> siblings, MarkupNode node) {
        int index = indexOf(siblings, node);
        if (index < 0) {
            return false;
        }
        siblings.remove(index);
        return true;
    }

    /** Inserts {@code node} immediately before {@code anchor}. */
    public static boolean insertBefore(List<MarkupNode> siblings, MarkupNode anchor, MarkupNode node) {
        int index = indexOf(siblings, anchor);
        if (index < 0) {
            return false;
        }
        siblings.add(index, node);
        return true;
    }

    /** Collects every descendant of {@code node} (not the node itself) matching the predicate. */
    public static List<MarkupNode> descendants(MarkupNode node, Predicate<MarkupNode> predicate) {
        List<MarkupNode> out = new ArrayList<>();
        collect(node.children(), predicate, out);
        return out;
    }

    private static void collect(
            List<MarkupNode> nodes, Predicate<MarkupNode> predicate, List<MarkupNode> out) {
        for (MarkupNode n : nodes) {
            if (predicate.test(n)) {
                out.add(n);
            }
            collect(n.children(), predicate, out);
        }
    }

    /** Counts all nodes in the forest. */
    public static int count(List<MarkupNode> nodes) {
        int total = 0;
        for (MarkupNode n : nodes) {
            total += 1 + count(n.children());
        }
        return total;
    }

    /** Produces an indented tree, one tag per line, with styles and conditions inline. */
    public static String toIndentedTreeString(List<MarkupNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MarkupNode n : nodes) {
            appendTree(sb, n, 0);
        }
        return sb.toString();
    }

    private static void appendTree(StringBuilder sb, MarkupNode node, int level) {
        sb.append("  ".repeat(level)).append(label(node));
        Object style = node.attributes().get(MarkupNode.STYLE);
        if (style instanceof Map<?, ?> && !((Map<?, ?>) style).isEmpty()) {
            sb.append(" style=").append(style);
        }
        if (node.condition() != null) {
            sb.append(" if=(").append(node.condition()).append(")");
        }
        if (node.text() != null && !node.text().isBlank()) {
            sb.append(" \"").append(abbreviate(node.text().strip(), 40)).append("\"");
        }
        sb.append("\n");
        for (MarkupNode child : node.children()) {
            appendTree(sb, child, level + 1);
        }
    }

    private static String label(MarkupNode node) {
        if (node.tagName() == null) {
            return node.extras().isEmpty() ? "(untagged)" : "{" + String.join(",", node.extras().keySet()) + "}";
        }
        return node.isComponent() ? "<" + node.tagName() + "/>" : node.tagName();
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
