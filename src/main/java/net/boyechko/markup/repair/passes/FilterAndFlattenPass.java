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
package net.boyechko.markup.repair.passes;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueLoc;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.schema.MarkupSchema;
import net.boyechko.markup.repair.tree.MarkupNode;

/**
 * Drops non-rendering nodes ({@code script}, {@code meta}, ...) and replaces document wrappers
 * ({@code html}, {@code head}, {@code body}) with their own filtered children.
 *
 * <p>Unlike the other passes this one builds a new list: nodes with children are shallow-copied,
 * childless nodes are passed through as they are.
 */
public class FilterAndFlattenPass implements RepairPass {

    @Override
    public String name() {
        return "Filter and Flatten";
    }

    @Override
    public String description() {
        return "Non-rendering and document wrapper nodes are removed";
    }

    @Override
    public List<MarkupNode> apply(List<MarkupNode> elements, RepairContext ctx) {
        return filter(elements, ctx.schema(), ctx, "/");
    }

    /** Filters a sibling list without recording issues. */
    public static List<MarkupNode> filter(List<MarkupNode> elements, MarkupSchema schema) {
        return filter(elements, schema, null, "/");
    }

    private static List<MarkupNode> filter(
            List<MarkupNode> nodes, MarkupSchema schema, RepairContext ctx, String parentPath) {
        List<MarkupNode> out = new ArrayList<>();
        for (MarkupNode node : nodes) {
            String path = parentPath + node.tagName();
            if (schema.isRemovable(node.tagName())) {
                record(ctx, IssueType.NON_RENDERING_NODE, path, node, "Removed " + path);
            } else if (schema.isWrapper(node.tagName())) {
                List<MarkupNode> flattened = filter(node.children(), schema, ctx, path + ".");
                record(
                        ctx,
                        IssueType.WRAPPER_NODE,
                        path,
                        node,
                        "Replaced " + path + " with " + flattened.size() + " child(ren)");
                out.addAll(flattened);
            } else if (node.hasChildren()) {
                out.add(node.shallowCopy(filter(node.children(), schema, ctx, path + ".")));
            } else {
                out.add(node);
            }
        }
        return out;
    }

    private static void record(
            RepairContext ctx, IssueType type, String path, MarkupNode node, String note) {
        if (ctx == null) {
            return;
        }
        ctx.report(
                Issue.repaired(
                        type,
                        IssueLoc.atNode(path, node.tagName()),
                        type.groupLabel() + ": " + node.tagName(),
                        note));
    }
}
