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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.tree.MarkupTree;
import net.boyechko.markup.repair.tree.Styles;
import net.boyechko.markup.repair.walk.VisitorContext;

/**
 * Enforces table containment: a table's children live under one leading {@code tbody},
 * {@code cellpadding} becomes cell padding, and every child of a {@code tr} is a cell.
 *
 * <p>Only the first child of a table decides whether a {@code tbody} is synthesized. A table that
 * already starts with {@code tbody} is left alone even if later children are not row groups.
 */
public class TableStructureRepairPass extends TreeVisitingPass {

    @Override
    public String name() {
        return "Table Structure Repair";
    }

    @Override
    public String description() {
        return "Tables should have a tbody, rows should contain only cells";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        MarkupNode node = ctx.node();
        if (node.hasTag("table")) {
            wrapInTbody(ctx, node);
            applyCellPadding(ctx, node);
        } else if (node.hasTag("tr")) {
            wrapNonCellChildren(ctx, node);
        }
        return true;
    }

    private void wrapInTbody(VisitorContext ctx, MarkupNode table) {
        if (!table.hasChildren() || table.children().get(0).hasTag("tbody")) {
            return;
        }
        MarkupNode tbody = new MarkupNode("tbody");
        tbody.setChildren(table.children());
        List<MarkupNode> only = new ArrayList<>();
        only.add(tbody);
        table.setChildren(only);
        ctx.structureChanged();
        issues.add(
                Issue.repaired(
                        IssueType.TABLE_WITHOUT_TBODY,
                        ctx.location(),
                        "Table does not start with tbody",
                        "Wrapped " + tbody.children().size() + " child(ren) of " + ctx.path() + " in tbody"));
    }

    private void applyCellPadding(VisitorContext ctx, MarkupNode table) {
        String key = null;
        for (String name : table.attributes().keySet()) {
            if ("cellpadding".equalsIgnoreCase(name)) {
                key = name;
                break;
            }
        }
        if (key == null) {
            return;
        }
        String raw = table.attribute(key);
        table.attributes().remove(key);
        if (raw == null) {
            return;
        }
        String padding = Styles.toLength(raw, schema().getLengthUnit());
        List<MarkupNode> cells = MarkupTree.descendants(table, n -> n.hasTag("td") || n.hasTag("th"));
        for (MarkupNode cell : cells) {
            Styles.put(cell, "padding", padding);
        }
        issues.add(
                Issue.repaired(
                        IssueType.TABLE_CELLPADDING,
                        ctx.location(),
                        "Table uses cellpadding=" + raw,
                        "Applied padding " + padding + " to " + cells.size() + " cell(s)"));
    }

    private void wrapNonCellChildren(VisitorContext ctx, MarkupNode row) {
        List<MarkupNode> children = row.children();
        int wrapped = 0;
        for (int i = 0; i < children.size(); i++) {
            MarkupNode child = children.get(i);
            if (child.hasTag("td") || child.hasTag("th")) continue;
            children.set(i, hiddenCell(child));
            wrapped++;
        }
        if (wrapped == 0) {
            return;
        }
        ctx.structureChanged();
        issues.add(
                Issue.repaired(
                        IssueType.ROW_WITH_NON_CELL_CHILD,
                        ctx.location(),
                        "Row has " + wrapped + " child(ren) that are not cells",
                        "Wrapped " + wrapped + " child(ren) of " + ctx.path() + " in hidden td"));
    }

    private static MarkupNode hiddenCell(MarkupNode content) {
        Map<String, Object> style = new LinkedHashMap<>();
        style.put("display", "none");
        return MarkupNode.element("td", content).withAttribute(MarkupNode.STYLE, style);
    }
}
