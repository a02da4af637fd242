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
package net.boyechko.markup.repair.rules;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.tree.MarkupTree;
import net.boyechko.markup.repair.walk.VisitorContext;

/** The built-in nesting rule table, in evaluation order. */
public final class NestingRules {
    private NestingRules() {}

    public static List<NestingRule> defaults() {
        return List.of(
                new NestingRule(
                        "form in tr",
                        IssueType.FORM_IN_ROW,
                        ctx -> ctx.hasTag("form") && ctx.parentHasTag("tr"),
                        NestingRules::wrapInCell),
                new NestingRule(
                        "form in p",
                        IssueType.FORM_IN_PARAGRAPH,
                        ctx -> ctx.hasTag("form") && ctx.parentHasTag("p"),
                        NestingRules::hoistBeforeParent),
                new NestingRule(
                        "form in table",
                        IssueType.FORM_IN_TABLE,
                        ctx -> ctx.hasTag("form") && ctx.parentHasTag("table"),
                        NestingRules::wrapParentInForm),
                new NestingRule(
                        "orphan td",
                        IssueType.ORPHAN_CELL,
                        ctx -> ctx.hasTag("td") && !ctx.parentHasTag("tr"),
                        NestingRules::wrapInTable));
    }

    /** Replaces the node with {@code td > node}. */
    static boolean wrapInCell(VisitorContext ctx) {
        MarkupNode node = ctx.node();
        return MarkupTree.replace(ctx.parent().children(), node, MarkupNode.element("td", node));
    }

    /** Moves the node out of its parent to sit immediately before it. */
    static boolean hoistBeforeParent(VisitorContext ctx) {
        MarkupNode grandparent = ctx.grandparent();
        if (grandparent == null) {
            return false;
        }
        MarkupNode node = ctx.node();
        if (!MarkupTree.insertBefore(grandparent.children(), ctx.parent(), node)) {
            return false;
        }
        return MarkupTree.remove(ctx.parent().children(), node);
    }

    /**
     * Turns the form into the wrapper of its table: the form's own children go back into the table
     * where the form stood, and the form takes the table's place under the grandparent.
     */
    static boolean wrapParentInForm(VisitorContext ctx) {
        MarkupNode grandparent = ctx.grandparent();
        if (grandparent == null) {
            return false;
        }
        MarkupNode form = ctx.node();
        MarkupNode table = ctx.parent();
        List<MarkupNode> tableChildren = table.children();
        int at = MarkupTree.indexOf(tableChildren, form);
        if (at < 0 || !MarkupTree.replace(grandparent.children(), table, form)) {
            return false;
        }
        tableChildren.remove(at);
        tableChildren.addAll(at, form.children());

        List<MarkupNode> formChildren = new ArrayList<>();
        formChildren.add(table);
        form.setChildren(formChildren);
        return true;
    }

    /** Replaces the cell with {@code table > tr > td}, in the parent or the root list. */
    static boolean wrapInTable(VisitorContext ctx) {
        MarkupNode node = ctx.node();
        MarkupNode table = MarkupNode.element("table", MarkupNode.element("tr", node));
        List<MarkupNode> siblings = ctx.parent() != null ? ctx.parent().children() : ctx.root();
        return MarkupTree.replace(siblings, node, table);
    }
}
