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
package net.boyechko.markup.repair.checks;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueSev;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.passes.ExpressionRewritePass;
import net.boyechko.markup.repair.schema.MarkupSchema;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.walk.MarkupTreeVisitor;
import net.boyechko.markup.repair.walk.VisitorContext;

/**
 * Reports, without changing anything, every place where the tree breaks a structural rule the
 * repair passes establish. Used for analysis before repair and for the manual-review list after.
 */
public class InvariantCheckVisitor implements MarkupTreeVisitor {

    private final MarkupSchema schema;
    private final IssueList issues = new IssueList();

    public InvariantCheckVisitor(MarkupSchema schema) {
        this.schema = schema;
    }

    @Override
    public String name() {
        return "Invariant Check";
    }

    @Override
    public String description() {
        return "Tree should satisfy the structural rules of renderable markup";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        MarkupNode node = ctx.node();

        if (schema.isRemovable(node.tagName())) {
            report(ctx, IssueType.NON_RENDERING_NODE, node.tagName() + " does not render");
        } else if (schema.isWrapper(node.tagName())) {
            report(ctx, IssueType.WRAPPER_NODE, node.tagName() + " wraps the document");
        }

        List<String> legacy = new ArrayList<>();
        for (String name : node.attributes().keySet()) {
            if (schema.legacyAttribute(name) != null) {
                legacy.add(name);
            }
        }
        if (!legacy.isEmpty()) {
            report(ctx, IssueType.LEGACY_ATTRIBUTE, node.tagName() + " has legacy attributes " + legacy);
        }

        if (schema.isEmbeddedObject(node.tagName())) {
            report(ctx, IssueType.EMBEDDED_OBJECT, node.tagName() + " is a legacy embedded object");
        }
        if (ExpressionRewritePass.usesSessionAccessor(node.condition())) {
            report(ctx, IssueType.LEGACY_SESSION_ACCESSOR, "Condition reads the server session");
        }

        if (node.hasTag("table") && node.hasChildren()) {
            checkTable(ctx, node);
        }
        if (node.hasTag("tr")) {
            long nonCells =
                    node.children().stream().filter(c -> !c.hasTag("td") && !c.hasTag("th")).count();
            if (nonCells > 0) {
                report(
                        ctx,
                        IssueType.ROW_WITH_NON_CELL_CHILD,
                        "Row has " + nonCells + " child(ren) that are not cells");
            }
        }
        if (node.hasTag("form")) {
            if (ctx.parentHasTag("tr")) {
                report(ctx, IssueType.FORM_IN_ROW, "form directly inside tr");
            } else if (ctx.parentHasTag("p")) {
                report(ctx, IssueType.FORM_IN_PARAGRAPH, "form directly inside p");
            } else if (ctx.parentHasTag("table")) {
                report(ctx, IssueType.FORM_IN_TABLE, "form directly inside table");
            }
        }
        if (node.hasTag("td") && !ctx.parentHasTag("tr")) {
            report(ctx, IssueType.ORPHAN_CELL, "td outside a row");
        }
        return true;
    }

    private void checkTable(VisitorContext ctx, MarkupNode table) {
        List<MarkupNode> children = table.children();
        if (!children.get(0).hasTag("tbody")) {
            report(ctx, IssueType.TABLE_WITHOUT_TBODY, "Table does not start with tbody");
        } else if (children.size() > 1) {
            report(
                    ctx,
                    IssueType.TABLE_WITHOUT_TBODY,
                    "Table has " + (children.size() - 1) + " child(ren) after its tbody");
        }
    }

    private void report(VisitorContext ctx, IssueType type, String message) {
        issues.add(new Issue(type, IssueSev.WARNING, ctx.location(), message));
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
