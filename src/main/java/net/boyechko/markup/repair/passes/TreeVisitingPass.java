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

import java.util.List;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.schema.MarkupSchema;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.walk.MarkupTreeVisitor;
import net.boyechko.markup.repair.walk.MarkupTreeWalker;

/** Base for passes that rewrite the tree in place during a single walk. */
public abstract class TreeVisitingPass implements RepairPass, MarkupTreeVisitor {
    protected final IssueList issues = new IssueList();
    private RepairContext repairCtx;

    @Override
    public List<MarkupNode> apply(List<MarkupNode> elements, RepairContext ctx) {
        this.repairCtx = ctx;
        issues.clear();
        IssueList found = new MarkupTreeWalker().addVisitor(this).walk(elements);
        ctx.reportAll(found);
        return elements;
    }

    protected MarkupSchema schema() {
        return repairCtx.schema();
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
