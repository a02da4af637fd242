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

import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.schema.MarkupSchema;

/** Shared state for one pipeline run: the schema and the issues recorded so far. */
public final class RepairContext {
    private final MarkupSchema schema;
    private final IssueList issues = new IssueList();

    public RepairContext(MarkupSchema schema) {
        this.schema = schema;
    }

    public MarkupSchema schema() {
        return schema;
    }

    public IssueList issues() {
        return issues;
    }

    public void report(Issue issue) {
        issues.add(issue);
    }

    public void reportAll(IssueList found) {
        issues.addAll(found);
    }
}
