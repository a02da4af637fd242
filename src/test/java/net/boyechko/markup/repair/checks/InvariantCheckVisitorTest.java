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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.markup.repair.MarkupTestBase;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueSev;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.tree.MarkupDocument;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.walk.MarkupTreeWalker;
import org.junit.jupiter.api.Test;

class InvariantCheckVisitorTest extends MarkupTestBase {

    private static IssueList check(MarkupDocument doc) {
        return new MarkupTreeWalker().addVisitor(new InvariantCheckVisitor(SCHEMA)).walk(doc.elements());
    }

    @Test
    void cleanTreeHasNoIssues() throws Exception {
        MarkupDocument doc =
                parse(
                        "{'elements':[{'tagName':'div','attributes':{'style':{'width':'10px'}},'children':["
                                + "{'tagName':'table','children':[{'tagName':'tbody','children':["
                                + "{'tagName':'tr','children':[{'tagName':'td'},{'tagName':'th'}]}]}]}]}]}");
        assertTrue(check(doc).isEmpty(), "Unexpected issues: " + check(doc));
    }

    @Test
    void reportsEachKindOfViolation() throws Exception {
        MarkupDocument doc =
                parse(
                        "{'elements':[{'tagName':'body','children':["
                                + "{'tagName':'script'},"
                                + "{'tagName':'div','attributes':{'align':'left'}},"
                                + "{'tagName':'object'},"
                                + "{'tagName':'table','children':[{'tagName':'tr','children':["
                                + "{'tagName':'form'},{'tagName':'span'}]}]},"
                                + "{'tagName':'p','children':[{'tagName':'form'}]},"
                                + "{'tagName':'td'}]}]}");
        MarkupNode div = doc.elements().get(0).children().get(1);
        div.setCondition("session.getAttribute('x')");

        IssueList issues = check(doc);

        assertEquals(1, issues.ofType(IssueType.WRAPPER_NODE).size());
        assertEquals(1, issues.ofType(IssueType.NON_RENDERING_NODE).size());
        assertEquals(1, issues.ofType(IssueType.LEGACY_ATTRIBUTE).size());
        assertEquals(1, issues.ofType(IssueType.LEGACY_SESSION_ACCESSOR).size());
        assertEquals(1, issues.ofType(IssueType.EMBEDDED_OBJECT).size());
        assertEquals(1, issues.ofType(IssueType.TABLE_WITHOUT_TBODY).size());
        assertEquals(1, issues.ofType(IssueType.ROW_WITH_NON_CELL_CHILD).size());
        assertEquals(1, issues.ofType(IssueType.FORM_IN_ROW).size());
        assertEquals(1, issues.ofType(IssueType.FORM_IN_PARAGRAPH).size());
        assertEquals(1, issues.ofType(IssueType.ORPHAN_CELL).size());
        assertEquals(10, issues.size());
        assertTrue(issues.stream().allMatch(i -> i.severity() == IssueSev.WARNING));
        assertTrue(issues.getResolvedIssues().isEmpty(), "Checks never resolve issues");
    }

    @Test
    void flagsTbodyFollowedByOtherChildren() throws Exception {
        MarkupDocument doc =
                parse("{'elements':[{'tagName':'table','children':[{'tagName':'tbody'},{'tagName':'tr'}]}]}");

        IssueList issues = check(doc);

        assertEquals(1, issues.size());
        assertEquals(IssueType.TABLE_WITHOUT_TBODY, issues.get(0).type());
        assertEquals("/table[1]", issues.get(0).where().path());
    }

    @Test
    void formInTableIsReported() throws Exception {
        MarkupDocument doc =
                parse("{'elements':[{'tagName':'table','children':[{'tagName':'tbody'},{'tagName':'form'}]}]}");
        assertEquals(1, check(doc).ofType(IssueType.FORM_IN_TABLE).size());
    }
}
