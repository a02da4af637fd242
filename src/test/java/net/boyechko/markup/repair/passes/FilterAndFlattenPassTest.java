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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.markup.repair.MarkupTestBase;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.tree.MarkupDocument;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.tree.MarkupTree;
import net.boyechko.markup.repair.tree.TreeCodec;
import org.junit.jupiter.api.Test;

class FilterAndFlattenPassTest extends MarkupTestBase {

    private static final String PAGE =
            "{'elements':[{'tagName':'html','children':["
                    + "{'tagName':'head','children':[{'tagName':'title'},{'tagName':'meta'}]},"
                    + "{'tagName':'body','children':[{'tagName':'script'},"
                    + "{'tagName':'div','children':[{'tagName':'p'},{'tagName':'style'}]}]}]}]}";

    @Test
    void wrappersAreFlattenedAndNonRenderingNodesDropped() throws Exception {
        MarkupDocument doc = parse(PAGE);

        IssueList issues = applyPass(new FilterAndFlattenPass(), doc);

        assertEquals("div\n  p\n", MarkupTree.toIndentedTreeString(doc.elements()));
        assertEquals(4, issues.ofType(IssueType.NON_RENDERING_NODE).size());
        assertEquals(3, issues.ofType(IssueType.WRAPPER_NODE).size());
    }

    @Test
    void inputIsNotModified() throws Exception {
        MarkupDocument doc = parse(PAGE);
        String before = TreeCodec.write(doc);

        List<MarkupNode> out = FilterAndFlattenPass.filter(doc.elements(), SCHEMA);

        assertEquals(1, out.size());
        assertEquals(before, TreeCodec.write(doc), "Filtering must not change its input");
    }

    @Test
    void childlessNodesPassThroughByIdentity() throws Exception {
        MarkupDocument doc = parse("{'elements':[{'tagName':'br'},{'tagName':'div','children':[{'tagName':'img'}]}]}");
        MarkupNode br = doc.elements().get(0);
        MarkupNode div = doc.elements().get(1);

        List<MarkupNode> out = FilterAndFlattenPass.filter(doc.elements(), SCHEMA);

        assertSame(br, out.get(0));
        assertNotSame(div, out.get(1), "Nodes with children are copied");
        assertEquals(div, out.get(1));
        assertSame(div.children().get(0), out.get(1).children().get(0));
    }

    @Test
    void tagMatchingIsExact() throws Exception {
        MarkupDocument doc =
                parse("{'elements':[{'tagName':'BODY','children':[{'tagName':'SCRIPT'},{'tagName':'script'},{'tagName':'span'}]}]}");
        applyPass(new FilterAndFlattenPass(), doc);
        assertEquals("BODY\n  SCRIPT\n  span\n", MarkupTree.toIndentedTreeString(doc.elements()));
    }
}
