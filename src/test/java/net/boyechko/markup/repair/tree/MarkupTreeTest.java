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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MarkupTreeTest {

    @Test
    void listOperationsUseIdentity() {
        MarkupNode a = new MarkupNode("td");
        MarkupNode b = new MarkupNode("td");
        List<MarkupNode> siblings = new ArrayList<>(List.of(a, b));

        assertEquals(a, b, "Nodes are equal by value");
        assertEquals(1, MarkupTree.indexOf(siblings, b));

        MarkupNode c = new MarkupNode("th");
        assertTrue(MarkupTree.replace(siblings, b, c));
        assertSame(c, siblings.get(1));
        assertTrue(MarkupTree.insertBefore(siblings, a, b));
        assertSame(b, siblings.get(0));
        assertTrue(MarkupTree.remove(siblings, a));
        assertEquals(2, siblings.size());
        assertFalse(MarkupTree.remove(siblings, a));
    }

    @Test
    void descendantsExcludeTheNodeItself() {
        MarkupNode table =
                MarkupNode.element(
                        "table",
                        MarkupNode.element("tr", new MarkupNode("td"), new MarkupNode("th")),
                        MarkupNode.element("tr", new MarkupNode("td")));

        assertEquals(2, MarkupTree.descendants(table, n -> n.hasTag("td")).size());
        assertEquals(0, MarkupTree.descendants(table, n -> n.hasTag("table")).size());
        assertEquals(6, MarkupTree.count(List.of(table)));
    }

    @Test
    void indentedTreeShowsStyleConditionAndText() {
        MarkupNode div = MarkupNode.element("div", MarkupNode.text("Hello"));
        div.setCondition("a == b");
        div.withAttribute(MarkupNode.STYLE, Map.of("color", "red"));
        MarkupNode placeholder = MarkupNode.element("ActiveXPlaceholder", new MarkupNode());
        placeholder.setComponent(true);
        placeholder.children().get(0).putExtra("params", Map.of());

        String tree = MarkupTree.toIndentedTreeString(List.of(div, placeholder));

        assertEquals(
                "div style={color=red} if=(a == b)\n"
                        + "  #text \"Hello\"\n"
                        + "<ActiveXPlaceholder/>\n"
                        + "  {params}\n",
                tree);
    }
}
