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

import java.util.Map;
import net.boyechko.markup.repair.MarkupTestBase;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.tree.MarkupDocument;
import net.boyechko.markup.repair.tree.MarkupNode;
import org.junit.jupiter.api.Test;

class AttributeLoweringPassTest extends MarkupTestBase {

    private static MarkupNode lowerSingle(String singleQuotedNode) throws Exception {
        MarkupDocument doc = parse("{'elements':[" + singleQuotedNode + "]}");
        applyPass(new AttributeLoweringPass(), doc);
        return doc.elements().get(0);
    }

    @Test
    void widthAndAlignMoveIntoStyle() throws Exception {
        MarkupDocument doc =
                parse("{'elements':[{'tagName':'div','attributes':{'width':'100','align':'left','id':'x'}}]}");

        IssueList issues = applyPass(new AttributeLoweringPass(), doc);

        MarkupNode div = doc.elements().get(0);
        assertEquals(Map.of("width", "100px", "textAlign", "left"), style(div));
        assertFalse(div.attributes().containsKey("width"), "width should be removed");
        assertFalse(div.attributes().containsKey("align"), "align should be removed");
        assertEquals("x", div.attribute("id"), "Non-legacy attributes are kept");
        assertEquals(1, issues.size());
        assertEquals(IssueType.LEGACY_ATTRIBUTE, issues.get(0).type());
        assertTrue(issues.get(0).isResolved());
    }

    @Test
    void existingStyleWinsOverDerived() throws Exception {
        MarkupNode td =
                lowerSingle("{'tagName':'td','attributes':{'bgcolor':'red','style':{'backgroundColor':'blue'}}}");
        assertEquals(Map.of("backgroundColor", "blue"), style(td));
        assertNull(td.attribute("bgcolor"));
    }

    @Test
    void camelCaseStringStyleWinsOverDerived() throws Exception {
        MarkupNode td =
                lowerSingle(
                        "{'tagName':'td','attributes':{'bgcolor':'blue',"
                                + "'style':'fontSize: 12px; backgroundColor: red'}}");
        assertEquals(Map.of("fontSize", "12px", "backgroundColor", "red"), style(td));
    }

    @Test
    void stringStyleIsParsedAndMerged() throws Exception {
        MarkupNode td =
                lowerSingle("{'tagName':'td','attributes':{'valign':'top','style':'font-size: 10px; color: red'}}");
        assertEquals(Map.of("fontSize", "10px", "color", "red", "verticalAlign", "top"), style(td));
    }

    @Test
    void stringStyleWithoutLegacyAttributesBecomesMap() throws Exception {
        MarkupNode span = lowerSingle("{'tagName':'span','attributes':{'style':'color: red'}}");
        assertEquals(Map.of("color", "red"), style(span));
    }

    @Test
    void borderValues() throws Exception {
        assertEquals("none", style(lowerSingle("{'tagName':'table','attributes':{'border':'0'}}")).get("border"));
        assertEquals(
                "2px solid black",
                style(lowerSingle("{'tagName':'table','attributes':{'border':'2'}}")).get("border"));
        assertEquals("thin", style(lowerSingle("{'tagName':'table','attributes':{'border':'thin'}}")).get("border"));
    }

    @Test
    void constantAndUrlTransforms() throws Exception {
        MarkupNode td = lowerSingle("{'tagName':'td','attributes':{'nowrap':'','background':'bg.gif'}}");
        assertEquals(Map.of("whiteSpace", "nowrap", "backgroundImage", "url(bg.gif)"), style(td));

        MarkupNode wrapped = lowerSingle("{'tagName':'td','attributes':{'background':'url(a.png)'}}");
        assertEquals("url(a.png)", style(wrapped).get("backgroundImage"));
    }

    @Test
    void cellspacingBecomesBorderSpacing() throws Exception {
        MarkupNode table = lowerSingle("{'tagName':'table','attributes':{'cellspacing':'4','cellpadding':'3'}}");

        assertEquals("4px", style(table).get("borderSpacing"));
        assertEquals("separate", style(table).get("borderCollapse"));
        assertEquals("3", table.attribute("cellpadding"), "cellpadding on a table is left for table repair");
    }

    @Test
    void cellpaddingOnCellBecomesPadding() throws Exception {
        MarkupNode td = lowerSingle("{'tagName':'td','attributes':{'cellpadding':'3'}}");
        assertEquals(Map.of("padding", "3px"), style(td));
    }

    @Test
    void attributeNamesMatchIgnoringCase() throws Exception {
        MarkupNode td = lowerSingle("{'tagName':'td','attributes':{'BGCOLOR':'#eee','Width':'50%'}}");
        assertEquals(Map.of("backgroundColor", "#eee", "width", "50%"), style(td));
        assertTrue(td.attributes().keySet().stream().noneMatch(k -> k.equalsIgnoreCase("bgcolor")));
    }

    @Test
    void emptyStyleIsOmitted() throws Exception {
        MarkupNode span = lowerSingle("{'tagName':'span','attributes':{'style':{},'id':'s'}}");
        assertFalse(span.attributes().containsKey("style"));
        assertEquals("s", span.attribute("id"));
    }

    @Test
    void lowersNestedNodes() throws Exception {
        MarkupDocument doc =
                parse(
                        "{'elements':[{'tagName':'table','children':[{'tagName':'tr','children':"
                                + "[{'tagName':'td','attributes':{'align':'center'}}]}]}]}");
        IssueList issues = applyPass(new AttributeLoweringPass(), doc);

        MarkupNode td = doc.elements().get(0).children().get(0).children().get(0);
        assertEquals(Map.of("textAlign", "center"), style(td));
        assertEquals(1, issues.size());
    }

    @Test
    void minimalSchemaUsesItsLengthUnit() throws Exception {
        var schema = net.boyechko.markup.repair.schema.MarkupSchema.fromResource("/markup-schema-minimal.yaml");
        MarkupDocument doc = parse("{'elements':[{'tagName':'div','attributes':{'width':'3','bgcolor':'red'}}]}");

        RepairContext ctx = new RepairContext(schema);
        new AttributeLoweringPass().apply(doc.elements(), ctx);

        MarkupNode div = doc.elements().get(0);
        assertEquals(Map.of("width", "3em"), style(div));
        assertEquals("red", div.attribute("bgcolor"), "Attributes outside the table are untouched");
    }
}
