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
import net.boyechko.markup.repair.schema.MarkupSchema;
import net.boyechko.markup.repair.schema.MarkupSchema.AttributeRule;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.tree.Styles;
import net.boyechko.markup.repair.walk.VisitorContext;

/**
 * Moves legacy presentational attributes ({@code width}, {@code bgcolor}, {@code border}, ...) into
 * the node's {@code style} map according to the schema's lowering table.
 *
 * <p>Properties already present in the node's own style win over derived ones. A string style is
 * parsed into a map on the way; an empty style is dropped. {@code cellpadding} on a {@code table}
 * is left for {@link TableStructureRepairPass}, which spreads it over the cells.
 */
public class AttributeLoweringPass extends TreeVisitingPass {
    private static final String CELLPADDING = "cellpadding";

    @Override
    public String name() {
        return "Attribute Lowering";
    }

    @Override
    public String description() {
        return "Legacy presentational attributes are folded into the style map";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        MarkupNode node = ctx.node();
        if (node.attributes().isEmpty()) {
            return true;
        }

        MarkupSchema schema = schema();
        Map<String, Object> derived = new LinkedHashMap<>();
        List<String> lowered = new ArrayList<>();
        for (String name : new ArrayList<>(node.attributes().keySet())) {
            AttributeRule rule = schema.legacyAttribute(name);
            if (rule == null) continue;
            if (CELLPADDING.equalsIgnoreCase(name) && node.hasTag("table")) continue;

            String value = node.attribute(name);
            node.attributes().remove(name);
            lowered.add(name);
            if (value != null) {
                derive(rule, value, schema.getLengthUnit(), derived);
            }
        }

        Map<String, Object> style = Styles.of(node);
        for (Map.Entry<String, Object> e : derived.entrySet()) {
            style.putIfAbsent(e.getKey(), e.getValue());
        }
        Styles.store(node, style);

        if (!lowered.isEmpty()) {
            issues.add(
                    Issue.repaired(
                            IssueType.LEGACY_ATTRIBUTE,
                            ctx.location(),
                            node.tagName() + " has legacy attributes " + lowered,
                            "Moved " + String.join(", ", lowered) + " into style of " + ctx.path()));
        }
        return true;
    }

    /** Applies one lowering rule, adding the resulting style properties to {@code out}. */
    static void derive(AttributeRule rule, String value, String unit, Map<String, Object> out) {
        switch (rule.getTransform()) {
            case LENGTH:
                out.put(rule.property, Styles.toLength(value, unit));
                break;
            case URL:
                out.put(rule.property, value.startsWith("url(") ? value : "url(" + value + ")");
                break;
            case BORDER:
                out.put(rule.property, border(value.trim(), unit));
                break;
            case CONSTANT:
                out.put(rule.property, rule.value);
                break;
            case CELL_SPACING:
                out.put("borderSpacing", Styles.toLength(value, unit));
                out.put("borderCollapse", "separate");
                break;
            default:
                out.put(rule.property, value);
        }
    }

    private static String border(String value, String unit) {
        if ("0".equals(value)) {
            return "none";
        }
        if (Styles.isDigits(value)) {
            return value + unit + " solid black";
        }
        return value;
    }
}
