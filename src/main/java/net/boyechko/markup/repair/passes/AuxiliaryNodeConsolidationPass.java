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
import net.boyechko.markup.repair.walk.VisitorContext;

/**
 * Turns legacy embedded objects ({@code <object>} with {@code <param>} children) into a placeholder
 * component whose single child carries the collected parameters as {@code {"params": {...}}}.
 */
public class AuxiliaryNodeConsolidationPass extends TreeVisitingPass {
    static final String PARAMS = "params";

    @Override
    public String name() {
        return "Auxiliary Node Consolidation";
    }

    @Override
    public String description() {
        return "Embedded-object parameters are folded into a single placeholder";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        MarkupNode node = ctx.node();
        if (!schema().isEmbeddedObject(node.tagName())) {
            return true;
        }

        Map<String, String> params = new LinkedHashMap<>();
        for (MarkupNode child : node.children()) {
            if (!schema().isObjectParameter(child.tagName())) continue;
            String name = child.attribute("name");
            if (name == null || name.isEmpty()) continue;
            String value = child.attribute("value");
            params.put(name, value != null ? value : "");
        }

        String originalTag = node.tagName();
        MarkupNode wrapper = new MarkupNode();
        wrapper.putExtra(PARAMS, params);
        List<MarkupNode> children = new ArrayList<>();
        children.add(wrapper);

        node.setTagName(schema().getPlaceholderTag());
        node.setComponent(true);
        node.setChildren(children);
        ctx.structureChanged();

        issues.add(
                Issue.repaired(
                        IssueType.EMBEDDED_OBJECT,
                        ctx.location(),
                        originalTag + " with " + params.size() + " parameter(s)",
                        "Replaced " + originalTag + " with " + node.tagName() + " at " + ctx.path()));
        // The wrapper is synthetic; nothing below it needs visiting.
        return false;
    }
}
