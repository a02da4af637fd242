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
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.rules.NestingRule;
import net.boyechko.markup.repair.rules.NestingRules;
import net.boyechko.markup.repair.walk.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the nesting rule table to every node. All matching rules fire, in table order, each
 * against the parent and grandparent the node had when it was reached.
 */
public class NestingRepairPass extends TreeVisitingPass {
    private static final Logger logger = LoggerFactory.getLogger(NestingRepairPass.class);

    private final List<NestingRule> rules;

    public NestingRepairPass() {
        this(NestingRules.defaults());
    }

    public NestingRepairPass(List<NestingRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public String name() {
        return "Nesting Repair";
    }

    @Override
    public String description() {
        return "Elements should only appear inside parents that allow them";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        for (NestingRule rule : rules) {
            if (!rule.matches().test(ctx)) continue;
            if (rule.fix().apply(ctx)) {
                ctx.structureChanged();
                issues.add(
                        Issue.repaired(
                                rule.issueType(),
                                ctx.location(),
                                ctx.tagName() + " inside " + describeParent(ctx),
                                "Applied rule '" + rule.name() + "' at " + ctx.path()));
            } else {
                logger.debug("Rule '{}' matched {} but could not be applied", rule.name(), ctx.path());
            }
        }
        return true;
    }

    private static String describeParent(VisitorContext ctx) {
        return ctx.parent() != null ? ctx.parentTag() : "top level";
    }
}
