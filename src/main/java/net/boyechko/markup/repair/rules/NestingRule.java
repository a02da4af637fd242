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
package net.boyechko.markup.repair.rules;

import java.util.function.Predicate;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.walk.VisitorContext;

/**
 * One entry in the nesting rule table: a match over a node and its parent, and the fix applied
 * when it matches.
 *
 * @param name short human-readable rule name
 * @param issueType type recorded when the fix changes the tree
 * @param matches predicate over the node as it is placed when visited
 * @param fix restructures the tree around the node
 */
public record NestingRule(
        String name, IssueType issueType, Predicate<VisitorContext> matches, Fix fix) {

    /** Restructures the tree around the matched node. */
    @FunctionalInterface
    public interface Fix {
        /**
         * @return false if the fix could not be applied (e.g. there is no grandparent to move into)
         */
        boolean apply(VisitorContext ctx);
    }
}
