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

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.walk.VisitorContext;

/** Rewrites {@code session.getAttribute(x)} in conditions to {@code sessionStorage.getItem('x')}. */
public class ExpressionRewritePass extends TreeVisitingPass {
    private static final Pattern SESSION_ACCESSOR =
            Pattern.compile("(?<![\\w.$])session\\.getAttribute\\(\\s*([^()]*?)\\s*\\)");

    /** True if the condition reads the server session through {@code session.getAttribute}. */
    public static boolean usesSessionAccessor(String condition) {
        return condition != null && SESSION_ACCESSOR.matcher(condition).find();
    }

    @Override
    public String name() {
        return "Expression Rewrite";
    }

    @Override
    public String description() {
        return "Conditions should not read server-side session attributes";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        MarkupNode node = ctx.node();
        String condition = node.condition();
        if (condition == null) {
            return true;
        }
        Matcher m = SESSION_ACCESSOR.matcher(condition);
        StringBuilder sb = new StringBuilder();
        int count = 0;
        while (m.find()) {
            String key = unquote(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement("sessionStorage.getItem('" + key + "')"));
            count++;
        }
        if (count == 0) {
            return true;
        }
        m.appendTail(sb);
        node.setCondition(sb.toString());
        issues.add(
                Issue.repaired(
                        IssueType.LEGACY_SESSION_ACCESSOR,
                        ctx.location(),
                        "Condition uses session.getAttribute " + count + " time(s)",
                        "Rewrote condition to " + node.condition()));
        return true;
    }

    /** Strips one layer of matching single or double quotes. */
    static String unquote(String arg) {
        if (arg.length() >= 2) {
            char first = arg.charAt(0);
            char last = arg.charAt(arg.length() - 1);
            if (first == last && (first == '\'' || first == '"')) {
                return arg.substring(1, arg.length() - 1);
            }
        }
        return arg;
    }
}
