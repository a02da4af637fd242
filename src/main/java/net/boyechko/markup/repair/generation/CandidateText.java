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
package net.boyechko.markup.repair.generation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Cleans up raw generator output before it is parsed. */
public final class CandidateText {
    private static final Pattern FENCED =
            Pattern.compile("^```[\\w-]*[ \\t]*\\R?(.*?)\\R?```$", Pattern.DOTALL);

    private CandidateText() {}

    /**
     * Removes a surrounding markdown code fence ({@code ```json ... ```}). Text without a fence is
     * returned trimmed; null stays null.
     */
    public static String stripCodeFence(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        Matcher m = FENCED.matcher(trimmed);
        return m.matches() ? m.group(1).trim() : trimmed;
    }
}
