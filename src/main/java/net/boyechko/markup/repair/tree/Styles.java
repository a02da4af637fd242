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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Helpers for reading and writing the {@code style} attribute of a node. */
public final class Styles {
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern DASH_LETTER = Pattern.compile("-([a-z])");

    private Styles() {}

    /**
     * Parses a CSS declaration list ({@code "font-size: 12px; color: red"}) into a map keyed by
     * camel-case property names. Declarations without a name or value are skipped.
     */
    public static Map<String, Object> parse(String css) {
        Map<String, Object> style = new LinkedHashMap<>();
        if (css == null || css.isBlank()) {
            return style;
        }
        for (String declaration : css.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon < 0) continue;
            String name = declaration.substring(0, colon).trim();
            String value = declaration.substring(colon + 1).trim();
            if (name.isEmpty() || value.isEmpty()) continue;
            style.put(camelCase(name), value);
        }
        return style;
    }

    /**
     * Converts {@code background-color} to {@code backgroundColor}. Names without a dash are taken
     * to be camel-case already and returned unchanged.
     */
    public static String camelCase(String property) {
        String name = property.trim();
        if (name.indexOf('-') < 0) {
            return name;
        }
        Matcher m = DASH_LETTER.matcher(name.toLowerCase(Locale.ROOT));
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, m.group(1).toUpperCase(Locale.ROOT));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Returns a mutable copy of the node's style. A string style is parsed, a map style is copied,
     * anything else yields an empty map.
     */
    public static Map<String, Object> of(MarkupNode node) {
        Object raw = node.attributes().get(MarkupNode.STYLE);
        if (raw instanceof Map<?, ?>) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) raw).entrySet()) {
                copy.put(String.valueOf(e.getKey()), e.getValue());
            }
            return copy;
        }
        if (raw instanceof String) {
            return parse((String) raw);
        }
        return new LinkedHashMap<>();
    }

    /** Writes the style back onto the node, removing the key entirely when the map is empty. */
    public static void store(MarkupNode node, Map<String, Object> style) {
        if (style == null || style.isEmpty()) {
            node.attributes().remove(MarkupNode.STYLE);
        } else {
            node.attributes().put(MarkupNode.STYLE, style);
        }
    }

    /** Sets a single property, keeping every other property already on the node. */
    public static void put(MarkupNode node, String property, Object value) {
        Map<String, Object> style = of(node);
        style.put(property, value);
        store(node, style);
    }

    public static boolean isDigits(String value) {
        return value != null && DIGITS.matcher(value).matches();
    }

    /** Appends {@code unit} to digits-only values; anything else passes through unchanged. */
    public static String toLength(String value, String unit) {
        if (value == null) return null;
        String trimmed = value.trim();
        return isDigits(trimmed) ? trimmed + unit : value;
    }
}
