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
package net.boyechko.markup.repair.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.tree.Styles;
import net.boyechko.markup.repair.tree.TreeCodec;

/**
 * Converts a {@code <jsp:include page="...">} snippet into a component node without asking the
 * generator. {@code page="/admin/user.jsp"} becomes component {@code User} loaded from {@code
 * @/pages/admin/User.jsx}; a relative page resolves to {@code ./User.jsx}.
 */
public class ConvertJspIncludeTool implements Tool {
    static final String ARGUMENT = "content";

    private static final Pattern ATTRIBUTE = Pattern.compile("(\\w+)=\"([^\"]*)\"");
    private static final Pattern JSP_EXTENSION = Pattern.compile("\\.jsp$", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "convertJspInclude";
    }

    @Override
    public String description() {
        return "Converts a jsp:include snippet into a component node";
    }

    @Override
    public JsonNode invoke(JsonNode arguments) {
        JsonNode content = arguments.get(ARGUMENT);
        if (content == null || !content.isTextual()) {
            throw new IllegalArgumentException("Missing '" + ARGUMENT + "' argument");
        }
        return TreeCodec.mapper().valueToTree(convert(content.asText()));
    }

    /** Builds the component node for one include snippet. */
    public MarkupNode convert(String snippet) {
        String unescaped = snippet.replace("\\\"", "\"");
        Map<String, Object> attributes = new LinkedHashMap<>();
        String page = null;

        Matcher m = ATTRIBUTE.matcher(unescaped);
        while (m.find()) {
            String name = m.group(1);
            String value = m.group(2);
            if ("page".equals(name)) {
                page = value;
            } else if (MarkupNode.STYLE.equals(name)) {
                attributes.put(name, Styles.parse(value));
            } else {
                attributes.put(name, value);
            }
        }
        if (page == null) {
            throw new IllegalArgumentException("jsp:include has no page attribute");
        }

        int slash = page.lastIndexOf('/');
        String fileName = JSP_EXTENSION.matcher(page.substring(slash + 1)).replaceFirst("");
        String componentName =
                fileName.isEmpty()
                        ? fileName
                        : fileName.substring(0, 1).toUpperCase(Locale.ROOT) + fileName.substring(1);
        String componentUrl =
                page.startsWith("/")
                        ? "@/pages" + page.substring(0, slash) + "/" + componentName + ".jsx"
                        : "./" + componentName + ".jsx";

        MarkupNode node = new MarkupNode(componentName);
        node.setAttributes(attributes);
        node.setComponent(true);
        node.setComponentUrl(componentUrl);
        return node;
    }
}
