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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.boyechko.markup.repair.schema.MarkupSchema;

/** Tools available to the generator, by name. */
public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    /** Registry with {@code convertJspInclude} and {@code filterElements}. */
    public static ToolRegistry withBuiltins(MarkupSchema schema) {
        return new ToolRegistry()
                .register(new ConvertJspIncludeTool())
                .register(new FilterElementsTool(schema));
    }

    public ToolRegistry register(Tool tool) {
        tools.put(tool.name(), tool);
        return this;
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name != null ? tools.get(name) : null);
    }

    public Set<String> names() {
        return tools.keySet();
    }
}
