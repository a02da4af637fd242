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
import net.boyechko.markup.repair.passes.FilterAndFlattenPass;
import net.boyechko.markup.repair.schema.MarkupSchema;
import net.boyechko.markup.repair.tree.MarkupDocument;
import net.boyechko.markup.repair.tree.TreeCodec;

/** Removes non-rendering and document wrapper nodes from a document passed as {@code unfilteredJson}. */
public class FilterElementsTool implements Tool {
    static final String ARGUMENT = "unfilteredJson";

    private final MarkupSchema schema;

    public FilterElementsTool(MarkupSchema schema) {
        this.schema = schema;
    }

    @Override
    public String name() {
        return "filterElements";
    }

    @Override
    public String description() {
        return "Removes meta, script and similar nodes and flattens html/head/body";
    }

    @Override
    public JsonNode invoke(JsonNode arguments) throws Exception {
        JsonNode input = arguments.get(ARGUMENT);
        if (input == null || input.isNull()) {
            throw new IllegalArgumentException("Missing '" + ARGUMENT + "' argument");
        }
        // The argument may be the document itself or a string holding it.
        MarkupDocument doc =
                input.isTextual() ? TreeCodec.read(input.asText()) : TreeCodec.fromJson(input);
        doc.setElements(FilterAndFlattenPass.filter(doc.elements(), schema));
        return TreeCodec.toJson(doc);
    }
}
