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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Reads and writes {@link MarkupDocument}s as JSON. */
public final class TreeCodec {
    static final String ELEMENTS = "elements";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private TreeCodec() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses strict JSON into a document. The text must hold a JSON object; a missing {@code
     * elements} field reads as an empty list, a non-array one is rejected.
     */
    public static MarkupDocument read(String json) throws TreeParseException {
        if (json == null || json.isBlank()) {
            throw new TreeParseException("Candidate is empty");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TreeParseException("Candidate is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return fromJson(root);
    }

    /** Converts an already-parsed JSON value into a document, with the same checks as {@link #read}. */
    public static MarkupDocument fromJson(JsonNode root) throws TreeParseException {
        if (root == null || !root.isObject()) {
            throw new TreeParseException("Candidate is not a JSON object");
        }
        JsonNode elements = root.get(ELEMENTS);
        if (elements != null && !elements.isNull() && !elements.isArray()) {
            throw new TreeParseException("\"elements\" is not an array");
        }
        try {
            return MAPPER.treeToValue(root, MarkupDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TreeParseException("Candidate does not describe a node tree: " + e.getMessage(), e);
        }
    }

    /** Pretty-printed JSON. */
    public static String write(MarkupDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document", e);
        }
    }

    public static ObjectNode toJson(MarkupDocument document) {
        return MAPPER.valueToTree(document);
    }

    /** Deep copy through the JSON form. */
    public static MarkupDocument copy(MarkupDocument document) {
        try {
            return MAPPER.treeToValue(MAPPER.valueToTree(document), MarkupDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to copy document", e);
        }
    }
}
