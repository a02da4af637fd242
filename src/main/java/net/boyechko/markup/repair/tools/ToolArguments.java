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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import net.boyechko.markup.repair.generation.CandidateGenerator;
import net.boyechko.markup.repair.generation.CandidateText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses tool-call argument bundles. Generators often produce almost-JSON, so the first attempt is
 * lenient (single quotes, unquoted names, trailing commas, comments). If that fails the generator
 * is asked once to repair the text, which must then be strict JSON.
 */
public final class ToolArguments {
    private static final Logger logger = LoggerFactory.getLogger(ToolArguments.class);

    private static final ObjectMapper LENIENT =
            JsonMapper.builder()
                    .enable(
                            JsonReadFeature.ALLOW_SINGLE_QUOTES,
                            JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES,
                            JsonReadFeature.ALLOW_TRAILING_COMMA,
                            JsonReadFeature.ALLOW_JAVA_COMMENTS,
                            JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS,
                            JsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS,
                            JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                    .build();
    private static final ObjectMapper STRICT = new ObjectMapper();

    private ToolArguments() {}

    /**
     * @param repairer asked to fix the text when lenient parsing fails; may be null
     * @return the arguments as a JSON object
     * @throws ToolArgumentException if neither the text nor its repair is a JSON object
     */
    public static JsonNode parse(String raw, CandidateGenerator repairer) throws ToolArgumentException {
        String text = raw == null || raw.isBlank() ? "{}" : raw;
        try {
            return requireObject(LENIENT.readTree(text));
        } catch (JsonProcessingException e) {
            logger.warn("Lenient parse of tool arguments failed: {}", e.getOriginalMessage());
            if (repairer == null) {
                throw new ToolArgumentException("Tool arguments are not valid JSON", e);
            }
            return parseRepaired(text, repairer, e);
        }
    }

    private static JsonNode parseRepaired(String text, CandidateGenerator repairer, Exception first)
            throws ToolArgumentException {
        String repaired;
        try {
            repaired = CandidateText.stripCodeFence(repairer.repairJson(text));
        } catch (Exception e) {
            e.addSuppressed(first);
            throw new ToolArgumentException("Repair of tool arguments failed: " + e.getMessage(), e);
        }
        if (repaired == null || repaired.isEmpty()) {
            throw new ToolArgumentException("Repair of tool arguments returned nothing", first);
        }
        try {
            JsonNode args = requireObject(STRICT.readTree(repaired));
            logger.debug("Tool arguments parsed after repair");
            return args;
        } catch (JsonProcessingException e) {
            throw new ToolArgumentException("Repaired tool arguments are still not valid JSON", e);
        }
    }

    private static JsonNode requireObject(JsonNode node) throws JsonProcessingException {
        if (node == null || !node.isObject()) {
            throw new ArgumentsNotObjectException();
        }
        return node;
    }

    private static class ArgumentsNotObjectException extends JsonProcessingException {
        ArgumentsNotObjectException() {
            super("Tool arguments must be a JSON object");
        }
    }
}
