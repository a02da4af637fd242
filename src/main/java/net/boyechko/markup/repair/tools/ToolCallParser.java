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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.markup.repair.generation.CandidateGenerator;
import net.boyechko.markup.repair.generation.CandidateText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts tool calls that a generator wrote into plain text as {@code <tool_call>} blocks:
 *
 * <pre>
 * &lt;tool_call&gt;&lt;function=filterElements&gt;&lt;parameter=unfilteredJson&gt;{...}&lt;/parameter&gt;&lt;/tool_call&gt;
 * </pre>
 *
 * <p>A block whose function name cannot be read is handed to the normalizer, if one is set, which
 * rewrites it as JSON. Blocks that still cannot be read are skipped.
 */
public final class ToolCallParser {
    private static final Logger logger = LoggerFactory.getLogger(ToolCallParser.class);

    private static final String OPEN_TAG = "<tool_call>";
    private static final String CLOSE_TAG = "</tool_call>";
    private static final Pattern BLOCK_END = Pattern.compile(CLOSE_TAG, Pattern.CASE_INSENSITIVE);
    private static final Pattern FUNCTION =
            Pattern.compile("<function\\s*=\\s*[\"']?([^>\\s\"']+)[\"']?\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAMETER =
            Pattern.compile(
                    "<parameter\\s*=\\s*[\"']?([^>\\s\"']+)[\"']?\\s*>(.*?)</parameter>",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final ObjectMapper mapper = new ObjectMapper();
    private final CandidateGenerator normalizer;

    public ToolCallParser() {
        this(null);
    }

    /** @param normalizer rewrites blocks the parser cannot read; may be null */
    public ToolCallParser(CandidateGenerator normalizer) {
        this.normalizer = normalizer;
    }

    /** Returns the calls in block order; text without a {@code <tool_call>} yields none. */
    public List<ToolCall> parse(String content) {
        List<ToolCall> calls = new ArrayList<>();
        if (content == null || !content.toLowerCase().contains(OPEN_TAG)) {
            return calls;
        }

        String[] blocks = BLOCK_END.split(content);
        for (int i = 0; i < blocks.length; i++) {
            String block = blocks[i];
            if (!block.toLowerCase().contains(OPEN_TAG)) continue;

            Matcher function = FUNCTION.matcher(block);
            if (!function.find()) {
                normalize(block + CLOSE_TAG, i + 1, calls);
                continue;
            }

            ObjectNode arguments = mapper.createObjectNode();
            Matcher parameter = PARAMETER.matcher(block);
            if (parameter.find()) {
                arguments.put(parameter.group(1).trim(), parameter.group(2).trim());
            }
            calls.add(new ToolCall(nextId(calls), function.group(1).trim(), arguments.toString()));
        }
        logger.debug("Parsed {} tool call(s) from text", calls.size());
        return calls;
    }

    private void normalize(String block, int blockNumber, List<ToolCall> calls) {
        if (normalizer == null) {
            logger.warn("Skipping tool_call block {}: no function name", blockNumber);
            return;
        }
        logger.warn("Tool_call block {} has no readable function name, asking for normalization", blockNumber);
        try {
            JsonNode normalized = readNormalized(normalizer.normalizeToolCall(block));
            JsonNode entries = normalized.isArray() ? normalized : mapper.createArrayNode().add(normalized);
            for (JsonNode entry : entries) {
                JsonNode function = entry.path("function");
                String name = function.path("name").asText("");
                if (name.isBlank()) {
                    logger.warn("Normalized tool_call block {} has no function name", blockNumber);
                    continue;
                }
                JsonNode arguments = function.get("arguments");
                String argumentText =
                        arguments == null || arguments.isNull()
                                ? "{}"
                                : arguments.isTextual() ? arguments.asText() : arguments.toString();
                calls.add(new ToolCall(nextId(calls), name.trim(), argumentText));
            }
        } catch (Exception e) {
            logger.error("Skipping tool_call block {}: {}", blockNumber, e.getMessage());
        }
    }

    /** Parses the normalizer's output, asking once for a JSON repair if it is not valid JSON. */
    private JsonNode readNormalized(String text) throws Exception {
        String stripped = CandidateText.stripCodeFence(text);
        if (stripped == null || stripped.isEmpty()) {
            throw new ToolArgumentException("Normalization of tool call returned nothing", null);
        }
        try {
            return mapper.readTree(stripped);
        } catch (JsonProcessingException e) {
            logger.warn("Normalized tool call is not valid JSON: {}", e.getOriginalMessage());
            return mapper.readTree(CandidateText.stripCodeFence(normalizer.repairJson(stripped)));
        }
    }

    private static String nextId(List<ToolCall> calls) {
        return "call_" + (calls.size() + 1);
    }
}
