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

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.repair.generation.CandidateGenerator;
import net.boyechko.markup.repair.generation.ChatMessage;
import org.junit.jupiter.api.Test;

class ToolCallParserTest {
    private final ToolCallParser parser = new ToolCallParser();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesSequentialCalls() throws Exception {
        String content =
                "I will use tools.\n"
                        + "<tool_call><function=convertJspInclude>"
                        + "<parameter=content><jsp:include page=\"/header.jsp\"/></parameter></tool_call>\n"
                        + "<tool_call>\n<function=filterElements>\n<parameter=unfilteredJson>\n"
                        + "{\"elements\":[]}\n</parameter>\n</tool_call>";

        List<ToolCall> calls = parser.parse(content);

        assertEquals(2, calls.size());
        assertEquals("call_1", calls.get(0).id());
        assertEquals("convertJspInclude", calls.get(0).name());
        JsonNode first = mapper.readTree(calls.get(0).arguments());
        assertEquals("<jsp:include page=\"/header.jsp\"/>", first.get("content").asText());

        assertEquals("call_2", calls.get(1).id());
        assertEquals("filterElements", calls.get(1).name());
        assertEquals("{\"elements\":[]}", mapper.readTree(calls.get(1).arguments()).get("unfilteredJson").asText());
    }

    @Test
    void callWithoutParameterHasEmptyArguments() {
        List<ToolCall> calls = parser.parse("<tool_call><function='listTools'></tool_call>");

        assertEquals(1, calls.size());
        assertEquals("listTools", calls.get(0).name());
        assertEquals("{}", calls.get(0).arguments());
    }

    @Test
    void blocksWithoutFunctionAreSkippedWithoutConsumingIds() {
        List<ToolCall> calls =
                parser.parse(
                        "<tool_call><parameter=x>1</parameter></tool_call>"
                                + "<tool_call><function=filterElements></tool_call>");

        assertEquals(1, calls.size());
        assertEquals("call_1", calls.get(0).id());
    }

    /** Answers normalization and repair requests with canned text. */
    private static class NormalizingGenerator implements CandidateGenerator {
        final List<String> normalized = new ArrayList<>();
        final String normalization;
        final String repair;

        NormalizingGenerator(String normalization, String repair) {
            this.normalization = normalization;
            this.repair = repair;
        }

        @Override
        public String regenerate(List<ChatMessage> history) {
            throw new UnsupportedOperationException();
        }

        @Override
        public String normalizeToolCall(String block) {
            normalized.add(block);
            return normalization;
        }

        @Override
        public String repairJson(String malformed) {
            return repair;
        }
    }

    @Test
    void unreadableBlockIsNormalizedByGenerator() throws Exception {
        NormalizingGenerator generator =
                new NormalizingGenerator(
                        "```json\n[{\"type\":\"function\",\"function\":{\"name\":\"convertJspInclude\","
                                + "\"arguments\":\"{\\\"content\\\":\\\"x\\\"}\"}}]\n```",
                        null);
        ToolCallParser normalizing = new ToolCallParser(generator);

        List<ToolCall> calls =
                normalizing.parse(
                        "<tool_call>{name: convertJspInclude, content: x}</tool_call>"
                                + "<tool_call><function=filterElements></tool_call>");

        assertEquals(1, generator.normalized.size());
        assertEquals("<tool_call>{name: convertJspInclude, content: x}</tool_call>", generator.normalized.get(0));
        assertEquals(2, calls.size());
        assertEquals("call_1", calls.get(0).id());
        assertEquals("convertJspInclude", calls.get(0).name());
        assertEquals("x", mapper.readTree(calls.get(0).arguments()).get("content").asText());
        assertEquals("call_2", calls.get(1).id());
        assertEquals("filterElements", calls.get(1).name());
    }

    @Test
    void malformedNormalizationIsRepairedOnce() {
        NormalizingGenerator generator =
                new NormalizingGenerator(
                        "[{function: {name: 'filterElements', arguments: {}}",
                        "[{\"function\":{\"name\":\"filterElements\",\"arguments\":{}}}]");

        List<ToolCall> calls = new ToolCallParser(generator).parse("<tool_call>filterElements()</tool_call>");

        assertEquals(1, calls.size());
        assertEquals("filterElements", calls.get(0).name());
        assertEquals("{}", calls.get(0).arguments());
    }

    @Test
    void blockIsSkippedWhenNormalizationFails() {
        NormalizingGenerator generator = new NormalizingGenerator("not json", "still not json");

        List<ToolCall> calls =
                new ToolCallParser(generator)
                        .parse("<tool_call>???</tool_call>trailing text<tool_call><function=filterElements></tool_call>");

        assertEquals(1, generator.normalized.size(), "Text outside tool_call blocks is not normalized");
        assertEquals(1, calls.size());
        assertEquals("call_1", calls.get(0).id());
    }

    @Test
    void textWithoutToolCallsYieldsNothing() {
        assertTrue(parser.parse("{\"elements\":[]}").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
