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
import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.repair.generation.CandidateGenerator;
import net.boyechko.markup.repair.generation.ChatMessage;
import org.junit.jupiter.api.Test;

class ToolArgumentsTest {

    /** Repairs by returning a fixed string and records what it was asked to repair. */
    private static class FixedRepairer implements CandidateGenerator {
        final String answer;
        final List<String> asked = new ArrayList<>();

        FixedRepairer(String answer) {
            this.answer = answer;
        }

        @Override
        public String regenerate(List<ChatMessage> history) {
            throw new AssertionError("regenerate should not be called");
        }

        @Override
        public String repairJson(String malformed) {
            asked.add(malformed);
            return answer;
        }
    }

    @Test
    void strictJsonParses() throws Exception {
        JsonNode args = ToolArguments.parse("{\"content\": \"x\"}", null);
        assertEquals("x", args.get("content").asText());
    }

    @Test
    void almostJsonParsesLeniently() throws Exception {
        FixedRepairer repairer = new FixedRepairer("{}");
        JsonNode args = ToolArguments.parse("{content: 'x', /* note */ n: .5,}", repairer);

        assertEquals("x", args.get("content").asText());
        assertEquals(0.5, args.get("n").asDouble());
        assertTrue(repairer.asked.isEmpty(), "Lenient input should not need repair");
    }

    @Test
    void blankArgumentsAreEmptyObject() throws Exception {
        assertTrue(ToolArguments.parse("  ", null).isEmpty());
        assertTrue(ToolArguments.parse(null, null).isEmpty());
    }

    @Test
    void brokenArgumentsAreRepairedOnce() throws Exception {
        FixedRepairer repairer = new FixedRepairer("```json\n{\"content\": \"fixed\"}\n```");

        JsonNode args = ToolArguments.parse("{content: \"unterminated", repairer);

        assertEquals("fixed", args.get("content").asText());
        assertEquals(List.of("{content: \"unterminated"), repairer.asked);
    }

    @Test
    void nonObjectArgumentsAreRepaired() throws Exception {
        FixedRepairer repairer = new FixedRepairer("{\"content\": \"x\"}");
        assertEquals("x", ToolArguments.parse("[1, 2]", repairer).get("content").asText());
    }

    @Test
    void failedRepairThrows() {
        assertThrows(
                ToolArgumentException.class,
                () -> ToolArguments.parse("{broken", new FixedRepairer("{'still': broken}")));
        assertThrows(ToolArgumentException.class, () -> ToolArguments.parse("{broken", new FixedRepairer(null)));
        assertThrows(ToolArgumentException.class, () -> ToolArguments.parse("{broken", null));
    }

    @Test
    void repairerWithoutSupportThrowsArgumentException() {
        CandidateGenerator noRepair = history -> "unused";
        ToolArgumentException e =
                assertThrows(ToolArgumentException.class, () -> ToolArguments.parse("{broken", noRepair));
        assertTrue(e.getCause() instanceof UnsupportedOperationException);
    }
}
