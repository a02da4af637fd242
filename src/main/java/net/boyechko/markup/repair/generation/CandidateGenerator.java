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

import java.util.List;

/**
 * The external generative step. Implementations talk to whatever model or service produces markup
 * trees; the engine only consumes the text they return.
 */
public interface CandidateGenerator {

    /**
     * Produces a new candidate given the conversation so far. The last message is normally the
     * corrective instruction for a candidate that did not parse.
     */
    String regenerate(List<ChatMessage> history) throws Exception;

    /**
     * Asks the generator to turn malformed JSON into valid JSON. Used once for tool-call arguments
     * that do not parse even leniently.
     */
    default String repairJson(String malformed) throws Exception {
        throw new UnsupportedOperationException(
                getClass().getSimpleName() + " does not repair JSON");
    }

    /**
     * Rewrites one {@code <tool_call>...</tool_call>} block that could not be read as-is into a JSON
     * array holding a single {@code {"function": {"name": ..., "arguments": "..."}}} object.
     */
    default String normalizeToolCall(String block) throws Exception {
        throw new UnsupportedOperationException(
                getClass().getSimpleName() + " does not normalize tool calls");
    }
}
