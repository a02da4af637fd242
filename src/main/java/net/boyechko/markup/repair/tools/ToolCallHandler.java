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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.repair.concurrent.BoundedTaskExecutor;
import net.boyechko.markup.repair.concurrent.BoundedTaskExecutor.Task;
import net.boyechko.markup.repair.concurrent.TaskOutcome;
import net.boyechko.markup.repair.generation.CandidateGenerator;
import net.boyechko.markup.repair.generation.ChatMessage;
import net.boyechko.markup.repair.generation.ConversationHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a batch of tool calls with bounded concurrency. Every call settles independently and its
 * result, or an {@code {"error": ...}} object, is appended to the history as a tool message.
 */
public class ToolCallHandler {
    private static final Logger logger = LoggerFactory.getLogger(ToolCallHandler.class);

    private final ToolRegistry registry;
    private final CandidateGenerator repairer;
    private final int concurrency;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param repairer used to repair argument bundles that do not parse; may be null
     * @param concurrency maximum number of tools running at once
     */
    public ToolCallHandler(ToolRegistry registry, CandidateGenerator repairer, int concurrency) {
        this.registry = registry;
        this.repairer = repairer;
        this.concurrency = concurrency;
    }

    /** Runs the calls and returns one result per call, in call order. */
    public List<ToolInvocationResult> handle(List<ToolCall> calls, ConversationHistory history)
            throws InterruptedException {
        List<ToolInvocationResult> results = new ArrayList<>();
        if (calls == null || calls.isEmpty()) {
            return results;
        }
        logger.info("Running {} tool call(s), at most {} at a time", calls.size(), concurrency);

        List<Task<JsonNode>> tasks = new ArrayList<>();
        for (ToolCall call : calls) {
            tasks.add(new Task<>(call.id(), () -> invoke(call, history)));
        }

        List<TaskOutcome<JsonNode>> outcomes;
        try (BoundedTaskExecutor executor = new BoundedTaskExecutor(concurrency)) {
            outcomes = executor.runAll(tasks);
        }

        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            TaskOutcome<JsonNode> outcome = outcomes.get(i);
            results.add(
                    outcome.isSuccess()
                            ? ToolInvocationResult.success(call, outcome.value())
                            : ToolInvocationResult.failure(call, outcome.error()));
        }
        return results;
    }

    private JsonNode invoke(ToolCall call, ConversationHistory history) throws Exception {
        try {
            Tool tool = registry.find(call.name()).orElseThrow(() -> new UnknownToolException(call.name()));
            JsonNode arguments = ToolArguments.parse(call.arguments(), repairer);
            JsonNode result = tool.invoke(arguments);
            history.append(ChatMessage.tool(call.id(), mapper.writeValueAsString(result)));
            logger.debug("Tool {} ({}) completed", call.name(), call.id());
            return result;
        } catch (Exception e) {
            ObjectNode error = mapper.createObjectNode();
            error.put("error", ToolInvocationResult.describe(e));
            history.append(ChatMessage.tool(call.id(), error.toString()));
            throw e;
        }
    }
}
