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

/**
 * What one tool call produced.
 *
 * @param toolCallId id of the call
 * @param toolName tool the call named
 * @param result tool output; null on error
 * @param error error description; null exactly when the call succeeded
 */
public record ToolInvocationResult(String toolCallId, String toolName, JsonNode result, String error) {

    public static ToolInvocationResult success(ToolCall call, JsonNode result) {
        return new ToolInvocationResult(call.id(), call.name(), result, null);
    }

    public static ToolInvocationResult failure(ToolCall call, Throwable error) {
        return new ToolInvocationResult(call.id(), call.name(), null, describe(error));
    }

    /** The error's message, or its class name when it has none. Never null. */
    static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getName();
    }

    public boolean isError() {
        return error != null;
    }
}
