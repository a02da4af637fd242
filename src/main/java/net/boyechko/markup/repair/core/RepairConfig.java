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
package net.boyechko.markup.repair.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run-time limits for the repair loop and tool execution.
 *
 * @param maxAttempts candidates tried before giving up, including the first
 * @param toolConcurrency tool calls allowed to run at once
 */
public record RepairConfig(int maxAttempts, int toolConcurrency) {
    private static final Logger logger = LoggerFactory.getLogger(RepairConfig.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_TOOL_CONCURRENCY = 2;

    public RepairConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (toolConcurrency < 1) {
            throw new IllegalArgumentException(
                    "toolConcurrency must be at least 1, got " + toolConcurrency);
        }
    }

    public static RepairConfig defaults() {
        return new RepairConfig(DEFAULT_MAX_ATTEMPTS, DEFAULT_TOOL_CONCURRENCY);
    }

    /** Reads each setting from a system property, then an environment variable, then the default. */
    public static RepairConfig fromEnvironment() {
        return new RepairConfig(
                resolve("markuprepair.maxAttempts", "MARKUPREPAIR_MAX_ATTEMPTS", DEFAULT_MAX_ATTEMPTS),
                resolve(
                        "markuprepair.toolConcurrency",
                        "MARKUPREPAIR_TOOL_CONCURRENCY",
                        DEFAULT_TOOL_CONCURRENCY));
    }

    public RepairConfig withMaxAttempts(int maxAttempts) {
        return new RepairConfig(maxAttempts, toolConcurrency);
    }

    private static int resolve(String property, String envVar, int defaultValue) {
        // 1. Explicit JVM flag:  -Dmarkuprepair.maxAttempts=5
        String value = System.getProperty(property);
        String source = property;

        // 2. Environment variable: export MARKUPREPAIR_MAX_ATTEMPTS=5
        if (value == null) {
            value = System.getenv(envVar);
            source = envVar;
        }

        // 3. Default
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed >= 1) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            // fall through to the warning below
        }
        logger.warn("Ignoring {}={}: expected a positive integer", source, value);
        return defaultValue;
    }
}
