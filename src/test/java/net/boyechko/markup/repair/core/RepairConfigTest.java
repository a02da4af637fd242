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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RepairConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("markuprepair.maxAttempts");
        System.clearProperty("markuprepair.toolConcurrency");
    }

    @Test
    void defaults() {
        RepairConfig config = RepairConfig.defaults();
        assertEquals(3, config.maxAttempts());
        assertEquals(2, config.toolConcurrency());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new RepairConfig(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RepairConfig(1, 0));
        assertThrows(IllegalArgumentException.class, () -> RepairConfig.defaults().withMaxAttempts(-1));
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("markuprepair.maxAttempts", "5");
        System.setProperty("markuprepair.toolConcurrency", " 4 ");

        RepairConfig config = RepairConfig.fromEnvironment();

        assertEquals(5, config.maxAttempts());
        assertEquals(4, config.toolConcurrency());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        System.setProperty("markuprepair.maxAttempts", "many");
        System.setProperty("markuprepair.toolConcurrency", "0");

        RepairConfig config = RepairConfig.fromEnvironment();

        assertEquals(RepairConfig.DEFAULT_MAX_ATTEMPTS, config.maxAttempts());
        assertEquals(RepairConfig.DEFAULT_TOOL_CONCURRENCY, config.toolConcurrency());
    }
}
