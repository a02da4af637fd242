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

/**
 * Defines the verbosity levels for output control.
 *
 * <p>Levels (from least to most verbose):
 *
 * <ul>
 *   <li>QUIET - Only errors and final status
 *   <li>NORMAL - One box per pass with what it changed (default)
 *   <li>VERBOSE - Every individual change, plus the repaired tree
 *   <li>DEBUG - All information including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0),
    NORMAL(1),
    VERBOSE(2),
    DEBUG(3);

    private final int level;

    VerbosityLevel(int level) {
        this.level = level;
    }

    /** True if this level is at least as verbose as {@code other}. */
    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }

    public boolean shouldShow(VerbosityLevel requiredLevel) {
        return this.level >= requiredLevel.level;
    }
}
