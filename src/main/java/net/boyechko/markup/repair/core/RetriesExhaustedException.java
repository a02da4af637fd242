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

/** Thrown when no candidate parsed within the allowed number of attempts. */
public class RetriesExhaustedException extends Exception {
    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastError) {
        super(
                "No parseable candidate after "
                        + attempts
                        + " attempt(s)"
                        + (lastError != null ? ": " + lastError.getMessage() : ""),
                lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
