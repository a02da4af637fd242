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
package net.boyechko.markup.repair.concurrent;

/**
 * Result of one task run by {@link BoundedTaskExecutor}: either a value or the error it failed with.
 *
 * @param id the task's identifier
 * @param value the task's result; null when it failed
 * @param error what the task threw; null when it succeeded
 */
public record TaskOutcome<T>(String id, T value, Throwable error) {

    public static <T> TaskOutcome<T> success(String id, T value) {
        return new TaskOutcome<>(id, value, null);
    }

    public static <T> TaskOutcome<T> failure(String id, Throwable error) {
        return new TaskOutcome<>(id, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
