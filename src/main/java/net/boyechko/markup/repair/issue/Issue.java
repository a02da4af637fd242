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
package net.boyechko.markup.repair.issue;

/** A problem found in a markup tree, and how (or whether) it was repaired. */
public final class Issue {
    private final IssueType type;
    private final IssueSev severity;
    private final IssueLoc where;
    private final String message;

    private boolean resolved;
    private String resolution;

    public Issue(IssueType type, IssueSev sev, String message) {
        this(type, sev, IssueLoc.none(), message);
    }

    public Issue(IssueType type, IssueSev sev, IssueLoc where, String message) {
        this.type = type;
        this.severity = sev;
        this.where = where != null ? where : IssueLoc.none();
        this.message = message;
    }

    /** Shorthand for an issue that was repaired on the spot. */
    public static Issue repaired(IssueType type, IssueLoc where, String message, String note) {
        Issue issue = new Issue(type, IssueSev.WARNING, where, message);
        issue.markResolved(note);
        return issue;
    }

    public IssueType type() {
        return type;
    }

    public IssueSev severity() {
        return severity;
    }

    public IssueLoc where() {
        return where;
    }

    public String message() {
        return message;
    }

    public boolean isResolved() {
        return resolved;
    }

    public String resolutionNote() {
        return resolution;
    }

    public void markResolved(String note) {
        this.resolved = true;
        this.resolution = note;
    }

    @Override
    public String toString() {
        String at = where.path() != null ? " at " + where.path() : "";
        return type + ": " + message + at;
    }
}
