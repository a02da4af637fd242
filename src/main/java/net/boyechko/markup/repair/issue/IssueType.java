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

/** Kinds of problems the engine detects and repairs in a converted markup tree. */
public enum IssueType {
    // Candidate-level issues
    MALFORMED_CANDIDATE("candidates that did not parse"),
    RETRIES_EXHAUSTED("requests that never produced a parseable candidate"),

    // Attribute and metadata issues
    LEGACY_ATTRIBUTE("legacy presentational attributes"),
    EMBEDDED_OBJECT("embedded objects with parameter children"),
    LEGACY_SESSION_ACCESSOR("conditions using session.getAttribute"),

    // Table structure issues
    TABLE_WITHOUT_TBODY("tables without a leading tbody"),
    TABLE_CELLPADDING("tables with cellpadding"),
    ROW_WITH_NON_CELL_CHILD("row children that are not cells"),

    // Nesting issues
    FORM_IN_ROW("forms directly inside tr"),
    FORM_IN_PARAGRAPH("forms directly inside p"),
    FORM_IN_TABLE("forms directly inside table"),
    ORPHAN_CELL("cells outside a row"),

    // Non-rendering nodes
    NON_RENDERING_NODE("non-rendering nodes"),
    WRAPPER_NODE("document wrapper nodes");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
