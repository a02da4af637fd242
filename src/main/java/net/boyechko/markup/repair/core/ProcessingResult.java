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

import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.tree.MarkupDocument;

/**
 * Outcome of repairing one document.
 *
 * @param document the repaired document
 * @param appliedFixes changes the passes made, each as a resolved issue
 * @param remainingIssues violations still present after repair
 * @param attempts candidates parsed or rejected before this result, counting the successful one
 */
public record ProcessingResult(
        MarkupDocument document, IssueList appliedFixes, IssueList remainingIssues, int attempts) {

    public ProcessingResult withAttempts(int attempts) {
        return new ProcessingResult(document, appliedFixes, remainingIssues, attempts);
    }

    public int totalFixesApplied() {
        return appliedFixes.size();
    }

    public boolean needsManualReview() {
        return !remainingIssues.isEmpty();
    }
}
