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

import java.util.List;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueList;

/** Interface for reporting progress and results of the processing. */
public interface ProcessingListener {
    void onPhaseStart(String phaseName);

    void onSuccess(String message);

    void onWarning(Issue issue);

    void onIssueFixed(Issue issue);

    void onSummary(IssueList allIssues);

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onVerboseOutput(String message) {}

    default void onSubsection(String header) {}

    default void onFixesSectionStart() {
        onSubsection("Changes applied");
    }

    default void onManualReviewSectionStart() {
        onSubsection("Needs manual review");
    }

    /** A pass has run; node counts cover the whole forest, wrappers and placeholders included. */
    default void onPassComplete(String passName, int nodesBefore, int nodesAfter) {}

    /** A candidate did not parse; {@code attempt} counts from 1. */
    default void onAttemptFailed(int attempt, int maxAttempts, String reason) {
        onError("Attempt " + attempt + " of " + maxAttempts + " failed: " + reason);
    }

    default void onIssueGroup(String groupLabel, List<Issue> issues) {
        for (Issue issue : issues) {
            onWarning(issue);
        }
    }

    default void onFixGroup(String groupLabel, List<Issue> resolvedIssues) {
        for (Issue issue : resolvedIssues) {
            if (issue.isResolved()) {
                onIssueFixed(issue);
            }
        }
    }

    /** A listener that ignores every event. */
    static ProcessingListener silent() {
        return new ProcessingListener() {
            @Override
            public void onPhaseStart(String phaseName) {}

            @Override
            public void onSuccess(String message) {}

            @Override
            public void onWarning(Issue issue) {}

            @Override
            public void onIssueFixed(Issue issue) {}

            @Override
            public void onSummary(IssueList allIssues) {}
        };
    }
}
