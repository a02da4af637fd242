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
package net.boyechko.markup.repair.ui;

import net.boyechko.markup.repair.core.ProcessingListener;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueSev;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ProcessingListener} that routes all events through SLF4J, one plain line per event.
 * Used by the CLI's {@code --plain} mode, where output goes wherever Logback sends it.
 */
public class LoggingListener implements ProcessingListener {

    public static final String LOGGER_NAME = "net.boyechko.markup.repair.processing";

    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PASS {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onWarning(Issue issue) {
        String message = "ISSUE " + issue.type() + ": " + issue.message() + at(issue);
        IssueSev severity = issue.severity();
        if (severity == IssueSev.INFO) {
            logger.info("{}", message);
        } else if (severity == IssueSev.WARNING) {
            logger.warn("{}", message);
        } else {
            logger.error("{}", message);
        }
    }

    @Override
    public void onIssueFixed(Issue issue) {
        logger.info("FIXED {}: {}", issue.type(), issue.resolutionNote());
    }

    @Override
    public void onPassComplete(String passName, int nodesBefore, int nodesAfter) {
        logger.debug("NODES {}: {} -> {}", passName, nodesBefore, nodesAfter);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onSummary(IssueList allIssues) {
        int detected = allIssues.size();
        int resolved = allIssues.getResolvedIssues().size();
        int remaining = allIssues.getRemainingIssues().size();
        logger.info("SUMMARY detected={} resolved={} remaining={}", detected, resolved, remaining);
    }

    private static String at(Issue issue) {
        String path = issue.where().path();
        return path != null ? " (at " + path + ")" : "";
    }
}
