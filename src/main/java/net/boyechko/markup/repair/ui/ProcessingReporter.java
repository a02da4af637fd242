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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.markup.repair.core.ProcessingListener;
import net.boyechko.markup.repair.core.VerbosityLevel;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueSev;
import org.slf4j.LoggerFactory;

/**
 * Console report of a repair run. Each pass gets a box listing what it changed and how the tree's
 * node count moved. At verbose level individual changes are listed under the tree path they
 * touched. The summary box adds the candidate retries, the overall tree size and whatever is left
 * for manual review, grouped by kind.
 *
 * <p>Warnings logged by the engine while a box is open are captured and shown inside that box.
 */
public class ProcessingReporter implements ProcessingListener {
    private static final String APP_LOGGER = "net.boyechko.markup.repair";

    private static final String DONE = "✓";
    private static final String FAILED = "⛔️";
    private static final String PENDING = "️✗";
    private static final String NOTE = "○";
    private static final String SECTION = "🞙︎";

    private static final String GUTTER = "│ ";
    private static final int TITLE_WIDTH = 68;
    private static final int TEXT_WIDTH = 80;

    private final PrintStream output;
    private final VerbosityLevel verbosity;
    private final ListAppender<ILoggingEvent> capturedLog = new ListAppender<>();

    private final List<PassSize> passSizes = new ArrayList<>();
    private int rejectedCandidates;
    private boolean boxOpen;
    private boolean sectionOpen;

    private record PassSize(String pass, int before, int after) {}

    public ProcessingReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        capturedLog.start();
        ((Logger) LoggerFactory.getLogger(APP_LOGGER)).addAppender(capturedLog);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (!verbosity.shouldShow(VerbosityLevel.NORMAL)) return;
        closeBox();
        openBox(phaseName);
    }

    @Override
    public void onSubsection(String header) {
        if (!verbosity.shouldShow(VerbosityLevel.NORMAL)) return;
        if (sectionOpen) {
            blank();
        }
        entry(SECTION, header, VerbosityLevel.NORMAL);
        sectionOpen = true;
    }

    @Override
    public void onPassComplete(String passName, int nodesBefore, int nodesAfter) {
        passSizes.add(new PassSize(passName, nodesBefore, nodesAfter));
        if (nodesBefore != nodesAfter) {
            entry(NOTE, "Tree: " + nodesBefore + " → " + nodesAfter + " nodes", VerbosityLevel.NORMAL);
        } else {
            entry(NOTE, "Tree: " + nodesAfter + " nodes", VerbosityLevel.VERBOSE);
        }
    }

    @Override
    public void onAttemptFailed(int attempt, int maxAttempts, String reason) {
        rejectedCandidates++;
        entry(FAILED, "Candidate " + attempt + " of " + maxAttempts + " rejected: " + reason, VerbosityLevel.QUIET);
    }

    @Override
    public void onFixGroup(String groupLabel, List<Issue> resolvedIssues) {
        if (resolvedIssues.isEmpty()) return;
        entry(DONE, resolvedIssues.size() + " " + groupLabel, VerbosityLevel.NORMAL);
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            listByPath(resolvedIssues, DONE, true);
        }
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        if (issues.isEmpty()) return;
        entry(PENDING, issues.size() + " " + groupLabel, VerbosityLevel.NORMAL);
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            listByPath(issues, PENDING, false);
        }
    }

    @Override
    public void onIssueFixed(Issue issue) {
        entry(DONE, issue.resolutionNote(), VerbosityLevel.NORMAL);
    }

    @Override
    public void onWarning(Issue issue) {
        entry(markFor(issue), located(issue), VerbosityLevel.NORMAL);
    }

    @Override
    public void onSuccess(String message) {
        entry(DONE, message, VerbosityLevel.NORMAL);
    }

    @Override
    public void onError(String message) {
        entry(FAILED, message, VerbosityLevel.QUIET);
    }

    @Override
    public void onInfo(String message) {
        entry(NOTE, message, VerbosityLevel.NORMAL);
    }

    @Override
    public void onVerboseOutput(String message) {
        if (verbosity.shouldShow(VerbosityLevel.VERBOSE)) {
            output.print(message);
        }
    }

    @Override
    public void onSummary(IssueList allIssues) {
        if (!verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            passSizes.clear();
            rejectedCandidates = 0;
            return;
        }
        closeBox();
        openBox("Summary");

        if (rejectedCandidates > 0) {
            entry(NOTE, "Candidate regenerated " + rejectedCandidates + " time(s)", VerbosityLevel.NORMAL);
        }
        if (!passSizes.isEmpty()) {
            int start = passSizes.get(0).before();
            int end = passSizes.get(passSizes.size() - 1).after();
            entry(NOTE, "Tree size: " + start + " → " + end + " nodes", VerbosityLevel.NORMAL);
        }

        IssueList remaining = allIssues.getRemainingIssues();
        IssueList resolved = allIssues.getResolvedIssues();
        if (allIssues.isEmpty()) {
            entry(DONE, "Tree already satisfies all structural rules", VerbosityLevel.NORMAL);
        } else {
            entry(NOTE, "Issues detected: " + allIssues.size(), VerbosityLevel.NORMAL);
            entry(DONE, "Resolved: " + resolved.size() + " at " + byPath(resolved).size() + " node(s)", VerbosityLevel.NORMAL);
        }
        if (!remaining.isEmpty()) {
            blank();
            onSubsection("Manual review needed");
            Map<String, List<Issue>> byKind = new LinkedHashMap<>();
            for (Issue issue : remaining) {
                byKind.computeIfAbsent(issue.type().groupLabel(), k -> new ArrayList<>()).add(issue);
            }
            for (Map.Entry<String, List<Issue>> kind : byKind.entrySet()) {
                entry(PENDING, kind.getKey() + ":", VerbosityLevel.NORMAL);
                for (Issue issue : kind.getValue()) {
                    entry(" ", located(issue), VerbosityLevel.NORMAL);
                }
            }
        }
        closeBox();
        passSizes.clear();
        rejectedCandidates = 0;
    }

    private void listByPath(List<Issue> issues, String mark, boolean useResolution) {
        for (Map.Entry<String, List<Issue>> node : byPath(issues).entrySet()) {
            entry(mark, node.getKey(), VerbosityLevel.VERBOSE);
            for (Issue issue : node.getValue()) {
                String text = useResolution && issue.resolutionNote() != null ? issue.resolutionNote() : issue.message();
                entry(" ", "  " + text, VerbosityLevel.VERBOSE);
            }
        }
    }

    /** Groups issues by tree path, in first-seen order; issues without a path go under "(document)". */
    private static Map<String, List<Issue>> byPath(List<Issue> issues) {
        Map<String, List<Issue>> grouped = new LinkedHashMap<>();
        for (Issue issue : issues) {
            String path = issue.where().path();
            grouped.computeIfAbsent(path != null ? path : "(document)", k -> new ArrayList<>()).add(issue);
        }
        return grouped;
    }

    private static String located(Issue issue) {
        String path = issue.where().path();
        return path != null ? issue.message() + " (" + path + ")" : issue.message();
    }

    private static String markFor(Issue issue) {
        return issue.severity() == IssueSev.FATAL || issue.severity() == IssueSev.ERROR ? FAILED : PENDING;
    }

    private void openBox(String title) {
        int rule = Math.max(0, TITLE_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(rule) + "─╮");
        output.println("│");
        boxOpen = true;
        sectionOpen = false;
    }

    private void closeBox() {
        if (!boxOpen) return;
        showCapturedWarnings();
        output.println("│");
        output.println("└─╯");
        boxOpen = false;
        sectionOpen = false;
    }

    /** Moves engine warnings logged since the last box into the box being closed. */
    private void showCapturedWarnings() {
        List<ILoggingEvent> events = new ArrayList<>(capturedLog.list);
        capturedLog.list.clear();
        boolean first = true;
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)) continue;
            if (first) {
                blank();
                first = false;
            }
            String source = event.getLoggerName().substring(event.getLoggerName().lastIndexOf('.') + 1);
            String mark = event.getLevel().isGreaterOrEqual(Level.ERROR) ? FAILED : NOTE;
            entry(mark, source + ": " + event.getFormattedMessage(), VerbosityLevel.NORMAL);
        }
    }

    /** Prints one entry in the box gutter, wrapped to the text width. */
    private void entry(String mark, String text, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) return;
        List<String> lines = wrap(text, TEXT_WIDTH);
        output.println(GUTTER + mark + " " + (lines.isEmpty() ? "" : lines.get(0)));
        for (int i = 1; i < lines.size(); i++) {
            output.println(GUTTER + "  " + lines.get(i));
        }
    }

    private void blank() {
        output.println(GUTTER);
    }

    /**
     * Splits text into lines of at most {@code width} characters, breaking at spaces. Tree paths
     * contain no spaces, so a word longer than the width is broken after a {@code .} or {@code /}
     * where possible and hard-split otherwise.
     */
    static List<String> wrap(String text, int width) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        StringBuilder line = new StringBuilder();
        for (String word : text.split(" ")) {
            String rest = word;
            while (rest.length() > width) {
                if (line.length() > 0) {
                    lines.add(line.toString());
                    line.setLength(0);
                }
                int cut = Math.max(rest.lastIndexOf('.', width - 1), rest.lastIndexOf('/', width - 1));
                cut = cut > 0 ? cut : width;
                lines.add(rest.substring(0, cut));
                rest = rest.substring(cut);
            }
            if (line.length() == 0) {
                line.append(rest);
            } else if (line.length() + 1 + rest.length() <= width) {
                line.append(' ').append(rest);
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(rest);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}
