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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.markup.repair.core.VerbosityLevel;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueLoc;
import net.boyechko.markup.repair.issue.IssueSev;
import net.boyechko.markup.repair.issue.IssueType;
import org.junit.jupiter.api.Test;

public class ProcessingReporterTest {

    private static String render(VerbosityLevel level, ReporterScript script) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ProcessingReporter reporter = new ProcessingReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), level);
        script.play(reporter);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private interface ReporterScript {
        void play(ProcessingReporter reporter);
    }

    private static Issue fixed(int n) {
        return Issue.repaired(
                IssueType.LEGACY_ATTRIBUTE,
                IssueLoc.atNode("/td[" + n + "]", "td"),
                "td has legacy attributes [bgcolor]",
                "Moved bgcolor into style of /td[" + n + "]");
    }

    @Test
    void phasesAreRenderedAsBoxes() {
        String out =
                render(
                        VerbosityLevel.NORMAL,
                        r -> {
                            r.onPhaseStart("Attribute Lowering");
                            r.onFixesSectionStart();
                            r.onIssueFixed(fixed(1));
                            r.onPhaseStart("Nesting Repair");
                            r.onSuccess("No changes needed");
                        });

        assertTrue(out.contains("┌─ Attribute Lowering "), out);
        assertTrue(out.contains("Changes applied"), out);
        assertTrue(out.contains("Moved bgcolor into style of /td[1]"), out);
        assertTrue(out.contains("┌─ Nesting Repair "), out);
        assertTrue(out.indexOf("└─╯") < out.indexOf("Nesting Repair"), "First box is closed before the second");
    }

    @Test
    void fixGroupsShowCountAndDetailsOnlyWhenVerbose() {
        List<Issue> fixes = List.of(fixed(1), fixed(2), fixed(3));
        String label = IssueType.LEGACY_ATTRIBUTE.groupLabel();

        String normal = render(VerbosityLevel.NORMAL, r -> r.onFixGroup(label, fixes));
        String verbose = render(VerbosityLevel.VERBOSE, r -> r.onFixGroup(label, fixes));

        assertTrue(normal.contains("3 legacy presentational attributes"), normal);
        assertFalse(normal.contains("/td[2]"), normal);
        assertTrue(verbose.contains("Moved bgcolor into style of /td[2]"), verbose);
    }

    @Test
    void verboseFixesAreListedUnderTheirPath() {
        Issue cellpadding =
                Issue.repaired(
                        IssueType.TABLE_CELLPADDING,
                        IssueLoc.atNode("/td[1]", "td"),
                        "table has cellpadding",
                        "Pushed padding into cells");
        List<Issue> fixes = List.of(fixed(1), fixed(2), cellpadding);

        String out = render(VerbosityLevel.VERBOSE, r -> r.onFixGroup("changes", fixes));

        int firstPath = out.indexOf("/td[1]\n");
        assertTrue(firstPath >= 0, out);
        assertTrue(out.indexOf("Pushed padding into cells") > firstPath, out);
        assertTrue(out.indexOf("Pushed padding into cells") < out.indexOf("/td[2]\n"), "Both /td[1] changes come before /td[2]: " + out);
    }

    @Test
    void passNodeCountsAreReportedAndSummarized() {
        IssueList all = new IssueList();
        all.add(fixed(1));
        all.add(fixed(2));

        String out =
                render(
                        VerbosityLevel.NORMAL,
                        r -> {
                            r.onPhaseStart("Auxiliary Node Consolidation");
                            r.onPassComplete("Auxiliary Node Consolidation", 12, 9);
                            r.onPhaseStart("Expression Rewrite");
                            r.onPassComplete("Expression Rewrite", 9, 9);
                            r.onPhaseStart("Filter and Flatten");
                            r.onPassComplete("Filter and Flatten", 9, 6);
                            r.onSummary(all);
                        });

        assertTrue(out.contains("Tree: 12 → 9 nodes"), out);
        assertFalse(out.contains("Tree: 9 nodes"), "Unchanged counts need verbose: " + out);
        assertTrue(out.contains("Tree size: 12 → 6 nodes"), out);
        assertTrue(out.contains("Resolved: 2 at 2 node(s)"), out);
    }

    @Test
    void rejectedCandidatesAreCountedInSummary() {
        String out =
                render(
                        VerbosityLevel.NORMAL,
                        r -> {
                            r.onAttemptFailed(1, 3, "Candidate is not valid JSON");
                            r.onAttemptFailed(2, 3, "Candidate is not valid JSON");
                            r.onSummary(new IssueList());
                        });

        assertTrue(out.contains("Candidate 2 of 3 rejected: Candidate is not valid JSON"), out);
        assertTrue(out.contains("Candidate regenerated 2 time(s)"), out);
    }

    @Test
    void summaryListsRemainingIssuesWithPaths() {
        IssueList all = new IssueList();
        all.add(fixed(1));
        all.add(new Issue(IssueType.ORPHAN_CELL, IssueSev.WARNING, IssueLoc.atNode("/div[1].td[2]", "td"), "td outside a row"));

        String out = render(VerbosityLevel.NORMAL, r -> r.onSummary(all));

        assertTrue(out.contains("┌─ Summary"), out);
        assertTrue(out.contains("Issues detected: 2"), out);
        assertTrue(out.contains("Resolved: 1"), out);
        assertTrue(out.contains("Manual review needed"), out);
        assertTrue(out.contains(IssueType.ORPHAN_CELL.groupLabel() + ":"), out);
        assertTrue(out.contains("td outside a row (/div[1].td[2])"), out);
    }

    @Test
    void emptySummarySaysTreeIsClean() {
        String out = render(VerbosityLevel.NORMAL, r -> r.onSummary(new IssueList()));
        assertTrue(out.contains("Tree already satisfies all structural rules"), out);
    }

    @Test
    void quietShowsOnlyErrors() {
        String out =
                render(
                        VerbosityLevel.QUIET,
                        r -> {
                            r.onPhaseStart("Attribute Lowering");
                            r.onSuccess("No changes needed");
                            r.onAttemptFailed(1, 3, "Candidate is not valid JSON");
                            r.onSummary(new IssueList());
                        });

        assertFalse(out.contains("Attribute Lowering"), out);
        assertFalse(out.contains("No changes needed"), out);
        assertTrue(out.contains("Candidate 1 of 3 rejected: Candidate is not valid JSON"), out);
    }

    @Test
    void verboseOutputNeedsVerboseLevel() {
        assertEquals("", render(VerbosityLevel.NORMAL, r -> r.onVerboseOutput("div\n")));
        assertEquals("div\n", render(VerbosityLevel.VERBOSE, r -> r.onVerboseOutput("div\n")));
    }

    @Test
    void wrapBreaksAtSpaces() {
        assertEquals(List.of("aaa bbb", "ccc"), ProcessingReporter.wrap("aaa bbb ccc", 8));
        assertEquals(List.of("short"), ProcessingReporter.wrap("short", 80));
        assertTrue(ProcessingReporter.wrap("", 80).isEmpty());
    }

    @Test
    void longPathsBreakAtSegments() {
        assertEquals(
                List.of("at", "/table[1]", ".tbody[1]", ".tr[3]"),
                ProcessingReporter.wrap("at /table[1].tbody[1].tr[3]", 10));
        assertEquals(List.of("abcd", "efgh", "ij"), ProcessingReporter.wrap("abcdefghij", 4));
    }
}
