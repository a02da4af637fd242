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
package net.boyechko.markup.repair;

import static org.junit.jupiter.api.Assertions.fail;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.markup.repair.core.ProcessingResult;
import net.boyechko.markup.repair.tree.MarkupTree;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Goal-driven integration tests. Each test runs the full repair pipeline on a converted tree and
 * compares the result against a hand-written goal snapshot.
 *
 * <p>Workflow for adding a new test case:
 *
 * <ol>
 *   <li>Run {@code markup-repair --dump-tree foo.json} to see the "before" tree
 *   <li>Write the tree you expect after repair to {@code src/test/resources/goals/foo.goal.txt}
 *   <li>Add "foo.json" to the {@code @ValueSource} below
 *   <li>Run tests; they fail until the passes produce the goal
 * </ol>
 */
public class GoalDrivenIntegrationTest extends MarkupTestBase {

    private static final Path GOALS_DIR = Path.of("src/test/resources/goals");

    @ParameterizedTest(name = "repair {0}")
    @ValueSource(strings = {"legacy_layout.json", "embedded_and_orphans.json", "clean_page.json"})
    @Tag("GoalDriven")
    void repairAndCompareToGoal(String inputName) throws Exception {
        Path inputPath = GOALS_DIR.resolve(inputName);
        assumeTrue(Files.exists(inputPath), "Input tree not found: " + inputPath);

        String baseName = inputName.replace(".json", "");
        Path goalFile = GOALS_DIR.resolve(baseName + ".goal.txt");
        assumeTrue(Files.exists(goalFile), "Goal snapshot not found: " + goalFile);

        ProcessingResult result = service().process(Files.readString(inputPath, StandardCharsets.UTF_8));

        String actualTree = MarkupTree.toIndentedTreeString(result.document().elements()).strip();
        String expectedTree = Files.readString(goalFile, StandardCharsets.UTF_8).strip();

        if (!expectedTree.equals(actualTree)) {
            fail(
                    "Repaired tree of "
                            + inputName
                            + " does not match goal "
                            + goalFile
                            + "\n\n"
                            + unifiedDiff(expectedTree, actualTree));
        }
    }

    private static String unifiedDiff(String expected, String actual) {
        List<String> goalLines = expected.lines().toList();
        List<String> actualLines = actual.lines().toList();
        Patch<String> patch = DiffUtils.diff(goalLines, actualLines);
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff("goal", "actual", goalLines, patch, 2);
        return String.join("\n", diff);
    }
}
