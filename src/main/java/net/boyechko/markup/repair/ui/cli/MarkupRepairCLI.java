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
package net.boyechko.markup.repair.ui.cli;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.markup.repair.core.ProcessingListener;
import net.boyechko.markup.repair.core.ProcessingResult;
import net.boyechko.markup.repair.core.ProcessingService;
import net.boyechko.markup.repair.core.RetriesExhaustedException;
import net.boyechko.markup.repair.core.VerbosityLevel;
import net.boyechko.markup.repair.generation.CandidateText;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.tree.MarkupDocument;
import net.boyechko.markup.repair.tree.MarkupTree;
import net.boyechko.markup.repair.tree.TreeCodec;
import net.boyechko.markup.repair.tree.TreeParseException;
import net.boyechko.markup.repair.ui.LoggingListener;
import net.boyechko.markup.repair.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MarkupRepairCLI {
    private static final String DEFAULT_OUTPUT_SUFFIX = "_repaired";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            boolean analyzeOnly,
            boolean dumpTree,
            Path reportPath,
            VerbosityLevel verbosity,
            boolean printTree,
            boolean plainOutput,
            Set<String> skipPasses) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (!analyzeOnly && !dumpTree && outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        boolean analyzeOnly;
        boolean dumpTree;
        boolean generateReport;
        Path reportPath;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        boolean printTree;
        boolean plainOutput;
        Set<String> skipPasses = Set.of();

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }

            String baseName =
                    inputPath.getFileName().toString().replaceFirst("(_repaired)*[.][^.]+$", "");
            resolveOutputPath(baseName);
            resolveReportPath(baseName);

            return new CLIConfig(
                    inputPath,
                    outputPath,
                    analyzeOnly,
                    dumpTree,
                    reportPath,
                    verbosity,
                    printTree,
                    plainOutput,
                    skipPasses);
        }

        private void resolveOutputPath(String baseName) {
            if (analyzeOnly || dumpTree) {
                return;
            }
            if (outputPath == null) {
                String outputFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".json";
                Path parent = inputPath.getParent();
                outputPath =
                        parent != null ? parent.resolve(outputFilename) : Paths.get(outputFilename);
            } else if (Files.isDirectory(outputPath)) {
                outputPath = outputPath.resolve(baseName + DEFAULT_OUTPUT_SUFFIX + ".json");
            }
        }

        private void resolveReportPath(String baseName) {
            String reportFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".txt";
            if (generateReport && reportPath == null) {
                Path reportSibling = analyzeOnly || dumpTree ? inputPath : outputPath;
                reportPath = reportSibling.resolveSibling(reportFilename);
            } else if (reportPath != null && Files.isDirectory(reportPath)) {
                reportPath = reportPath.resolve(reportFilename);
            }
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config);
            logger().info(
                            "Starting processing of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            int status = processFile(config);
            if (status != 0) {
                System.exit(status);
            }
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--report=")) {
                b.reportPath = Paths.get(args[i].substring("--report=".length()));
                b.generateReport = true;
            } else if (args[i].startsWith("-r=")) {
                b.reportPath = Paths.get(args[i].substring("-r=".length()));
                b.generateReport = true;
            } else if (args[i].startsWith("--skip-passes=")) {
                b.skipPasses = parseCommaSeparated(args[i].substring("--skip-passes=".length()));
            } else {
                switch (args[i]) {
                    case "--skip-passes" -> {
                        if (i + 1 < args.length) {
                            b.skipPasses = parseCommaSeparated(args[++i]);
                        } else {
                            throw new CLIException("Pass names not specified after --skip-passes");
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-t", "--print-tree" -> b.printTree = true;
                    case "--dump-tree" -> b.dumpTree = true;
                    case "--plain" -> b.plainOutput = true;
                    case "-a", "--analyze" -> b.analyzeOnly = true;
                    case "-r", "--report" -> b.generateReport = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static void configureLogging(CLIConfig config) {
        Level level =
                switch (config.verbosity()) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        ch.qos.logback.classic.Logger appLogger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("net.boyechko.markup.repair");
        appLogger.setLevel(level);

        if (config.plainOutput() && config.verbosity() != VerbosityLevel.QUIET) {
            // Processing events are logged at INFO; let them through unless -q was given.
            ch.qos.logback.classic.Logger eventLogger =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LoggingListener.LOGGER_NAME);
            eventLogger.setLevel(config.verbosity().isAtLeast(VerbosityLevel.VERBOSE) ? Level.DEBUG : Level.INFO);
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(MarkupRepairCLI.class);
        }
        return logger;
    }

    /** Returns the process exit status. */
    static int processFile(CLIConfig config) {
        if (config.dumpTree()) {
            return dumpTree(config);
        }

        OutputStream reportFile = null;
        PrintStream output = System.out;

        try {
            reportFile = openReportStream(config);
            if (reportFile != null) {
                output = new PrintStream(new TeeOutputStream(System.out, reportFile));
            }

            ProcessingListener listener =
                    config.plainOutput()
                            ? new LoggingListener()
                            : new ProcessingReporter(output, config.verbosity());
            ProcessingService service =
                    new ProcessingService.ProcessingServiceBuilder()
                            .withListener(listener)
                            .withPrintTree(config.printTree())
                            .skipPasses(config.skipPasses())
                            .build();

            String candidate = Files.readString(config.inputPath(), StandardCharsets.UTF_8);
            if (config.analyzeOnly()) {
                logger().info("Analyzing {}", config.inputPath());
                IssueList issues = service.analyze(candidate);
                return issues.hasFatalIssues() ? 2 : 0;
            }

            logger().info("Repairing {}", config.inputPath());
            ProcessingResult result = service.process(candidate);
            saveResult(result, config, listener);
            return 0;
        } catch (RetriesExhaustedException e) {
            System.err.println("✗ " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("✗ Processing failed due to an exception:");
            System.err.println();
            e.printStackTrace();
            return 1;
        } finally {
            logger().info("Closing output stream");
            if (reportFile != null) {
                output.flush();
                try {
                    reportFile.close();
                } catch (IOException e) {
                    logger().warn("Failed to close report file", e);
                }
            }
        }
    }

    private static OutputStream openReportStream(CLIConfig config) throws IOException {
        if (config.reportPath() == null) {
            return null;
        }
        Path reportParent = config.reportPath().getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        logger().info("Saving report to {}", config.reportPath());
        return Files.newOutputStream(config.reportPath());
    }

    private static void saveResult(
            ProcessingResult result, CLIConfig config, ProcessingListener listener)
            throws IOException {
        Path outputParent = config.outputPath().getParent();
        if (outputParent != null) {
            Files.createDirectories(outputParent);
        }
        Files.writeString(
                config.outputPath(), TreeCodec.write(result.document()), StandardCharsets.UTF_8);
        listener.onSuccess("Output saved to " + config.outputPath());
    }

    /** Prints the input tree, one tag per line, and exits. */
    private static int dumpTree(CLIConfig config) {
        try {
            String text = Files.readString(config.inputPath(), StandardCharsets.UTF_8);
            MarkupDocument document = TreeCodec.read(CandidateText.stripCodeFence(text));
            System.out.print(MarkupTree.toIndentedTreeString(document.elements()));
            return 0;
        } catch (TreeParseException | IOException e) {
            System.err.println("✗ Failed to read tree: " + e.getMessage());
            return 1;
        }
    }

    /** Writes to two output streams simultaneously, like the Unix tee command. */
    private static class TeeOutputStream extends OutputStream {
        private final OutputStream out1;
        private final OutputStream out2;

        TeeOutputStream(OutputStream out1, OutputStream out2) {
            this.out1 = out1;
            this.out2 = out2;
        }

        @Override
        public void write(int b) throws IOException {
            out1.write(b);
            out2.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out1.write(b, off, len);
            out2.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            out1.flush();
            out2.flush();
        }
    }

    private static Set<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: markup-repair [-a] [-q|-v|-vv] [-t] [--plain] [-r[=report]] [--skip-passes=<names>] <input.json> [<output.json>]\n"
                + "  -h, --help        Show this help message\n"
                + "  -a, --analyze     Report structural problems without repairing\n"
                + "  -q, --quiet       Only show errors and final status\n"
                + "  -v, --verbose     Show every individual change\n"
                + "  -vv, --debug      Show all debug information\n"
                + "  -t, --print-tree  Print the repaired tree (with -v)\n"
                + "  --dump-tree       Print the input tree and exit\n"
                + "  --plain           Log events as plain lines instead of boxed sections\n"
                + "  -r, --report      Save output to report file (auto-named from input)\n"
                + "                    Use -r=<file> or --report=<file> for a custom path\n"
                + "  --skip-passes <names>  Skip specific passes (comma-separated class names)\n"
                + "Examples:\n"
                + "  markup-repair -a page.json\n"
                + "  markup-repair -v -t page.json\n"
                + "  markup-repair --dump-tree page.json\n"
                + "  markup-repair --skip-passes=NestingRepairPass page.json out.json";
    }
}
