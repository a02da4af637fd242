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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import net.boyechko.markup.repair.checks.InvariantCheckVisitor;
import net.boyechko.markup.repair.generation.CandidateGenerator;
import net.boyechko.markup.repair.generation.CandidateText;
import net.boyechko.markup.repair.generation.ChatMessage;
import net.boyechko.markup.repair.generation.ConversationHistory;
import net.boyechko.markup.repair.issue.Issue;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.issue.IssueSev;
import net.boyechko.markup.repair.issue.IssueType;
import net.boyechko.markup.repair.passes.RepairContext;
import net.boyechko.markup.repair.passes.RepairPass;
import net.boyechko.markup.repair.schema.MarkupSchema;
import net.boyechko.markup.repair.tools.ToolCallHandler;
import net.boyechko.markup.repair.tools.ToolCallParser;
import net.boyechko.markup.repair.tools.ToolRegistry;
import net.boyechko.markup.repair.tree.MarkupDocument;
import net.boyechko.markup.repair.tree.MarkupNode;
import net.boyechko.markup.repair.tree.MarkupTree;
import net.boyechko.markup.repair.tree.TreeCodec;
import net.boyechko.markup.repair.tree.TreeParseException;
import net.boyechko.markup.repair.walk.MarkupTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the repair of generated markup trees.
 *
 * <p>{@link #process} wraps the pipeline in a parse-validate-regenerate loop: a candidate that does
 * not parse is sent back to the generator with a corrective instruction, up to {@link
 * RepairConfig#maxAttempts()} times. Passes only ever see a document that parsed.
 */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    static final String CORRECTIVE_INSTRUCTION =
            "The result could not be parsed as a JSON object with an \"elements\" array."
                    + " Regenerate the complete result as JSON only.";

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final MarkupSchema schema;
    private final CandidateGenerator generator;
    private final ProcessingListener listener;
    private final RepairConfig config;
    private final boolean printTree;
    private final List<Supplier<RepairPass>> passSuppliers;

    public static class ProcessingServiceBuilder {
        private MarkupSchema schema;
        private CandidateGenerator generator;
        private ProcessingListener listener;
        private RepairConfig config;
        private boolean printTree;
        private final Set<String> skipPasses = new HashSet<>();

        public ProcessingServiceBuilder withSchema(MarkupSchema schema) {
            this.schema = schema;
            return this;
        }

        public ProcessingServiceBuilder withGenerator(CandidateGenerator generator) {
            this.generator = generator;
            return this;
        }

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public ProcessingServiceBuilder withConfig(RepairConfig config) {
            this.config = config;
            return this;
        }

        public ProcessingServiceBuilder withPrintTree(boolean printTree) {
            this.printTree = printTree;
            return this;
        }

        /** Skips passes by class simple name, e.g. {@code NestingRepairPass}. */
        public ProcessingServiceBuilder skipPasses(Set<String> passClassNames) {
            skipPasses.addAll(passClassNames);
            return this;
        }

        public ProcessingService build() {
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.schema = builder.schema != null ? builder.schema : MarkupSchema.loadDefault();
        this.generator = builder.generator;
        this.listener = builder.listener != null ? builder.listener : ProcessingListener.silent();
        this.config = builder.config != null ? builder.config : RepairConfig.fromEnvironment();
        this.printTree = builder.printTree;
        this.passSuppliers = filterPasses(ProcessingDefaults.passSuppliers(), builder.skipPasses);
    }

    private static List<Supplier<RepairPass>> filterPasses(
            List<Supplier<RepairPass>> defaults, Set<String> skip) {
        if (skip.isEmpty()) {
            return defaults;
        }
        Set<String> known = new HashSet<>();
        List<Supplier<RepairPass>> filtered = new ArrayList<>();
        for (Supplier<RepairPass> supplier : defaults) {
            String className = supplier.get().getClass().getSimpleName();
            known.add(className);
            if (skip.contains(className)) {
                logger.info("Skipping pass {}", className);
            } else {
                filtered.add(supplier);
            }
        }
        for (String name : skip) {
            if (!known.contains(name)) {
                throw new IllegalArgumentException(
                        "Unknown pass '" + name + "'; known passes: " + String.join(", ", known));
            }
        }
        return filtered;
    }

    public MarkupSchema getSchema() {
        return schema;
    }

    public RepairConfig getConfig() {
        return config;
    }

    /** Runs {@link #process(ConversationHistory, String)} with a fresh history. */
    public ProcessingResult process(String candidate) throws RetriesExhaustedException {
        return process(new ConversationHistory(), candidate);
    }

    /**
     * Parses the candidate, regenerating it while it does not parse, and repairs the first one that
     * does. The repaired document is appended to {@code history} as an assistant message.
     *
     * @throws RetriesExhaustedException if no candidate parsed within the attempt limit
     */
    public ProcessingResult process(ConversationHistory history, String candidate)
            throws RetriesExhaustedException {
        int maxAttempts = config.maxAttempts();
        String current = candidate;
        TreeParseException lastError = null;
        int attempt = 0;

        while (attempt < maxAttempts) {
            attempt++;
            MarkupDocument document;
            try {
                document = TreeCodec.read(CandidateText.stripCodeFence(current));
            } catch (TreeParseException e) {
                lastError = e;
                listener.onAttemptFailed(attempt, maxAttempts, e.getMessage());
                logger.debug("Candidate {} rejected: {}", attempt, e.getMessage());
                if (attempt == maxAttempts) {
                    break;
                }
                if (generator == null) {
                    logger.warn("No generator configured, cannot request a corrected candidate");
                    break;
                }
                history.append(ChatMessage.assistant(current != null ? current : ""));
                history.append(ChatMessage.user(CORRECTIVE_INSTRUCTION));
                current = regenerate(history, attempt);
                continue;
            }

            ProcessingResult result = repair(document).withAttempts(attempt);
            history.append(ChatMessage.assistant(TreeCodec.write(result.document())));
            return result;
        }

        RetriesExhaustedException exhausted = new RetriesExhaustedException(attempt, lastError);
        listener.onError("Giving up after " + attempt + " attempt(s)");
        listener.onSummary(
                new IssueList(new Issue(IssueType.RETRIES_EXHAUSTED, IssueSev.FATAL, exhausted.getMessage())));
        throw exhausted;
    }

    /** Asks the generator for a new candidate; a failed call yields null, which will not parse. */
    private String regenerate(ConversationHistory history, int attempt)
            throws RetriesExhaustedException {
        try {
            return generator.regenerate(history.snapshot());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetriesExhaustedException(attempt, e);
        } catch (Exception e) {
            logger.error("Generator failed after attempt {}: {}", attempt, e.getMessage());
            return null;
        }
    }

    /**
     * Runs every pass once, in order, on an already-parsed document. The document is rewritten in
     * place; the returned result holds the same instance.
     */
    public ProcessingResult repair(MarkupDocument document) {
        RepairContext ctx = new RepairContext(schema);
        List<MarkupNode> elements = document.elements();
        logger.debug("Repairing tree of {} node(s)", MarkupTree.count(elements));

        for (Supplier<RepairPass> supplier : passSuppliers) {
            RepairPass pass = supplier.get();
            listener.onPhaseStart(pass.name());
            int before = ctx.issues().size();
            int nodesBefore = MarkupTree.count(elements);
            elements = pass.apply(elements, ctx);
            IssueList changes = new IssueList(ctx.issues().subList(before, ctx.issues().size()));
            if (changes.isEmpty()) {
                listener.onSuccess("No changes needed");
            } else {
                listener.onFixesSectionStart();
                reportFixesGrouped(changes);
            }
            listener.onPassComplete(pass.name(), nodesBefore, MarkupTree.count(elements));
        }
        document.setElements(elements);

        if (printTree) {
            listener.onVerboseOutput(MarkupTree.toIndentedTreeString(document.elements()));
        }

        IssueList remaining = check(document.elements());
        if (!remaining.isEmpty()) {
            listener.onPhaseStart("Review");
            listener.onManualReviewSectionStart();
            reportIssuesGrouped(remaining);
        }

        IssueList all = new IssueList(ctx.issues());
        all.addAll(remaining);
        listener.onSummary(all);

        return new ProcessingResult(document, ctx.issues(), remaining, 1);
    }

    /** Reports violations of the tree rules without changing the document. */
    public IssueList analyze(MarkupDocument document) {
        listener.onPhaseStart("Checking tree structure");
        IssueList issues = check(document.elements());
        if (issues.isEmpty()) {
            listener.onSuccess("No issues found");
        } else {
            reportIssuesGrouped(issues);
            listener.onInfo("Found " + issues.size() + " issue(s)");
        }
        if (printTree) {
            listener.onVerboseOutput(MarkupTree.toIndentedTreeString(document.elements()));
        }
        listener.onSummary(issues);
        return issues;
    }

    /** Parses candidate text and analyzes it; unparseable text is reported as a single issue. */
    public IssueList analyze(String candidate) {
        try {
            return analyze(TreeCodec.read(CandidateText.stripCodeFence(candidate)));
        } catch (TreeParseException e) {
            IssueList issues =
                    new IssueList(
                            new Issue(
                                    IssueType.MALFORMED_CANDIDATE,
                                    IssueSev.FATAL,
                                    e.getMessage()));
            listener.onError(e.getMessage());
            listener.onSummary(issues);
            return issues;
        }
    }

    /**
     * Creates a handler for tool calls made during generation: the built-in tools for this schema,
     * the generator as argument repairer, and the configured concurrency ceiling.
     */
    public ToolCallHandler newToolCallHandler() {
        return new ToolCallHandler(ToolRegistry.withBuiltins(schema), generator, config.toolConcurrency());
    }

    /** Creates a parser for text-embedded tool calls that uses the generator to normalize blocks. */
    public ToolCallParser newToolCallParser() {
        return new ToolCallParser(generator);
    }

    private IssueList check(List<MarkupNode> elements) {
        return new MarkupTreeWalker().addVisitor(new InvariantCheckVisitor(schema)).walk(elements);
    }

    // == Reporting helpers ============================================

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream().collect(Collectors.groupingBy(Issue::type));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();
            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }

    private void reportFixesGrouped(IssueList fixes) {
        Map<IssueType, List<Issue>> grouped =
                fixes.stream().filter(Issue::isResolved).collect(Collectors.groupingBy(Issue::type));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupFixes = entry.getValue();
            if (groupFixes.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onFixGroup(entry.getKey().groupLabel(), groupFixes);
            } else {
                for (Issue issue : groupFixes) {
                    listener.onIssueFixed(issue);
                }
            }
        }
    }
}
