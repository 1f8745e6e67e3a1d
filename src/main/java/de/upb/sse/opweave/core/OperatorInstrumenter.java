package de.upb.sse.opweave.core;

import de.upb.sse.opweave.analysis.*;
import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.generation.ExtractionException;
import de.upb.sse.opweave.generation.InstrumentationCodeGenerator;
import de.upb.sse.opweave.model.*;
import de.upb.sse.opweave.rewrite.*;
import de.upb.sse.opweave.stats.Counter;
import de.upb.sse.opweave.stats.StatisticsSnapshot;
import de.upb.sse.opweave.stats.UsageStatistics;
import de.upb.sse.opweave.util.LineOffsetTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs classification, filtering, analysis, generation and rewriting over the tree
 * of one file.
 * <p>
 * Nodes are visited in post-order, so an inner candidate is proposed before the
 * expression that contains it. Since the earlier proposal wins a conflict, an
 * enclosing candidate whose span covers an accepted edit is rejected, and every
 * replacement is built from original text only.
 */
public class OperatorInstrumenter {
    private static final Logger logger = Logger.getLogger(OperatorInstrumenter.class.getName());

    private final OpWeaveConfiguration config;
    private final ExpressionClassifier classifier;
    private final ContextFilter contextFilter;
    private final TypeDependencyAnalyzer analyzer;
    private final InstrumentationCodeGenerator generator;
    private final UsageStatistics statistics;
    private final OutputVerifier verifier;

    public OperatorInstrumenter(OpWeaveConfiguration config) {
        this(config, UsageStatistics.global(), null);
    }

    /**
     * @param statistics sink every file's counters are merged into
     * @param verifier   checks committed text; only used when the configuration asks for verification
     */
    public OperatorInstrumenter(OpWeaveConfiguration config, UsageStatistics statistics, OutputVerifier verifier) {
        this.config = config;
        this.classifier = new ExpressionClassifier();
        this.contextFilter = new ContextFilter(config);
        this.analyzer = new TypeDependencyAnalyzer();
        this.generator = new InstrumentationCodeGenerator(config);
        this.statistics = statistics;
        this.verifier = config.isVerifyOutput() ? verifier : null;
    }

    public FileResult instrument(String fileName, SyntaxNode root, String buffer) {
        FileRun run = new FileRun(fileName, buffer);
        for (SyntaxNode node : postOrder(root)) {
            run.visit(node);
        }
        return run.finish();
    }

    /** Children left to right, then the node itself; iterative so deep trees cannot overflow the stack. */
    static List<SyntaxNode> postOrder(SyntaxNode root) {
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        Deque<SyntaxNode> reversed = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            reversed.push(node);
            for (SyntaxNode child : node.getChildren()) {
                pending.push(child);
            }
        }
        return new ArrayList<>(reversed);
    }

    private final class FileRun {
        private final String fileName;
        private final String buffer;
        private final LineOffsetTable lines;
        private final SafeRewriteEngine engine;
        private final ProcessedRangeSet processed = new ProcessedRangeSet();
        private final UsageStatistics fileStats = new UsageStatistics();
        private final List<CandidateOutcome> outcomes = new ArrayList<>();
        private final List<Integer> acceptedIndexes = new ArrayList<>();
        private int nextId = 1;

        FileRun(String fileName, String buffer) {
            this.fileName = fileName;
            this.buffer = buffer;
            this.lines = new LineOffsetTable(buffer);
            this.engine = new SafeRewriteEngine(fileName, buffer, verifier);
        }

        void visit(SyntaxNode node) {
            Optional<CandidateExpression> classified = classifier.classify(node);
            if (classified.isEmpty()) return;

            CandidateExpression candidate = classified.get();
            int id = nextId++;
            fileStats.increment(Counter.CLASSIFIED);
            try {
                process(id, candidate, node);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, fileName + ": candidate #" + id + " at " + candidate.getSpan()
                        + " abandoned", e);
                fileStats.increment(Counter.EXTRACTION_FAILED);
                recordOutcome(id, candidate, OutcomeKind.EXTRACTION_FAILURE, "internal error: " + e, null);
            }
        }

        private void process(int id, CandidateExpression candidate, SyntaxNode node) {
            if (!config.isEnabled(candidate.getCategory())) {
                fileStats.increment(Counter.CATEGORY_DISABLED);
                recordOutcome(id, candidate, OutcomeKind.CLASSIFICATION_SKIP, "category disabled", null);
                return;
            }
            if (processed.isProcessed(candidate.getSpan())) {
                fileStats.increment(Counter.ALREADY_PROCESSED);
                recordOutcome(id, candidate, OutcomeKind.CLASSIFICATION_SKIP, "span already processed", null);
                return;
            }

            FilterDecision decision = contextFilter.check(candidate, node.getParent().orElse(null));
            if (!decision.isPassed()) {
                reject(id, candidate, decision.getReason().get());
                return;
            }
            TypeAnalysis analysis = analyzer.analyze(candidate);
            if (!analysis.isAccepted()) {
                reject(id, candidate, analysis.getRejection().get());
                return;
            }

            DependencyClassification classification = analysis.getClassification();
            fileStats.increment(classification.getKind() == DependencyClassification.Kind.CONCRETE
                    ? Counter.ANALYZED_CONCRETE : Counter.ANALYZED_DEFERRED);

            String replacement;
            try {
                replacement = generator.generate(candidate, classification, buffer);
            } catch (ExtractionException e) {
                logger.warning(fileName + ": candidate #" + id + ": " + e.getMessage());
                fileStats.increment(Counter.EXTRACTION_FAILED);
                recordOutcome(id, candidate, OutcomeKind.EXTRACTION_FAILURE, e.getMessage(), null);
                return;
            }
            fileStats.increment(Counter.GENERATED);

            fileStats.increment(Counter.PROPOSED);
            ProposalResult result = engine.proposeEdit(new Edit(candidate.getSpan(), replacement, id));
            if (result == ProposalResult.ACCEPTED) {
                processed.markProcessed(candidate.getSpan());
                acceptedIndexes.add(outcomes.size());
                recordOutcome(id, candidate, OutcomeKind.COMMITTED, null, replacement);
                return;
            }
            fileStats.increment(Counter.CONFLICT_REJECTED);
            recordOutcome(id, candidate, OutcomeKind.CONFLICT_REJECTED, describeRejection(id), replacement);
        }

        private String describeRejection(int id) {
            List<RejectedEdit> rejected = engine.getRejectedEdits();
            RejectedEdit last = rejected.get(rejected.size() - 1);
            if (last.edit.candidateId != id || last.conflictingEdit == null) {
                return "span outside buffer";
            }
            return "overlaps edit of candidate #" + last.conflictingEdit.candidateId;
        }

        private void reject(int id, CandidateExpression candidate, RejectionReason reason) {
            logger.fine(() -> fileName + ": candidate #" + id + " rejected: " + reason.getDescription());
            fileStats.recordRejection(reason.name());
            recordOutcome(id, candidate, OutcomeKind.CONTEXT_REJECTED, reason.getDescription(), null);
        }

        private void recordOutcome(int id, CandidateExpression candidate, OutcomeKind outcome, String reason,
                            String replacement) {
            SourceSpan span = candidate.getSpan();
            int line = 0;
            int column = 0;
            if (span.getStart() <= buffer.length()) {
                line = lines.lineOf(span.getStart());
                column = lines.columnOf(span.getStart());
            }
            outcomes.add(new CandidateOutcome(id, candidate.getKind(), candidate.getCategory(), span, line, column,
                    outcome, reason, replacement));
        }

        FileResult finish() {
            String output = buffer;
            if (config.isDryRun()) {
                engine.rollback();
                settleAccepted(OutcomeKind.DRY_RUN, null);
                fileStats.add(Counter.DRY_RUN_SKIPPED, acceptedIndexes.size());
            } else {
                try {
                    output = engine.commitAll();
                    settleAccepted(OutcomeKind.COMMITTED, null);
                    for (int index : acceptedIndexes) {
                        fileStats.recordCommitted(outcomes.get(index).getCategory());
                    }
                } catch (CommitFailureException e) {
                    logger.warning(e.getMessage());
                    fileStats.increment(Counter.COMMIT_FAILED);
                    settleAccepted(OutcomeKind.COMMIT_FAILURE, e.getMessage());
                }
            }

            fileStats.increment(Counter.FILES_PROCESSED);
            if (!output.equals(buffer)) fileStats.increment(Counter.FILES_CHANGED);
            StatisticsSnapshot snapshot = fileStats.snapshot();
            statistics.mergeFrom(snapshot);

            logger.info(fileName + ": " + snapshot.getCommitted() + " committed, "
                    + snapshot.get(Counter.CONTEXT_REJECTED) + " context-rejected, "
                    + snapshot.get(Counter.CONFLICT_REJECTED) + " conflicting, "
                    + snapshot.get(Counter.EXTRACTION_FAILED) + " extraction failures");
            return new FileResult(fileName, buffer, output, engine.getState(), outcomes, snapshot);
        }

        private void settleAccepted(OutcomeKind outcome, String reason) {
            for (int index : acceptedIndexes) {
                outcomes.set(index, outcomes.get(index).withOutcome(outcome, reason));
            }
        }
    }
}
