package de.upb.sse.opweave.tool;

import de.upb.sse.opweave.OpWeave;
import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.core.FileResult;
import de.upb.sse.opweave.finder.SourceRootFinder;
import de.upb.sse.opweave.frontend.SourceParseException;
import de.upb.sse.opweave.stats.Counter;
import de.upb.sse.opweave.stats.StatisticsSnapshot;
import de.upb.sse.opweave.util.FileUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Instruments every Java file below a source directory.
 * <p>
 * Results go to an output directory that mirrors the relative paths, or back into
 * the source files when no output directory is given. In dry-run mode nothing is
 * written. A file that cannot be read, parsed or written is reported and skipped.
 */
public class SourceTreeProcessor {

    private final Path sourceRoot;
    private final Path outputDirectory;  // null means in place
    private final OpWeave opWeave;
    private volatile boolean cancelled;

    public SourceTreeProcessor(Path sourceRoot, Path outputDirectory, OpWeave opWeave) {
        this.sourceRoot = sourceRoot;
        this.outputDirectory = outputDirectory;
        this.opWeave = opWeave;
    }

    /**
     * A processor whose type resolution sees every source root found below {@code sourceRoot}.
     */
    public static SourceTreeProcessor forDirectory(Path sourceRoot, Path outputDirectory,
                                                   OpWeaveConfiguration config) {
        Set<String> sourceRoots = SourceRootFinder.findSourceRoots(sourceRoot);
        return new SourceTreeProcessor(sourceRoot, outputDirectory, new OpWeave(config, sourceRoots));
    }

    /** Stops processing after the file currently being instrumented. */
    public void cancel() {
        cancelled = true;
    }

    public ProcessingResult process() {
        boolean dryRun = opWeave.getConfig().isDryRun();
        System.out.println("Starting instrumentation...");
        System.out.println("Source Root: " + sourceRoot);
        System.out.println("Output: " + (dryRun ? "none (dry run)"
                : outputDirectory != null ? outputDirectory.toString() : "in place"));

        long committedBefore = opWeave.getStatistics().snapshot().getCommitted();
        List<Path> javaFiles = FileUtil.getAllJavaFiles(sourceRoot);
        System.out.println("Found " + javaFiles.size() + " Java files");
        System.out.println();

        List<FileResult> results = new ArrayList<>();
        Map<String, String> failures = new TreeMap<>();
        int filesSeen = 0;
        int filesChanged = 0;
        for (Path javaFile : javaFiles) {
            if (cancelled) {
                System.out.println("Cancelled after " + filesSeen + " of " + javaFiles.size() + " files");
                break;
            }
            filesSeen++;
            String relativePath = sourceRoot.relativize(javaFile).toString().replace('\\', '/');
            try {
                String source = Files.readString(javaFile, StandardCharsets.UTF_8);
                FileResult result = opWeave.instrument(relativePath, source);
                results.add(result);
                if (result.isChanged()) filesChanged++;
                result.getOutcomes().stream()
                        .filter(outcome -> outcome.getOutcome().isFailure())
                        .forEach(outcome -> System.err.println(outcome.describe(relativePath)));
                if (!dryRun) write(javaFile, relativePath, result);
            } catch (SourceParseException e) {
                System.err.println("Error parsing file " + relativePath + ": " + e.getMessage());
                failures.put(relativePath, e.getMessage());
            } catch (IOException e) {
                System.err.println("Error processing file " + relativePath + ": " + e.getMessage());
                opWeave.getStatistics().increment(Counter.FILES_FAILED);
                failures.put(relativePath, e.getMessage());
            }
        }

        StatisticsSnapshot statistics = opWeave.getStatistics().snapshot();
        ProcessingResult result = new ProcessingResult(filesSeen, filesChanged, failures, cancelled, results,
                statistics.getCommitted() - committedBefore, statistics);
        result.printSummary();
        return result;
    }

    private void write(Path javaFile, String relativePath, FileResult result) throws IOException {
        if (outputDirectory == null) {
            if (result.isChanged()) Files.writeString(javaFile, result.getOutput(), StandardCharsets.UTF_8);
            return;
        }
        Path target = outputDirectory.resolve(relativePath);
        if (target.getParent() != null) Files.createDirectories(target.getParent());
        Files.writeString(target, result.getOutput(), StandardCharsets.UTF_8);
    }

    public static class ProcessingResult {
        public final int filesSeen;
        public final int filesChanged;
        public final Map<String, String> failures;  // relative path -> message
        public final boolean cancelled;
        public final List<FileResult> results;
        public final long committed;  // edits committed by this run
        public final StatisticsSnapshot statistics;  // cumulative, including earlier runs on the same sink

        public ProcessingResult(int filesSeen, int filesChanged, Map<String, String> failures, boolean cancelled,
                                List<FileResult> results, long committed, StatisticsSnapshot statistics) {
            this.filesSeen = filesSeen;
            this.filesChanged = filesChanged;
            this.failures = Collections.unmodifiableMap(failures);
            this.cancelled = cancelled;
            this.results = Collections.unmodifiableList(results);
            this.committed = committed;
            this.statistics = statistics;
        }

        public int getFilesFailed() {
            return failures.size();
        }

        public void printSummary() {
            System.out.println();
            System.out.println("=== Instrumentation Summary ===");
            System.out.println("Files processed: " + filesSeen);
            System.out.println("Files changed: " + filesChanged);
            System.out.println("Files failed: " + getFilesFailed());
            System.out.println("Edits committed: " + committed);
            if (cancelled) System.out.println("Run was cancelled");
            System.out.println();
            statistics.print(System.out);
        }
    }
}
