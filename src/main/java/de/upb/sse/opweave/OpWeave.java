package de.upb.sse.opweave;

import com.github.javaparser.symbolsolver.javaparsermodel.JavaParserFacade;
import de.upb.sse.opweave.analysis.CensusReport;
import de.upb.sse.opweave.analysis.OperatorCensus;
import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.core.FileResult;
import de.upb.sse.opweave.core.OperatorInstrumenter;
import de.upb.sse.opweave.frontend.JavaParserOutputVerifier;
import de.upb.sse.opweave.frontend.JavaSourceFrontEnd;
import de.upb.sse.opweave.frontend.ParsedSource;
import de.upb.sse.opweave.frontend.SourceParseException;
import de.upb.sse.opweave.stats.Counter;
import de.upb.sse.opweave.stats.UsageStatistics;
import lombok.Getter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point for instrumenting Java sources: parses with JavaParser, runs the
 * instrumentation pipeline and returns the rewritten text.
 */
public class OpWeave {
    private static final Logger logger = Logger.getLogger(OpWeave.class.getName());

    @Getter private final OpWeaveConfiguration config;
    @Getter private final UsageStatistics statistics;
    private final JavaSourceFrontEnd frontEnd;
    private final OperatorInstrumenter instrumenter;
    private final OperatorCensus census = new OperatorCensus();

    public OpWeave() {
        this(new OpWeaveConfiguration());
    }

    public OpWeave(OpWeaveConfiguration config) {
        this(config, Collections.emptyList());
    }

    public OpWeave(OpWeaveConfiguration config, Collection<String> sourceRoots) {
        this(config, sourceRoots, UsageStatistics.global());
    }

    public OpWeave(OpWeaveConfiguration config, Collection<String> sourceRoots, UsageStatistics statistics) {
        this.config = config;
        this.statistics = statistics;
        this.frontEnd = new JavaSourceFrontEnd(config, sourceRoots);
        this.instrumenter = new OperatorInstrumenter(config, statistics,
                new JavaParserOutputVerifier(config.getLanguageLevel()));
    }

    /**
     * @throws SourceParseException if the source does not parse; nothing is rewritten then
     */
    public FileResult instrument(String fileName, String source) {
        try {
            ParsedSource parsed = frontEnd.parse(fileName, source);
            return instrumenter.instrument(fileName, parsed.root, source);
        } catch (SourceParseException e) {
            logger.warning(e.getMessage());
            statistics.increment(Counter.FILES_FAILED);
            throw e;
        } finally {
            JavaParserFacade.clearInstances();
        }
    }

    public FileResult instrumentFile(Path file) throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        return instrument(file.toString(), source);
    }

    /** Counts candidates without rewriting anything. */
    public CensusReport survey(String fileName, String source) {
        try {
            return census.survey(frontEnd.parse(fileName, source).root);
        } finally {
            JavaParserFacade.clearInstances();
        }
    }

    public List<String> getSourceRoots() {
        return frontEnd.getSourceRoots();
    }
}
