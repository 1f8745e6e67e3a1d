package de.upb.sse.opweave.frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.model.TreeNode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses Java source with JavaParser, resolves types against the JDK and the given
 * source roots, and hands back the tree the instrumentation pipeline works on.
 */
public class JavaSourceFrontEnd {
    private final OpWeaveConfiguration config;
    private final JavaSymbolSolver symbolSolver;
    private final List<String> sourceRoots = new ArrayList<>();

    public JavaSourceFrontEnd(OpWeaveConfiguration config) {
        this(config, Collections.emptyList());
    }

    public JavaSourceFrontEnd(OpWeaveConfiguration config, Collection<String> sourceRoots) {
        this.config = config;

        CombinedTypeSolver combinedTypeSolver = new CombinedTypeSolver();
        combinedTypeSolver.add(new ReflectionTypeSolver());
        for (String sourceRoot : sourceRoots) {
            try {
                Path rootPath = Paths.get(sourceRoot);
                if (!Files.isDirectory(rootPath)) {
                    System.err.println("Warning: Skipping invalid source root (not a directory): " + sourceRoot);
                    continue;
                }
                combinedTypeSolver.add(new JavaParserTypeSolver(rootPath));
                this.sourceRoots.add(sourceRoot);
            } catch (IllegalStateException e) {
                System.err.println("Warning: Skipping invalid source root: " + sourceRoot + " - " + e.getMessage());
            }
        }
        this.symbolSolver = new JavaSymbolSolver(combinedTypeSolver);
    }

    public ParsedSource parse(String fileName, String source) {
        ParserConfiguration parserConfiguration = new ParserConfiguration()
                .setLanguageLevel(config.getLanguageLevel())
                .setSymbolResolver(symbolSolver);
        ParseResult<CompilationUnit> result = new JavaParser(parserConfiguration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<String> problems = result.getProblems().stream()
                    .map(Problem::getMessage)
                    .collect(Collectors.toList());
            throw new SourceParseException(fileName, problems);
        }

        CompilationUnit cu = result.getResult().get();
        TreeNode root = new JavaSyntaxTreeBuilder(config, fileName, source).build(cu);
        return new ParsedSource(fileName, source, cu, root);
    }

    public List<String> getSourceRoots() {
        return Collections.unmodifiableList(sourceRoots);
    }
}
