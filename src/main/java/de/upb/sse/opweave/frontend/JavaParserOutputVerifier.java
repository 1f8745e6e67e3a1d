package de.upb.sse.opweave.frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import de.upb.sse.opweave.rewrite.OutputVerifier;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Accepts rewritten text only if it still parses at the configured language level.
 */
public class JavaParserOutputVerifier implements OutputVerifier {
    private final ParserConfiguration.LanguageLevel languageLevel;

    public JavaParserOutputVerifier(ParserConfiguration.LanguageLevel languageLevel) {
        this.languageLevel = languageLevel;
    }

    @Override
    public List<String> verify(String fileName, String output) {
        ParserConfiguration configuration = new ParserConfiguration().setLanguageLevel(languageLevel);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(output);
        return result.getProblems().stream()
                .map(Problem::getMessage)
                .collect(Collectors.toList());
    }
}
