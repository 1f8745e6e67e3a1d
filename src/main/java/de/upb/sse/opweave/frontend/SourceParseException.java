package de.upb.sse.opweave.frontend;

import java.util.List;

/**
 * A source file could not be parsed. The file is left untouched.
 */
public class SourceParseException extends RuntimeException {
    private final String fileName;
    private final List<String> problems;

    public SourceParseException(String fileName, List<String> problems) {
        super(fileName + ": could not parse" + (problems.isEmpty() ? "" : ": " + problems.get(0)));
        this.fileName = fileName;
        this.problems = List.copyOf(problems);
    }

    public String getFileName() {
        return fileName;
    }

    public List<String> getProblems() {
        return problems;
    }
}
