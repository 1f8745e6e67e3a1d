package de.upb.sse.opweave.frontend;

import com.github.javaparser.ast.CompilationUnit;
import de.upb.sse.opweave.model.TreeNode;

public final class ParsedSource {
    public final String fileName;
    public final String source;
    public final CompilationUnit compilationUnit;
    public final TreeNode root;

    public ParsedSource(String fileName, String source, CompilationUnit compilationUnit, TreeNode root) {
        this.fileName = fileName;
        this.source = source;
        this.compilationUnit = compilationUnit;
        this.root = root;
    }
}
