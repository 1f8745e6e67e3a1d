package de.upb.sse.opweave.finder;

import de.upb.sse.opweave.util.FileUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives source roots from the package declarations of the files below a
 * directory, so the symbol solver can resolve types declared next to the file
 * being instrumented.
 */
public class SourceRootFinder {
    private final static String PACKAGE_REGEX = "package\\s+([\\w.]+)\\s*;";
    private final static Pattern PACKAGE_PATTERN = Pattern.compile(PACKAGE_REGEX);

    public static Set<String> findSourceRoots(Path dir) {
        Set<String> roots = new TreeSet<>();
        for (Path javaFile : FileUtil.getAllJavaFiles(dir)) {
            try {
                Path root = getSourceRoot(javaFile);
                if (root != null && Files.isDirectory(root)) roots.add(root.toString());
            } catch (IOException e) {
                System.err.println("Warning: Could not read package of " + javaFile + ": " + e.getMessage());
            }
        }
        return roots;
    }

    /** The directory the file's package path starts in, or {@code null} when the file does not sit in it. */
    static Path getSourceRoot(Path javaFile) throws IOException {
        String packageDeclaration = findPackage(javaFile);
        Path parent = javaFile.toAbsolutePath().getParent();
        if (packageDeclaration == null) return parent;

        Matcher m = PACKAGE_PATTERN.matcher(packageDeclaration);
        if (!m.find()) return null;

        String[] segments = m.group(1).split("\\.");
        Path current = parent;
        for (int i = segments.length - 1; i >= 0; i--) {
            if (current == null || current.getFileName() == null
                    || !current.getFileName().toString().equals(segments[i])) {
                return null;
            }
            current = current.getParent();
        }
        return current;
    }

    private static String findPackage(Path path) throws IOException {
        boolean commentScope = false;
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmedLine = line.trim();

                if (!commentScope && trimmedLine.startsWith("package")) return trimmedLine;
                if (trimmedLine.startsWith("/*")) commentScope = true;
                if (!commentScope && !trimmedLine.startsWith("//") && !trimmedLine.startsWith("@")
                        && !trimmedLine.isEmpty()) {
                    break;
                }

                if (commentScope && trimmedLine.contains("*/")) commentScope = false;
            }
            return null;
        }
    }
}
