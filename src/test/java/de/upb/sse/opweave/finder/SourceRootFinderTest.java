package de.upb.sse.opweave.finder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SourceRootFinderTest {

    @TempDir
    Path tempDir;

    private Path write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Package declarations after comments and annotations are found")
    void package_after_header() throws IOException {
        Path file = write("main/java/org/example/A.java",
                "/*\n * header\n */\n// note\n@Deprecated\npackage org.example;\nclass A {}\n");
        assertEquals(tempDir.resolve("main/java").toAbsolutePath(), SourceRootFinder.getSourceRoot(file));
    }

    @Test
    @DisplayName("Files without a package are their own root")
    void default_package() throws IOException {
        Path file = write("scripts/B.java", "class B {}\n");
        assertEquals(tempDir.resolve("scripts").toAbsolutePath(), SourceRootFinder.getSourceRoot(file));
    }

    @Test
    @DisplayName("A package that does not match the directories gives no root")
    void mismatched_package() throws IOException {
        Path file = write("src/wrong/C.java", "package org.example;\nclass C {}\n");
        assertNull(SourceRootFinder.getSourceRoot(file));
    }

    @Test
    @DisplayName("Roots of all files are collected once each")
    void find_all() throws IOException {
        write("a/org/x/A.java", "package org.x;\nclass A {}\n");
        write("a/org/x/y/B.java", "package org.x.y;\nclass B {}\n");
        write("b/C.java", "class C {}\n");
        write("c/wrong/D.java", "package org.x;\nclass D {}\n");

        Set<String> roots = SourceRootFinder.findSourceRoots(tempDir);
        assertEquals(Set.of(tempDir.resolve("a").toAbsolutePath().toString(),
                tempDir.resolve("b").toAbsolutePath().toString()), roots);
    }
}
