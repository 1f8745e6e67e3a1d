package de.upb.sse.opweave;

import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.core.FileResult;
import de.upb.sse.opweave.runtime.Primops;
import de.upb.sse.opweave.stats.UsageStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class InstrumentedOutputCompilationTest {
    private static final String FIXTURES = "src/test/resources/instrumentation/";
    private static final List<String> COMPILED = List.of("Arithmetic.java", "ArrayAccess.java", "GenericBox.java",
            "Narrowing.java");

    @TempDir
    Path workDir;

    private OpWeave opWeave;
    private JavaCompiler compiler;

    @BeforeEach
    void setup() {
        opWeave = new OpWeave(OpWeaveConfiguration.allOperators(), Collections.emptyList(), new UsageStatistics());
        compiler = ToolProvider.getSystemJavaCompiler();
    }

    private static String runtimeClassPath() throws Exception {
        // surefire may hide the real class path behind a manifest-only jar
        return Paths.get(Primops.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
    }

    private Path writeSources(String set, boolean instrumented) throws IOException {
        Path dir = workDir.resolve(set).resolve("fixtures");
        Files.createDirectories(dir);
        for (String name : COMPILED) {
            String source = Files.readString(Paths.get(FIXTURES + name));
            String text = instrumented ? opWeave.instrument(name, source).getOutput() : source;
            Files.writeString(dir.resolve(name), text);
        }
        return dir;
    }

    private Path compile(Path sourceDir, String set) throws Exception {
        Path output = workDir.resolve(set + "-classes");
        Files.createDirectories(output);
        List<String> files = new ArrayList<>();
        for (String name : COMPILED) {
            files.add(sourceDir.resolve(name).toString());
        }
        List<String> options = List.of("-cp", runtimeClassPath(), "-d", output.toString());

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        boolean success;
        try (StandardJavaFileManager fileManager = compiler.getStandardFileManager(diagnostics, null, null)) {
            JavaCompiler.CompilationTask task = compiler.getTask(null, fileManager, diagnostics, options, null,
                    fileManager.getJavaFileObjectsFromStrings(files));
            success = task.call();
        }

        StringBuilder errors = new StringBuilder();
        for (Diagnostic<? extends JavaFileObject> diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.getKind() == Diagnostic.Kind.ERROR) {
                errors.append(diagnostic.getSource() != null ? diagnostic.getSource().getName() : "unknown")
                        .append(':').append(diagnostic.getLineNumber()).append(": ")
                        .append(diagnostic.getMessage(null)).append('\n');
            }
        }
        assertTrue(success, set + " sources do not compile:\n" + errors);
        return output;
    }

    private static Object call(ClassLoader loader, String className, String method, Class<?>[] parameterTypes,
                               Object... arguments) throws Exception {
        Class<?> type = loader.loadClass("fixtures." + className);
        Object instance = type.getDeclaredConstructor().newInstance();
        Method target = type.getDeclaredMethod(method, parameterTypes);
        target.setAccessible(true);
        return target.invoke(instance, arguments);
    }

    @Test
    @DisplayName("Rewritten fixtures compile and compute what the originals compute")
    void rewritten_fixtures_compile_and_agree() throws Exception {
        assumeTrue(compiler != null, "no system Java compiler available");

        Path originalClasses = compile(writeSources("original", false), "original");
        Path instrumentedClasses = compile(writeSources("instrumented", true), "instrumented");

        String narrowing = Files.readString(workDir.resolve("instrumented/fixtures/Narrowing.java"));
        assertTrue(narrowing.contains("byte b = X + 1;"), narrowing);
        assertTrue(narrowing.contains("s[i] = 5;"), narrowing);
        assertTrue(narrowing.contains("Primops.subscript("), narrowing);

        try (URLClassLoader original = new URLClassLoader(new URL[]{originalClasses.toUri().toURL()},
                getClass().getClassLoader());
             URLClassLoader instrumented = new URLClassLoader(new URL[]{instrumentedClasses.toUri().toURL()},
                     getClass().getClassLoader())) {
            Class<?>[] intArray = {int[].class};
            assertEquals(call(original, "ArrayAccess", "sum", intArray, (Object) new int[]{1, 2, 3}),
                    call(instrumented, "ArrayAccess", "sum", intArray, (Object) new int[]{1, 2, 3}));

            Class<?>[] scaleArgs = {int.class, long.class};
            assertEquals(12L, call(instrumented, "Arithmetic", "scale", scaleArgs, 3, 4L));
            assertEquals(call(original, "Arithmetic", "scale", scaleArgs, 3, 4L),
                    call(instrumented, "Arithmetic", "scale", scaleArgs, 3, 4L));
            Class<?>[] lessArgs = {double.class, double.class};
            assertEquals(call(original, "Arithmetic", "less", lessArgs, 1.5, Double.NaN),
                    call(instrumented, "Arithmetic", "less", lessArgs, 1.5, Double.NaN));
            assertEquals(call(original, "Arithmetic", "flip", new Class<?>[]{int.class}, 7),
                    call(instrumented, "Arithmetic", "flip", new Class<?>[]{int.class}, 7));

            double[] before = {1.0, 2.0};
            double[] after = {1.0, 2.0};
            Class<?>[] bumpArgs = {double[].class, int.class};
            call(original, "Arithmetic", "bump", bumpArgs, before, 1);
            call(instrumented, "Arithmetic", "bump", bumpArgs, after, 1);
            assertTrue(Arrays.equals(before, after));

            Class<?>[] none = {};
            for (String method : List.of("next", "negated", "letter", "boxed")) {
                assertEquals(call(original, "Narrowing", method, none), call(instrumented, "Narrowing", method, none),
                        method);
            }
            Class<?>[] sumArgs = {int[].class, int.class};
            assertEquals(8, call(instrumented, "Narrowing", "sum", sumArgs, new int[]{4, 5}, 1));
        }
    }

    @Test
    @DisplayName("Narrowed constants and box element stores are left in place")
    void narrowing_outcomes() throws IOException {
        FileResult result = opWeave.instrument("Narrowing.java", Files.readString(Paths.get(FIXTURES + "Narrowing.java")));

        assertTrue(result.isChanged());
        String output = result.getOutput();
        assertTrue(output.contains("short s = -X;"), output);
        assertTrue(output.contains("return BASE + 2;"), output);
        assertTrue(output.contains("byte[] table = {X + 2, 3};"), output);
        assertFalse(output.contains("java.lang.Short[].class, s, i, 5"), output);
    }
}
