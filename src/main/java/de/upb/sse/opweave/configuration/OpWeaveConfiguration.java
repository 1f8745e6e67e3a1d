package de.upb.sse.opweave.configuration;

import com.github.javaparser.ParserConfiguration;
import de.upb.sse.opweave.model.OperatorCategory;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class OpWeaveConfiguration {
    public static final String DEFAULT_RUNTIME_CLASS = "de.upb.sse.opweave.runtime.Primops";

    private boolean indexAccess = true;
    private boolean arithmetic = false;
    private boolean assignment = false;
    private boolean comparison = false;
    private boolean unary = false;
    private boolean skipSystemOrigin = true;
    private boolean dryRun = false;

    // re-parse committed output and roll back when it no longer parses
    private boolean verifyOutput = true;

    private String runtimeClass = DEFAULT_RUNTIME_CLASS;

    // package or path prefixes whose sources count as system/library origin
    private List<String> systemOriginPrefixes = new ArrayList<>(List.of("java.", "javax.", "jdk.", "sun."));

    private ParserConfiguration.LanguageLevel languageLevel = ParserConfiguration.LanguageLevel.JAVA_17;

    public OpWeaveConfiguration(boolean indexAccess, boolean arithmetic, boolean assignment,
                                boolean comparison, boolean skipSystemOrigin, boolean dryRun) {
        this.indexAccess = indexAccess;
        this.arithmetic = arithmetic;
        this.assignment = assignment;
        this.comparison = comparison;
        this.skipSystemOrigin = skipSystemOrigin;
        this.dryRun = dryRun;
    }

    /** Every operator category switched on. */
    public static OpWeaveConfiguration allOperators() {
        OpWeaveConfiguration config = new OpWeaveConfiguration();
        config.setArithmetic(true);
        config.setAssignment(true);
        config.setComparison(true);
        config.setUnary(true);
        return config;
    }

    public boolean isEnabled(OperatorCategory category) {
        switch (category) {
            case INDEX_ACCESS: return indexAccess;
            case ARITHMETIC: return arithmetic;
            case ASSIGNMENT: return assignment;
            case COMPARISON: return comparison;
            case UNARY: return unary;
            default: return false;
        }
    }

    public boolean isSystemOriginPackage(String packageName) {
        if (packageName == null || packageName.isEmpty()) return false;
        String qualified = packageName + ".";
        for (String prefix : systemOriginPrefixes) {
            if (qualified.startsWith(prefix)) return true;
        }
        return false;
    }

    /** Matches the file path, with '/' separators, against the prefixes that are not package names. */
    public boolean isSystemOriginPath(String path) {
        if (path == null || path.isEmpty()) return false;
        String normalized = path.replace('\\', '/');
        for (String prefix : systemOriginPrefixes) {
            if (prefix.indexOf('/') >= 0 && normalized.startsWith(prefix)) return true;
        }
        return false;
    }
}
