package de.upb.sse.opweave.rewrite;

import java.util.List;

/**
 * Checks the text a commit is about to produce.
 */
@FunctionalInterface
public interface OutputVerifier {

    /**
     * @return problems found in {@code output}; empty when the text is acceptable
     */
    List<String> verify(String fileName, String output);
}
