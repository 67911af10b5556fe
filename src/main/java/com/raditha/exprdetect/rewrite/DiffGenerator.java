package com.raditha.exprdetect.rewrite;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for instrumentation previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the original and the instrumented source.
     *
     * @param fileName     name shown in the diff headers
     * @param original     original source text
     * @param instrumented instrumented source text
     * @return unified diff as string, empty when the texts are equal
     */
    public String generateUnifiedDiff(String fileName, String original, String instrumented) {
        return generateUnifiedDiff(fileName, original, instrumented, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String instrumented, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(instrumented);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
