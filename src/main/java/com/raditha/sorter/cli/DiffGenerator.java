package com.raditha.sorter.cli;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.List;

/**
 * Generates unified diffs for dry-run previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT = 3;

    /**
     * Generate a unified diff between the original and the sorted lines.
     *
     * @param fileName      name shown in the diff header
     * @param originalLines lines before sorting
     * @param revisedLines  lines after sorting
     * @return unified diff, or an empty string when the lines are equal
     */
    public String generateUnifiedDiff(String fileName, List<String> originalLines, List<String> revisedLines) {
        return generateUnifiedDiff(fileName, originalLines, revisedLines, DEFAULT_CONTEXT);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, List<String> originalLines, List<String> revisedLines,
            int contextLines) {
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
}
