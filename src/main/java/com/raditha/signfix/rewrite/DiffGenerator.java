package com.raditha.signfix.rewrite;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates unified diffs previewing a rewritten line.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private final int contextLines;

    public DiffGenerator() {
        this(3);
    }

    public DiffGenerator(int contextLines) {
        this.contextLines = contextLines;
    }

    /**
     * Unified diff of a file against the same file with one line replaced.
     *
     * @param sourceFile file on disk
     * @param lineNumber line to replace (1-indexed)
     * @param newLine    replacement text
     * @return unified diff, empty when the line is unchanged
     */
    public String generateUnifiedDiff(Path sourceFile, int lineNumber, String newLine) throws IOException {
        List<String> original = Files.readAllLines(sourceFile);
        return generateUnifiedDiff(sourceFile.getFileName().toString(), original, lineNumber, newLine);
    }

    public String generateUnifiedDiff(String fileName, List<String> original, int lineNumber, String newLine) {
        if (lineNumber < 1 || lineNumber > original.size()) {
            throw new IllegalArgumentException("Line " + lineNumber + " is outside " + fileName);
        }
        List<String> revised = new ArrayList<>(original);
        revised.set(lineNumber - 1, newLine);

        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                original,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    /**
     * 1-based column of the first character that differs between two lines, 0 when equal.
     */
    public static int firstDifference(String before, String after) {
        int n = Math.min(before.length(), after.length());
        for (int i = 0; i < n; i++) {
            if (before.charAt(i) != after.charAt(i)) {
                return i + 1;
            }
        }
        return before.length() == after.length() ? 0 : n + 1;
    }
}
