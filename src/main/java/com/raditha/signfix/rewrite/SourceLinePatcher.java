package com.raditha.signfix.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a rewritten line back into its source file.
 * <p>
 * Line terminators of the file are preserved, including a missing newline at the end.
 */
public class SourceLinePatcher {

    private static final Logger logger = LoggerFactory.getLogger(SourceLinePatcher.class);

    /**
     * Replace one line of a file.
     *
     * @param file       file to patch
     * @param newLine    replacement, without a line terminator
     * @param lineNumber line to replace (1-indexed)
     * @return true when the file changed
     * @throws IOException              when the file cannot be read or written
     * @throws IllegalArgumentException when the line does not exist
     */
    public boolean apply(Path file, String newLine, int lineNumber) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        int start = 0;
        for (int line = 1; line < lineNumber; line++) {
            int nl = content.indexOf('\n', start);
            if (nl < 0) {
                throw new IllegalArgumentException("Line " + lineNumber + " is outside " + file);
            }
            start = nl + 1;
        }
        if (start >= content.length() && lineNumber > 1) {
            throw new IllegalArgumentException("Line " + lineNumber + " is outside " + file);
        }
        int end = content.indexOf('\n', start);
        if (end < 0) {
            end = content.length();
        }
        if (end > start && content.charAt(end - 1) == '\r') {
            end--;
        }
        String current = content.substring(start, end);
        if (current.equals(newLine)) {
            logger.debug("Line {} of {} already up to date", lineNumber, file);
            return false;
        }
        Files.writeString(file, content.substring(0, start) + newLine + content.substring(end), StandardCharsets.UTF_8);
        logger.info("Patched line {} of {}", lineNumber, file);
        return true;
    }
}
