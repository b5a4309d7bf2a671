package com.raditha.signfix.preprocess;

import java.util.Arrays;
import java.util.List;

/**
 * Output of a {@link Preprocessor}: the expanded text of one original file together with
 * the line map derived from its line markers.
 *
 * @param originalFile path of the file that was preprocessed
 * @param text         preprocessed text including line markers
 * @param lineMap      preprocessed line to original line mapping
 */
public record PreprocessedSource(String originalFile, String text, LineMap lineMap) {

    public static PreprocessedSource of(String originalFile, String text) {
        return new PreprocessedSource(originalFile, text, LineMapper.build(originalFile, text));
    }

    public List<String> lines() {
        return Arrays.asList(text.split("\n", -1));
    }

    /**
     * Text of a preprocessed line (1-indexed), or an empty string when out of range.
     */
    public String line(int preprocessedLine) {
        List<String> lines = lines();
        if (preprocessedLine < 1 || preprocessedLine > lines.size()) {
            return "";
        }
        return lines.get(preprocessedLine - 1);
    }
}
