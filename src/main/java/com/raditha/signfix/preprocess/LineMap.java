package com.raditha.signfix.preprocess;

import com.raditha.signfix.model.SourcePosition;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Preprocessed line number to original (file, line) mapping.
 * <p>
 * An empty map means that no mapping is available; every query then falls back to the
 * identity mapping on the preprocessed file itself.
 */
public class LineMap {

    private final String preprocessedFile;
    private final TreeMap<Integer, SourcePosition> entries;

    LineMap(String preprocessedFile, Map<Integer, SourcePosition> entries) {
        this.preprocessedFile = preprocessedFile;
        this.entries = new TreeMap<>(entries);
    }

    public static LineMap empty(String preprocessedFile) {
        return new LineMap(preprocessedFile, Map.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Original position of a preprocessed line (column 0).
     */
    public SourcePosition toOriginal(int preprocessedLine) {
        SourcePosition mapped = entries.get(preprocessedLine);
        if (mapped == null) {
            return new SourcePosition(preprocessedFile, preprocessedLine, 0);
        }
        return mapped;
    }

    /**
     * Preprocessed lines that map to the given original line, in ascending order.
     * Files match when their names are equal or resolve to the same normalized absolute path.
     */
    public List<Integer> toPreprocessed(String originalFile, int originalLine) {
        if (entries.isEmpty()) {
            return List.of(originalLine);
        }
        List<Integer> lines = new ArrayList<>();
        for (Map.Entry<Integer, SourcePosition> e : entries.entrySet()) {
            SourcePosition pos = e.getValue();
            if (pos.line() == originalLine && sameFile(pos.file(), originalFile)) {
                lines.add(e.getKey());
            }
        }
        return Collections.unmodifiableList(lines);
    }

    /**
     * True when the preprocessed line belongs to the given original file.
     */
    public boolean belongsTo(int preprocessedLine, String originalFile) {
        return sameFile(toOriginal(preprocessedLine).file(), originalFile);
    }

    static boolean sameFile(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }
        try {
            Path pa = Path.of(a).toAbsolutePath().normalize();
            Path pb = Path.of(b).toAbsolutePath().normalize();
            return pa.equals(pb);
        } catch (RuntimeException e) {
            return false;
        }
    }
}
