package com.raditha.signfix.preprocess;

import com.raditha.signfix.model.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link LineMap} from preprocessor line markers.
 * <p>
 * Recognizes {@code # <num> "<file>" [flags]} and {@code #line <num> "<file>"}. A marker line
 * maps to (marker file, marker number); the lines after it map to consecutive original lines;
 * lines before the first marker map to themselves.
 */
public class LineMapper {

    private static final Logger logger = LoggerFactory.getLogger(LineMapper.class);

    static final Pattern LINE_MARKER = Pattern.compile("^\\s*#\\s*(?:line\\s+)?(\\d+)\\s+\"([^\"]+)\"");

    private LineMapper() {
    }

    /**
     * Map the lines of a preprocessed file. An unreadable file gives an empty map.
     */
    public static LineMap read(Path preprocessedFile) {
        try {
            String text = Files.readString(preprocessedFile, StandardCharsets.UTF_8);
            return build(preprocessedFile.toString(), text);
        } catch (IOException e) {
            logger.warn("Cannot read preprocessed file {}: {}", preprocessedFile, e.getMessage());
            return LineMap.empty(preprocessedFile.toString());
        }
    }

    /**
     * Map the lines of preprocessed text in a single pass.
     *
     * @param preprocessedFile name used for lines before the first marker
     * @param text             preprocessed text
     */
    public static LineMap build(String preprocessedFile, String text) {
        Map<Integer, SourcePosition> mapping = new HashMap<>();
        String[] lines = text.split("\n", -1);
        int markerLine = -1;
        int markerNumber = 0;
        String markerFile = preprocessedFile;

        for (int i = 0; i < lines.length; i++) {
            int preLine = i + 1;
            if (i == lines.length - 1 && lines[i].isEmpty()) {
                break;
            }
            Matcher m = LINE_MARKER.matcher(lines[i]);
            if (m.find()) {
                markerLine = preLine;
                markerNumber = Integer.parseInt(m.group(1));
                markerFile = m.group(2);
                mapping.put(preLine, new SourcePosition(markerFile, markerNumber, 0));
            } else if (markerLine > 0) {
                mapping.put(preLine, new SourcePosition(markerFile, markerNumber + (preLine - markerLine - 1), 0));
            } else {
                mapping.put(preLine, new SourcePosition(preprocessedFile, preLine, 0));
            }
        }
        logger.debug("Built line map for {} with {} entries", preprocessedFile, mapping.size());
        return new LineMap(preprocessedFile, mapping);
    }

    /**
     * True when the line is a line-marker directive.
     */
    public static boolean isMarker(String line) {
        return LINE_MARKER.matcher(line).find();
    }
}
