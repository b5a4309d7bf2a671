package com.raditha.signfix.frontend.treesitter;

import com.raditha.signfix.frontend.CursorToken;
import com.raditha.signfix.frontend.SourceExtent;
import com.raditha.signfix.lexer.CLexer;
import com.raditha.signfix.lexer.LexToken;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The text handed to the parser, with conversions from UTF-8 byte offsets to character
 * offsets and from character offsets to line and column.
 */
final class SourceText {

    private final String text;
    private final int[] lineStarts;
    private final int[] byteToChar;

    SourceText(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.byteToChar = buildByteMap(text);
    }

    private static int[] buildByteMap(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (bytes.length == text.length()) {
            return null;
        }
        int[] map = new int[bytes.length + 1];
        int b = 0;
        for (int c = 0; c < text.length(); c++) {
            int cp = text.codePointAt(c);
            int width = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            for (int k = 0; k < width; k++) {
                map[b + k] = c;
            }
            b += width;
            if (Character.isSupplementaryCodePoint(cp)) {
                c++;
            }
        }
        map[bytes.length] = text.length();
        return map;
    }

    String text() {
        return text;
    }

    int charOffset(int byteOffset) {
        if (byteToChar == null) {
            return Math.min(byteOffset, text.length());
        }
        return byteToChar[Math.min(byteOffset, byteToChar.length - 1)];
    }

    String slice(int start, int end) {
        return text.substring(start, end);
    }

    /**
     * 0-based index of the line containing the offset.
     */
    int lineIndex(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    SourceExtent extent(int start, int end) {
        int startLine = lineIndex(start);
        int endLine = lineIndex(Math.max(start, end - 1));
        int endColumn = end - lineStarts[endLine] + 1;
        return new SourceExtent(startLine + 1, start - lineStarts[startLine] + 1, endLine + 1, endColumn, start, end);
    }

    /**
     * Tokens between two offsets, lexed line by line so a line comment ends at its newline.
     */
    List<CursorToken> tokens(int start, int end) {
        List<CursorToken> tokens = new ArrayList<>();
        int line = lineIndex(start);
        int pos = start;
        while (pos < end) {
            int lineEnd = line + 1 < lineStarts.length ? Math.min(lineStarts[line + 1] - 1, end) : end;
            for (LexToken t : CLexer.tokenize(text.substring(pos, lineEnd))) {
                int tokenStart = pos + t.start();
                tokens.add(new CursorToken(t.kind(), t.text(), line + 1, tokenStart - lineStarts[line] + 1,
                        tokenStart, pos + t.end()));
            }
            line++;
            if (line >= lineStarts.length) {
                break;
            }
            pos = lineStarts[line];
        }
        return tokens;
    }
}
