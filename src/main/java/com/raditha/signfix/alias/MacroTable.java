package com.raditha.signfix.alias;

import com.raditha.signfix.types.TypeSpelling;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Macro Table built directly from {@code #define} lines of the source text.
 * <p>
 * Object-like macro values are resolved recursively (macro names inside a value are replaced
 * by their own values). Function-like macros are kept with their parameter lists; their
 * bodies take no part in value resolution.
 */
public class MacroTable extends AliasTable {

    private static final Pattern DEFINE = Pattern.compile(
            "^\\s*#\\s*define\\s+([A-Za-z_][A-Za-z0-9_]*)(\\(([^)]*)\\))?(.*)$");

    private static final Pattern UNDEF = Pattern.compile("^\\s*#\\s*undef\\s+([A-Za-z_][A-Za-z0-9_]*)");

    private final Map<String, MacroDefinition> definitions = new LinkedHashMap<>();

    private MacroTable(String sourceFile) {
        super(sourceFile);
    }

    /**
     * Build the table from a source file.
     */
    public static MacroTable read(Path sourceFile) throws IOException {
        List<String> lines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
        return parse(sourceFile.toString(), lines);
    }

    /**
     * Build the table from source lines.
     */
    public static MacroTable parse(String sourceFile, List<String> lines) {
        MacroTable table = new MacroTable(sourceFile);
        for (LogicalLine logical : joinContinuations(lines)) {
            Matcher undef = UNDEF.matcher(logical.text());
            if (undef.find()) {
                continue;
            }
            Matcher m = DEFINE.matcher(logical.text());
            if (!m.matches()) {
                continue;
            }
            String name = m.group(1);
            String body = stripComments(m.group(4));
            if (m.group(2) != null) {
                List<String> params = new ArrayList<>();
                for (String p : m.group(3).split(",")) {
                    if (!p.isBlank()) {
                        params.add(p.trim());
                    }
                }
                table.definitions.put(name, new MacroDefinition(name, params, body, logical.firstLine()));
            } else {
                table.definitions.put(name, new MacroDefinition(name, null, body, logical.firstLine()));
                table.define(name, body);
            }
        }
        table.finish(lines);
        return table;
    }

    public Optional<MacroDefinition> definition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * True for any defined macro, object-like or function-like.
     */
    public boolean isMacro(String name) {
        return definitions.containsKey(name);
    }

    public boolean isFunctionLike(String name) {
        MacroDefinition def = definitions.get(name);
        return def != null && def.isFunctionLike();
    }

    /**
     * Integer value of an object-like macro whose resolved value is an integer literal,
     * possibly wrapped in parentheses. Null otherwise.
     */
    public Long numericValue(String name) {
        String value = resolvedValue(name);
        if (value == null) {
            return null;
        }
        String s = value.trim();
        while (s.startsWith("(") && s.endsWith(")") && s.length() > 2) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return TypeSpelling.literalValue(s);
    }

    static String stripComments(String text) {
        if (text == null) {
            return "";
        }
        String s = text.replaceAll("/\\*.*?\\*/", " ");
        int lineComment = s.indexOf("//");
        if (lineComment >= 0) {
            s = s.substring(0, lineComment);
        }
        return s.trim();
    }

    /**
     * Join backslash-continued lines, remembering where each logical line starts.
     */
    static List<LogicalLine> joinContinuations(List<String> lines) {
        List<LogicalLine> result = new ArrayList<>();
        StringBuilder current = null;
        int first = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (current == null) {
                current = new StringBuilder();
                first = i + 1;
            }
            String trimmed = line.stripTrailing();
            if (trimmed.endsWith("\\")) {
                current.append(trimmed, 0, trimmed.length() - 1).append(' ');
                continue;
            }
            current.append(line);
            result.add(new LogicalLine(current.toString(), first, i + 1));
            current = null;
        }
        if (current != null) {
            result.add(new LogicalLine(current.toString(), first, lines.size()));
        }
        return result;
    }

    /**
     * A source line after joining continuations.
     *
     * @param text      joined text
     * @param firstLine first physical line (1-indexed)
     * @param lastLine  last physical line (1-indexed)
     */
    record LogicalLine(String text, int firstLine, int lastLine) {
    }

    @Override
    public String toString() {
        return "MacroTable" + Arrays.toString(definitions.keySet().toArray());
    }
}
