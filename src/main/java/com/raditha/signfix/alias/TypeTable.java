package com.raditha.signfix.alias;

import com.raditha.signfix.types.TypeSpelling;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Type Table built from the {@code typedef} declarations of a source file.
 * <p>
 * Canonical primitive integer names are seeded as self-mapped entries, so a chain such as
 * {@code typedef MyU8 Byte; typedef unsigned char MyU8;} resolves to {@code unsigned char}
 * and stops there.
 */
public class TypeTable extends AliasTable {

    private static final Pattern SIMPLE_TYPEDEF = Pattern.compile(
            "^\\s*typedef\\s+(.*?[\\s*])([A-Za-z_]\\w*)\\s*;");

    private static final Pattern TAGGED_TYPEDEF = Pattern.compile(
            "^\\s*typedef\\s+(struct|enum|union)\\s+(\\w+)?\\s*(\\{.*\\})?\\s*([A-Za-z_]\\w*)\\s*;",
            Pattern.DOTALL);

    private static final Pattern FUNCTION_POINTER = Pattern.compile("\\(\\s*\\*\\s*\\w+\\s*\\)");

    private static final List<String> PRIMITIVES = List.of(
            "char", "signed char", "unsigned char",
            "short", "unsigned short",
            "int", "unsigned int", "unsigned",
            "long", "unsigned long",
            "long long", "unsigned long long",
            "_Bool", "bool");

    private TypeTable(String sourceFile) {
        super(sourceFile);
    }

    public static TypeTable read(Path sourceFile) throws IOException {
        List<String> lines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
        return parse(sourceFile.toString(), lines);
    }

    public static TypeTable parse(String sourceFile, List<String> lines) {
        TypeTable table = new TypeTable(sourceFile);
        for (String primitive : PRIMITIVES) {
            if (!primitive.contains(" ")) {
                table.define(primitive, primitive);
            }
        }
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (!line.trim().startsWith("typedef")) {
                i++;
                continue;
            }
            StringBuilder statement = new StringBuilder(line);
            int end = i;
            while (!balancedAndTerminated(statement) && end + 1 < lines.size()) {
                end++;
                statement.append('\n').append(lines.get(end));
            }
            table.register(MacroTable.stripComments(statement.toString().replace('\n', ' ')));
            i = end + 1;
        }
        table.finish(lines);
        return table;
    }

    private void register(String statement) {
        Matcher tagged = TAGGED_TYPEDEF.matcher(statement);
        if (tagged.find()) {
            String tag = tagged.group(2);
            String base = tag != null ? tagged.group(1) + " " + tag : tagged.group(1);
            define(tagged.group(4), base);
            return;
        }
        if (FUNCTION_POINTER.matcher(statement).find()) {
            return;
        }
        Matcher simple = SIMPLE_TYPEDEF.matcher(statement);
        if (simple.find()) {
            define(simple.group(2), simple.group(1));
        }
    }

    private static boolean balancedAndTerminated(CharSequence text) {
        int depth = 0;
        for (int k = 0; k < text.length(); k++) {
            char c = text.charAt(k);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth <= 0 && text.toString().trim().endsWith(";");
    }

    @Override
    protected String normalizeValue(String value) {
        return TypeSpelling.normalize(value.replaceAll("\\s*\\*", " *").replace("* *", "**"));
    }

    /**
     * Canonical spelling of a type, with qualifiers stripped.
     */
    public String canonical(String spelling) {
        return TypeSpelling.stripQualifiers(resolveSpelling(spelling).value());
    }
}
