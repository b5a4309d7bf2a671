package com.raditha.signfix.types;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small parser for C type spellings and integer literal tokens.
 * <p>
 * Every signedness decision in the tool goes through this class: qualifier
 * stripping, the integer-family test, the unsigned test and literal suffix
 * handling. Spellings are compared after whitespace normalization, so
 * {@code "unsigned   int"} and {@code "unsigned int"} are the same type.
 */
public final class TypeSpelling {

    private static final Pattern QUALIFIERS = Pattern.compile(
            "\\b(const|volatile|restrict|register|static|extern|inline|_Atomic)\\b");

    private static final Pattern INTEGER_LITERAL = Pattern.compile(
            "(?<num>0[xX][0-9A-Fa-f]+|0[bB][01]+|0[0-7]*|[1-9][0-9]*)(?<suf>[uUlL]{0,3})");

    private static final Pattern FIXED_WIDTH = Pattern.compile("u?int(_least|_fast)?(8|16|32|64)_t");

    private static final Set<String> INTEGER_TYPES = Set.of(
            "bool", "_Bool",
            "char", "signed char", "unsigned char",
            "short", "short int", "signed short", "signed short int",
            "unsigned short", "unsigned short int", "short unsigned int",
            "int", "signed", "signed int", "unsigned", "unsigned int",
            "long", "long int", "signed long", "signed long int",
            "unsigned long", "unsigned long int", "long unsigned int",
            "long long", "long long int", "signed long long", "signed long long int",
            "unsigned long long", "unsigned long long int", "long long unsigned int",
            "size_t", "ssize_t", "ptrdiff_t", "intptr_t", "uintptr_t", "intmax_t", "uintmax_t");

    private static final Set<String> UNSIGNED_ALIASES = Set.of(
            "size_t", "uintptr_t", "uintmax_t", "unsigned char");

    private static final Pattern LEADING_QUALIFIERS = Pattern.compile(
            "^((?:(?:const|volatile|restrict|_Atomic)\\s+)*)(.*)$");

    private static final Map<String, String> CANONICAL = Map.ofEntries(
            Map.entry("uint8_t", "unsigned char"),
            Map.entry("uint16_t", "unsigned short"),
            Map.entry("uint32_t", "unsigned int"),
            Map.entry("uint64_t", "unsigned long"),
            Map.entry("int8_t", "signed char"),
            Map.entry("int16_t", "short"),
            Map.entry("int32_t", "int"),
            Map.entry("int64_t", "long"),
            Map.entry("size_t", "unsigned long"),
            Map.entry("ssize_t", "long"),
            Map.entry("ptrdiff_t", "long"),
            Map.entry("intptr_t", "long"),
            Map.entry("uintptr_t", "unsigned long"),
            Map.entry("intmax_t", "long"),
            Map.entry("uintmax_t", "unsigned long"),
            Map.entry("unsigned", "unsigned int"),
            Map.entry("signed", "int"),
            Map.entry("signed int", "int"),
            Map.entry("short int", "short"),
            Map.entry("signed short", "short"),
            Map.entry("signed short int", "short"),
            Map.entry("unsigned short int", "unsigned short"),
            Map.entry("short unsigned int", "unsigned short"),
            Map.entry("long int", "long"),
            Map.entry("signed long", "long"),
            Map.entry("signed long int", "long"),
            Map.entry("unsigned long int", "unsigned long"),
            Map.entry("long unsigned int", "unsigned long"),
            Map.entry("long long int", "long long"),
            Map.entry("signed long long", "long long"),
            Map.entry("signed long long int", "long long"),
            Map.entry("unsigned long long int", "unsigned long long"),
            Map.entry("long long unsigned int", "unsigned long long"),
            Map.entry("bool", "_Bool"));

    private TypeSpelling() {
    }

    /**
     * Collapse whitespace runs to single spaces and trim.
     */
    public static String normalize(String spelling) {
        if (spelling == null) {
            return "";
        }
        return spelling.trim().replaceAll("\\s+", " ");
    }

    /**
     * Canonical spelling of a builtin integer type: {@code "unsigned"} becomes
     * {@code "unsigned int"}, {@code "uint8_t"} becomes {@code "unsigned char"} (LP64 widths).
     * Leading cv-qualifiers are kept; other spellings are returned normalized.
     */
    public static String canonicalize(String spelling) {
        Matcher m = LEADING_QUALIFIERS.matcher(normalize(spelling));
        if (!m.matches()) {
            return normalize(spelling);
        }
        String core = m.group(2);
        return m.group(1) + CANONICAL.getOrDefault(core, core);
    }

    /**
     * Remove storage-class specifiers and cv-qualifiers.
     * {@code "const volatile uint8_t"} becomes {@code "uint8_t"}.
     */
    public static String stripQualifiers(String spelling) {
        if (spelling == null) {
            return "";
        }
        return normalize(QUALIFIERS.matcher(spelling).replaceAll(" "));
    }

    /**
     * True when the spelling (after qualifier stripping) names an integer-family type.
     * Pointers, arrays, floating types, structs and enums are not integers here.
     */
    public static boolean isInteger(String spelling) {
        String s = stripQualifiers(spelling);
        if (s.isEmpty() || s.contains("*") || s.contains("[") || s.contains("(")) {
            return false;
        }
        if (INTEGER_TYPES.contains(s)) {
            return true;
        }
        if (FIXED_WIDTH.matcher(s).matches()) {
            return true;
        }
        return s.endsWith("_t") && s.contains("int");
    }

    /**
     * Textual unsignedness: an {@code unsigned} prefix, the {@code uintN_t} family or one of
     * the known unsigned aliases. Plain {@code char} is implementation defined and counts as signed.
     */
    public static boolean isUnsigned(String spelling) {
        String s = stripQualifiers(spelling);
        if (s.startsWith("unsigned") || s.endsWith("unsigned int") || s.equals("unsigned")) {
            return true;
        }
        if (s.startsWith("uint") && s.endsWith("_t")) {
            return true;
        }
        return UNSIGNED_ALIASES.contains(s);
    }

    /**
     * Integer conversion rank used by the usual arithmetic conversions.
     * Unknown integer spellings get the rank of {@code int}.
     */
    public static int rank(String spelling) {
        String s = stripQualifiers(spelling);
        if (s.equals("bool") || s.equals("_Bool")) {
            return 0;
        }
        if (s.contains("char") || s.matches("u?int(_least|_fast)?8_t")) {
            return 1;
        }
        if (s.contains("short") || s.matches("u?int(_least|_fast)?16_t")) {
            return 2;
        }
        if (s.contains("long long") || s.matches("u?int(_least|_fast)?64_t") || s.contains("intmax")) {
            return 5;
        }
        if (s.contains("long") || s.equals("size_t") || s.equals("ssize_t")
                || s.equals("ptrdiff_t") || s.contains("intptr")) {
            return 4;
        }
        return 3;
    }

    /**
     * True for a bare integer literal token such as {@code 10}, {@code 0x1F}, {@code 5U} or
     * {@code 7uLL}. Signs, casts and floating literals do not count.
     */
    public static boolean isIntegerLiteral(String text) {
        if (text == null) {
            return false;
        }
        return INTEGER_LITERAL.matcher(text.trim()).matches();
    }

    /**
     * Type of an integer literal derived from its suffix.
     */
    public static String literalType(String text) {
        Matcher m = INTEGER_LITERAL.matcher(text == null ? "" : text.trim());
        if (!m.matches()) {
            return "int";
        }
        String suffix = m.group("suf").toUpperCase();
        boolean unsigned = suffix.contains("U");
        int longs = suffix.length() - suffix.replace("L", "").length();
        String base = switch (longs) {
            case 0 -> "int";
            case 1 -> "long";
            default -> "long long";
        };
        return unsigned ? "unsigned " + base : base;
    }

    /**
     * Numeric value of an integer literal, or null when the text is not one (or overflows).
     */
    public static Long literalValue(String text) {
        Matcher m = INTEGER_LITERAL.matcher(text == null ? "" : text.trim());
        if (!m.matches()) {
            return null;
        }
        String num = m.group("num");
        try {
            if (num.startsWith("0x") || num.startsWith("0X")) {
                return Long.parseUnsignedLong(num.substring(2), 16);
            }
            if (num.startsWith("0b") || num.startsWith("0B")) {
                return Long.parseUnsignedLong(num.substring(2), 2);
            }
            if (num.length() > 1 && num.startsWith("0")) {
                return Long.parseUnsignedLong(num.substring(1), 8);
            }
            return Long.parseUnsignedLong(num);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Add or remove the {@code U} suffix of an integer literal. {@code L}/{@code LL} are kept.
     * Text that is not an integer literal is returned trimmed and otherwise unchanged.
     */
    public static String withUnsignedSuffix(String text, boolean makeUnsigned) {
        String s = text == null ? "" : text.trim();
        Matcher m = INTEGER_LITERAL.matcher(s);
        if (!m.matches()) {
            return s;
        }
        String num = m.group("num");
        String suffix = m.group("suf");
        String longPart = suffix.replaceAll("[uU]", "");
        if (makeUnsigned) {
            if (suffix.indexOf('u') >= 0 || suffix.indexOf('U') >= 0) {
                return num + suffix.replace('u', 'U');
            }
            return num + "U" + longPart;
        }
        return num + longPart;
    }

    /**
     * Return-type part of a function type spelling: {@code "int (int, char *)"} gives {@code "int"}.
     * Other spellings are returned normalized.
     */
    public static String returnTypeOf(String functionSpelling) {
        String s = normalize(functionSpelling);
        int paren = s.indexOf('(');
        if (paren > 0 && s.endsWith(")")) {
            return s.substring(0, paren).trim();
        }
        return s;
    }

    /**
     * Type obtained by one level of dereference or subscript: strips a trailing {@code *}
     * or {@code [N]}. Returns the input normalized when it is neither.
     */
    public static String elementType(String spelling) {
        String s = normalize(spelling);
        if (s.endsWith("]")) {
            int open = s.lastIndexOf('[');
            if (open > 0) {
                return s.substring(0, open).trim();
            }
        }
        if (s.endsWith("*")) {
            return s.substring(0, s.length() - 1).trim();
        }
        return s;
    }
}
