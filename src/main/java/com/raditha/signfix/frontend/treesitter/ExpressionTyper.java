package com.raditha.signfix.frontend.treesitter;

import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.types.TypeSpelling;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes type spellings for declarations and expressions, bottom-up.
 * <p>
 * Declared types keep their typedef names; computed arithmetic types are spelled
 * canonically. The usual arithmetic conversions assume LP64 widths.
 */
final class ExpressionTyper {

    private static final Pattern IDENTIFIER = Pattern.compile("\\b([A-Za-z_]\\w*)\\b");
    private static final int MAX_TYPEDEF_DEPTH = 50;

    private static final Set<String> COMPARISONS = Set.of("<", ">", "<=", ">=", "==", "!=", "&&", "||");

    private final DeclarationIndex index;

    ExpressionTyper(DeclarationIndex index) {
        this.index = index;
    }

    void type(TreeSitterCursor node) {
        for (int i = 0; i < node.children().size(); i++) {
            type(node.child(i));
        }
        if (node.kind().isDeclaration()) {
            node.setType(node.typeSpelling(), canonical(node.typeSpelling()));
        } else if (node.kind().isExpression()) {
            String type = expressionType(node);
            node.setType(type, canonical(type));
        }
    }

    private String expressionType(TreeSitterCursor node) {
        List<Cursor> children = node.children();
        return switch (node.kind()) {
            case INTEGER_LITERAL -> TypeSpelling.literalType(node.spelling());
            case FLOATING_LITERAL -> floatingType(node.spelling());
            case CHARACTER_LITERAL -> "int";
            case STRING_LITERAL -> "char *";
            case DECL_REF_EXPR, CALL_EXPR -> referenceType(node);
            case PAREN_EXPR -> children.isEmpty() ? "" : children.get(0).typeSpelling();
            case CSTYLE_CAST_EXPR -> node.typeSpelling();
            case SIZEOF_EXPR -> "unsigned long";
            case MEMBER_REF_EXPR -> memberType(node);
            case ARRAY_SUBSCRIPT_EXPR -> children.isEmpty() ? "" : TypeSpelling.elementType(children.get(0).typeSpelling());
            case UNARY_OPERATOR -> unaryType(node);
            case BINARY_OPERATOR, COMPOUND_ASSIGNMENT_OPERATOR -> binaryType(node);
            case CONDITIONAL_OPERATOR -> children.size() < 3 ? "" : conditionalType(children.get(1), children.get(2));
            case UNEXPOSED_EXPR -> !node.typeSpelling().isEmpty() ? node.typeSpelling()
                    : children.size() == 1 ? children.get(0).typeSpelling() : "";
            default -> "";
        };
    }

    private static String floatingType(String literal) {
        String s = literal.toLowerCase();
        if (s.endsWith("f") && !s.startsWith("0x")) {
            return "float";
        }
        return s.endsWith("l") ? "long double" : "double";
    }

    private String referenceType(TreeSitterCursor node) {
        return node.referenced()
                .map(Cursor::typeSpelling)
                .map(t -> node.kind() == CursorKind.CALL_EXPR ? TypeSpelling.returnTypeOf(t) : t)
                .orElse("");
    }

    private String memberType(TreeSitterCursor node) {
        if (node.children().isEmpty()) {
            return "";
        }
        Cursor base = node.children().get(0);
        boolean arrow = node.text().substring(base.text().length()).trim().startsWith("->");
        for (String spelling : List.of(base.typeSpelling(), base.canonicalTypeSpelling())) {
            String record = TypeSpelling.stripQualifiers(arrow ? TypeSpelling.elementType(spelling) : spelling);
            String type = index.fields(record).get(node.spelling());
            if (type != null) {
                return type;
            }
        }
        return "";
    }

    private String unaryType(TreeSitterCursor node) {
        if (node.children().isEmpty()) {
            return "";
        }
        Cursor operand = node.children().get(0);
        return switch (node.spelling()) {
            case "!" -> "int";
            case "*" -> TypeSpelling.elementType(operand.typeSpelling());
            case "&" -> operand.typeSpelling().endsWith("*") ? operand.typeSpelling() + "*" : operand.typeSpelling() + " *";
            case "-", "+", "~" -> promote(operand.canonicalTypeSpelling());
            default -> operand.typeSpelling();
        };
    }

    private String binaryType(TreeSitterCursor node) {
        if (node.children().size() != 2) {
            return "";
        }
        Cursor left = node.children().get(0);
        Cursor right = node.children().get(1);
        String op = node.spelling();
        if (node.kind() == CursorKind.COMPOUND_ASSIGNMENT_OPERATOR || op.equals("=")) {
            return left.typeSpelling();
        }
        if (COMPARISONS.contains(op)) {
            return "int";
        }
        String l = left.canonicalTypeSpelling();
        String r = right.canonicalTypeSpelling();
        if (op.equals("<<") || op.equals(">>")) {
            return promote(l);
        }
        boolean leftPointer = isPointer(l);
        boolean rightPointer = isPointer(r);
        if (leftPointer && rightPointer) {
            return op.equals("-") ? "long" : "";
        }
        if (leftPointer) {
            return decay(left.typeSpelling());
        }
        if (rightPointer) {
            return decay(right.typeSpelling());
        }
        return arithmetic(l, r);
    }

    private String conditionalType(Cursor a, Cursor b) {
        if (TypeSpelling.normalize(a.typeSpelling()).equals(TypeSpelling.normalize(b.typeSpelling()))) {
            return a.typeSpelling();
        }
        String result = arithmetic(a.canonicalTypeSpelling(), b.canonicalTypeSpelling());
        return result.isEmpty() ? a.typeSpelling() : result;
    }

    private static boolean isPointer(String spelling) {
        return spelling.endsWith("*") || spelling.endsWith("]");
    }

    private static String decay(String spelling) {
        if (spelling.endsWith("]")) {
            String element = TypeSpelling.elementType(spelling);
            return element.endsWith("*") ? element + "*" : element + " *";
        }
        return spelling;
    }

    /**
     * Usual arithmetic conversions on canonical spellings.
     */
    static String arithmetic(String left, String right) {
        String l = TypeSpelling.stripQualifiers(left);
        String r = TypeSpelling.stripQualifiers(right);
        boolean leftInt = TypeSpelling.isInteger(l);
        boolean rightInt = TypeSpelling.isInteger(r);
        if (!leftInt || !rightInt) {
            if (l.contains("double") || r.contains("double")) {
                return l.equals("long double") || r.equals("long double") ? "long double" : "double";
            }
            if (l.equals("float") || r.equals("float")) {
                return "float";
            }
            return "";
        }
        String pl = promote(l);
        String pr = promote(r);
        if (pl.equals(pr)) {
            return pl;
        }
        boolean ul = TypeSpelling.isUnsigned(pl);
        boolean ur = TypeSpelling.isUnsigned(pr);
        int rl = TypeSpelling.rank(pl);
        int rr = TypeSpelling.rank(pr);
        if (ul == ur) {
            return rl >= rr ? pl : pr;
        }
        String unsigned = ul ? pl : pr;
        String signed = ul ? pr : pl;
        return TypeSpelling.rank(unsigned) >= TypeSpelling.rank(signed) ? unsigned : signed;
    }

    /**
     * Integer promotion: anything ranked below {@code int} becomes {@code int}.
     */
    static String promote(String spelling) {
        String s = TypeSpelling.canonicalize(TypeSpelling.stripQualifiers(spelling));
        if (TypeSpelling.isInteger(s) && TypeSpelling.rank(s) < 3) {
            return "int";
        }
        return s;
    }

    /**
     * Resolve typedef names declared in the file, then builtin aliases.
     */
    String canonical(String spelling) {
        if (spelling == null || spelling.isEmpty()) {
            return "";
        }
        Map<String, TreeSitterCursor> typedefs = index.typedefs();
        String current = spelling;
        Set<String> expanded = new HashSet<>();
        for (int depth = 0; depth < MAX_TYPEDEF_DEPTH; depth++) {
            Matcher m = IDENTIFIER.matcher(current);
            StringBuilder out = new StringBuilder();
            boolean changed = false;
            while (m.find()) {
                TreeSitterCursor td = typedefs.get(m.group(1));
                String replacement = m.group(1);
                if (td != null && !td.typeSpelling().isEmpty() && expanded.add(m.group(1))) {
                    replacement = td.typeSpelling();
                    changed = true;
                }
                m.appendReplacement(out, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(out);
            current = out.toString();
            if (!changed) {
                break;
            }
        }
        return TypeSpelling.canonicalize(current);
    }
}
