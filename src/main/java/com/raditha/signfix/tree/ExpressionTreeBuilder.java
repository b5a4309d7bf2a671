package com.raditha.signfix.tree;

import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.frontend.Cursors;
import com.raditha.signfix.functions.FunctionSignature;
import com.raditha.signfix.functions.FunctionTable;
import com.raditha.signfix.types.TypeSpelling;

import java.util.List;

/**
 * Builds the {@link ExprNode} tree of a located expression.
 * <p>
 * Parentheses and explicit casts are unwrapped; a node that was written inside parentheses
 * is marked {@link ExprNode#parenthesized()}. Anything that is not a binary operator becomes
 * a {@link Leaf}.
 */
public class ExpressionTreeBuilder {

    private final MacroTable macros;
    private final FunctionTable functions;

    public ExpressionTreeBuilder(MacroTable macros, FunctionTable functions) {
        this.macros = macros;
        this.functions = functions;
    }

    public ExprNode build(Cursor node) {
        Cursor current = node;
        boolean parenthesized = false;
        while (current.children().size() == 1) {
            if (current.kind() == CursorKind.PAREN_EXPR) {
                parenthesized = true;
            } else if (current.kind() != CursorKind.CSTYLE_CAST_EXPR) {
                break;
            }
            current = current.children().get(0);
        }
        if (current.kind().isBinary() && current.children().size() == 2) {
            return binary(current, parenthesized);
        }
        return leaf(current, parenthesized);
    }

    private Binary binary(Cursor node, boolean parenthesized) {
        Cursor left = node.children().get(0);
        Cursor right = node.children().get(1);
        String text = node.text();
        int base = node.extent().startOffset();
        String infix = text.substring(left.extent().endOffset() - base, right.extent().startOffset() - base);
        return new Binary(Cursors.operatorSpelling(node), build(left), build(right),
                node.typeSpelling(), node.canonicalTypeSpelling(), parenthesized, text, infix);
    }

    private Leaf leaf(Cursor node, boolean parenthesized) {
        String text = leafText(node);
        String type = node.typeSpelling();
        Classification classification = classify(node, text);
        if (classification == Classification.FUNCTION) {
            type = callType(node);
        }
        return new Leaf(text, type, node.canonicalTypeSpelling(), classification, precedence(node),
                parenthesized, false);
    }

    private static String leafText(Cursor node) {
        if (node.kind() == CursorKind.DECL_REF_EXPR && node.referenced().isPresent()) {
            return node.referenced().get().spelling();
        }
        String raw = node.text().trim();
        if (!raw.isEmpty()) {
            return raw;
        }
        return node.spelling();
    }

    private Classification classify(Cursor node, String text) {
        if (node.kind().isLiteral()) {
            return Classification.CONSTANT;
        }
        if (node.kind() == CursorKind.CALL_EXPR) {
            return Classification.FUNCTION;
        }
        if (macros != null && macros.isMacro(text)) {
            return Classification.MACRO;
        }
        if (node.kind() == CursorKind.DECL_REF_EXPR) {
            return Classification.VARIABLE;
        }
        return Classification.OTHER;
    }

    private String callType(Cursor call) {
        String type = call.typeSpelling();
        if (!type.isEmpty()) {
            return TypeSpelling.returnTypeOf(type);
        }
        if (functions != null) {
            return functions.lookup(call.spelling()).map(FunctionSignature::returnType).orElse("");
        }
        return "";
    }

    private static int precedence(Cursor node) {
        return switch (node.kind()) {
            case UNARY_OPERATOR, SIZEOF_EXPR, CSTYLE_CAST_EXPR -> isPostfix(node) ? Operators.ATOMIC : Operators.UNARY;
            case CONDITIONAL_OPERATOR -> Operators.CONDITIONAL;
            case UNEXPOSED_EXPR -> node.children().size() > 1 ? Operators.COMMA : Operators.ATOMIC;
            default -> Operators.ATOMIC;
        };
    }

    private static boolean isPostfix(Cursor node) {
        List<Cursor> children = node.children();
        return node.kind() == CursorKind.UNARY_OPERATOR && !children.isEmpty()
                && children.get(0).extent().startOffset() == node.extent().startOffset();
    }
}
