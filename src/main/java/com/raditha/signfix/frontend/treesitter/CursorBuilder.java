package com.raditha.signfix.frontend.treesitter;

import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.types.TypeSpelling;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts a tree-sitter-c syntax tree into {@link TreeSitterCursor}s.
 * <p>
 * Declarations at file scope are flattened into the translation unit; inside blocks they
 * become a {@link CursorKind#DECL_STMT} holding one {@link CursorKind#VAR_DECL} per declarator.
 * The parentheses that belong to {@code if}, {@code while}, {@code do} and {@code switch}
 * syntax are not expression cursors.
 */
final class CursorBuilder {

    private static final Set<String> SKIPPED = Set.of(
            "comment", "primitive_type", "sized_type_specifier", "type_identifier", "type_qualifier",
            "storage_class_specifier", "type_descriptor", "field_identifier", "statement_identifier",
            "preproc_call", "preproc_def", "preproc_function_def", "preproc_include", "attribute_specifier");

    private static final Set<String> RECORD_SPECIFIERS = Set.of("struct_specifier", "union_specifier", "enum_specifier");

    private final SourceText source;

    CursorBuilder(SourceText source) {
        this.source = source;
    }

    TreeSitterCursor build(TSNode root) {
        TreeSitterCursor unit = cursor(CursorKind.TRANSLATION_UNIT, root, "");
        for (TSNode child : namedChildren(root)) {
            addTopLevel(unit, child);
        }
        return unit;
    }

    private void addTopLevel(TreeSitterCursor unit, TSNode node) {
        switch (node.getType()) {
            case "function_definition" -> unit.addChild(functionDefinition(node));
            case "declaration" -> declarators(node, unit);
            case "type_definition" -> typedefs(node, unit);
            case "struct_specifier", "union_specifier", "enum_specifier" -> unit.addChild(record(node));
            case "preproc_if", "preproc_ifdef", "preproc_else", "preproc_elif", "linkage_specification",
                    "declaration_list" -> {
                for (TSNode child : namedChildren(node)) {
                    addTopLevel(unit, child);
                }
            }
            default -> unit.addChild(convert(node));
        }
    }

    // declarations

    private TreeSitterCursor functionDefinition(TSNode node) {
        String base = baseType(node);
        TSNode declarator = field(node, "declarator");
        TreeSitterCursor fn = cursor(CursorKind.FUNCTION_DECL, node, "");
        if (declarator != null) {
            Declarator d = declarator(declarator, base);
            fn.setSpelling(d.name());
            fn.setType(d.type(), "");
            addParameters(fn, declarator);
        }
        TSNode body = field(node, "body");
        if (body != null) {
            fn.addChild(convert(body));
        }
        return fn;
    }

    private void addParameters(TreeSitterCursor owner, TSNode declarator) {
        TSNode fnDeclarator = findFunctionDeclarator(declarator);
        if (fnDeclarator == null) {
            return;
        }
        TSNode params = field(fnDeclarator, "parameters");
        if (params == null) {
            return;
        }
        for (TSNode param : namedChildren(params)) {
            if (!param.getType().equals("parameter_declaration")) {
                continue;
            }
            String base = baseType(param);
            TSNode d = field(param, "declarator");
            TreeSitterCursor parm = cursor(CursorKind.PARM_DECL, param, "");
            if (d != null) {
                Declarator decl = declarator(d, base);
                parm.setSpelling(decl.name());
                parm.setType(decl.type(), "");
            } else {
                parm.setType(base, "");
            }
            owner.addChild(parm);
        }
    }

    /**
     * True for {@code f(int)} and {@code *f(int)}, false for a function pointer {@code (*f)(int)}.
     */
    private static boolean declaresFunction(TSNode declarator) {
        TSNode current = declarator;
        while (current != null && current.getType().equals("pointer_declarator")) {
            current = field(current, "declarator");
        }
        if (current == null || !current.getType().equals("function_declarator")) {
            return false;
        }
        TSNode name = field(current, "declarator");
        return name != null && name.getType().equals("identifier");
    }

    private static TSNode findFunctionDeclarator(TSNode node) {
        TSNode current = node;
        while (current != null) {
            if (current.getType().equals("function_declarator")) {
                return current;
            }
            current = field(current, "declarator");
        }
        return null;
    }

    /**
     * Add the cursors of a declaration to {@code owner}: nested record definitions first, then
     * a variable or function declaration per declarator.
     */
    private void declarators(TSNode node, TreeSitterCursor owner) {
        TSNode type = field(node, "type");
        if (type != null && field(type, "body") != null) {
            owner.addChild(record(type));
        }
        String base = baseType(node);
        for (TSNode d : fieldChildren(node, "declarator")) {
            TSNode inner = d.getType().equals("init_declarator") ? field(d, "declarator") : d;
            Declarator decl = declarator(d, base);
            boolean function = inner != null && declaresFunction(inner);
            TreeSitterCursor var = cursor(function ? CursorKind.FUNCTION_DECL : CursorKind.VAR_DECL, d, decl.name());
            var.setType(decl.type(), "");
            if (function) {
                addParameters(var, inner);
            }
            TSNode value = d.getType().equals("init_declarator") ? field(d, "value") : null;
            if (value != null) {
                var.addChild(convert(value));
            }
            owner.addChild(var);
        }
    }

    private void typedefs(TSNode node, TreeSitterCursor owner) {
        String base = baseType(node);
        TreeSitterCursor nested = null;
        TSNode type = field(node, "type");
        if (type != null && field(type, "body") != null) {
            nested = record(type);
        }
        for (TSNode d : fieldChildren(node, "declarator")) {
            Declarator decl = declarator(d, base);
            TreeSitterCursor td = cursor(CursorKind.TYPEDEF_DECL, node, decl.name());
            td.setType(decl.type(), "");
            if (nested != null) {
                td.addChild(nested);
                nested = null;
            }
            owner.addChild(td);
        }
    }

    private TreeSitterCursor record(TSNode node) {
        boolean isEnum = node.getType().equals("enum_specifier");
        TreeSitterCursor rec = cursor(isEnum ? CursorKind.ENUM_DECL : CursorKind.STRUCT_DECL, node, tagName(node));
        rec.setType(recordType(node), "");
        TSNode body = field(node, "body");
        if (body == null) {
            return rec;
        }
        for (TSNode member : namedChildren(body)) {
            if (isEnum && member.getType().equals("enumerator")) {
                TreeSitterCursor constant = cursor(CursorKind.ENUM_CONSTANT_DECL, member, text(field(member, "name")));
                constant.setType("int", "int");
                TSNode value = field(member, "value");
                if (value != null) {
                    constant.addChild(convert(value));
                }
                rec.addChild(constant);
            } else if (member.getType().equals("field_declaration")) {
                String base = baseType(member);
                for (TSNode d : fieldChildren(member, "declarator")) {
                    Declarator decl = declarator(d, base);
                    TreeSitterCursor f = cursor(CursorKind.FIELD_DECL, d, decl.name());
                    f.setType(decl.type(), "");
                    rec.addChild(f);
                }
            }
        }
        return rec;
    }

    private String tagName(TSNode record) {
        TSNode name = field(record, "name");
        return name == null ? "" : text(name);
    }

    private String recordType(TSNode record) {
        String keyword = switch (record.getType()) {
            case "union_specifier" -> "union";
            case "enum_specifier" -> "enum";
            default -> "struct";
        };
        String tag = tagName(record);
        return keyword + " " + (tag.isEmpty() ? "(anonymous at " + source.extent(start(record), end(record)).startLine()
                + ")" : tag);
    }

    /**
     * Type specifier of a declaration with its cv-qualifiers, for example {@code "const uint8_t"}.
     */
    private String baseType(TSNode declaration) {
        TSNode type = field(declaration, "type");
        String spelled;
        if (type == null) {
            spelled = "int";
        } else if (RECORD_SPECIFIERS.contains(type.getType())) {
            spelled = recordType(type);
        } else {
            spelled = TypeSpelling.normalize(text(type));
        }
        StringBuilder qualifiers = new StringBuilder();
        for (TSNode child : namedChildren(declaration)) {
            if (child.getType().equals("type_qualifier")) {
                qualifiers.append(text(child)).append(' ');
            }
        }
        return qualifiers + spelled;
    }

    private Declarator declarator(TSNode node, String base) {
        switch (node.getType()) {
            case "init_declarator", "parenthesized_declarator", "parenthesized_type_declarator",
                    "attributed_declarator" -> {
                TSNode inner = field(node, "declarator");
                if (inner == null) {
                    List<TSNode> named = namedChildren(node);
                    inner = named.isEmpty() ? null : named.get(0);
                }
                return inner == null ? new Declarator("", base) : declarator(inner, base);
            }
            case "pointer_declarator", "pointer_type_declarator", "abstract_pointer_declarator" -> {
                String pointer = base.endsWith("*") ? base + "*" : base + " *";
                TSNode inner = field(node, "declarator");
                return inner == null ? new Declarator("", pointer) : declarator(inner, pointer);
            }
            case "array_declarator", "array_type_declarator" -> {
                TSNode size = field(node, "size");
                String array = base + " [" + (size == null ? "" : text(size)) + "]";
                TSNode inner = field(node, "declarator");
                return inner == null ? new Declarator("", array) : declarator(inner, array);
            }
            case "function_declarator", "function_type_declarator" -> {
                TSNode params = field(node, "parameters");
                String fn = base + " (" + parameterTypes(params) + ")";
                TSNode inner = field(node, "declarator");
                return inner == null ? new Declarator("", fn) : declarator(inner, fn);
            }
            default -> {
                return new Declarator(text(node), base);
            }
        }
    }

    private String parameterTypes(TSNode params) {
        if (params == null) {
            return "";
        }
        List<String> types = new ArrayList<>();
        for (TSNode param : namedChildren(params)) {
            if (param.getType().equals("parameter_declaration")) {
                TSNode d = field(param, "declarator");
                String base = baseType(param);
                types.add(d == null ? base : declarator(d, base).type());
            } else if (param.getType().equals("variadic_parameter")) {
                types.add("...");
            }
        }
        return String.join(", ", types);
    }

    private record Declarator(String name, String type) {
    }

    // statements and expressions

    TreeSitterCursor convert(TSNode node) {
        String type = node.getType();
        return switch (type) {
            case "compound_statement" -> withChildren(CursorKind.COMPOUND_STMT, node);
            case "declaration" -> {
                TreeSitterCursor stmt = cursor(CursorKind.DECL_STMT, node, "");
                declarators(node, stmt);
                yield stmt;
            }
            case "type_definition" -> {
                TreeSitterCursor stmt = cursor(CursorKind.DECL_STMT, node, "");
                typedefs(node, stmt);
                yield stmt;
            }
            case "expression_statement" -> withChildren(CursorKind.EXPRESSION_STMT, node);
            case "if_statement" -> {
                TreeSitterCursor stmt = cursor(CursorKind.IF_STMT, node, "");
                stmt.addChild(condition(field(node, "condition")));
                addField(stmt, node, "consequence");
                TSNode alternative = field(node, "alternative");
                if (alternative != null) {
                    if (alternative.getType().equals("else_clause")) {
                        List<TSNode> inner = namedChildren(alternative);
                        if (!inner.isEmpty()) {
                            stmt.addChild(convert(inner.get(0)));
                        }
                    } else {
                        stmt.addChild(convert(alternative));
                    }
                }
                yield stmt;
            }
            case "while_statement" -> {
                TreeSitterCursor stmt = cursor(CursorKind.WHILE_STMT, node, "");
                stmt.addChild(condition(field(node, "condition")));
                addField(stmt, node, "body");
                yield stmt;
            }
            case "do_statement" -> {
                TreeSitterCursor stmt = cursor(CursorKind.DO_STMT, node, "");
                addField(stmt, node, "body");
                stmt.addChild(condition(field(node, "condition")));
                yield stmt;
            }
            case "switch_statement" -> {
                TreeSitterCursor stmt = cursor(CursorKind.SWITCH_STMT, node, "");
                stmt.addChild(condition(field(node, "condition")));
                addField(stmt, node, "body");
                yield stmt;
            }
            case "for_statement" -> withChildren(CursorKind.FOR_STMT, node);
            case "case_statement" -> withChildren(
                    field(node, "value") == null ? CursorKind.DEFAULT_STMT : CursorKind.CASE_STMT, node);
            case "return_statement" -> withChildren(CursorKind.RETURN_STMT, node);
            case "break_statement" -> cursor(CursorKind.BREAK_STMT, node, "");
            case "continue_statement" -> cursor(CursorKind.CONTINUE_STMT, node, "");

            case "binary_expression" -> binary(CursorKind.BINARY_OPERATOR, node);
            case "assignment_expression" -> {
                String op = text(field(node, "operator"));
                yield binary(op.equals("=") ? CursorKind.BINARY_OPERATOR : CursorKind.COMPOUND_ASSIGNMENT_OPERATOR,
                        node);
            }
            case "unary_expression", "pointer_expression", "update_expression" -> {
                TreeSitterCursor unary = cursor(CursorKind.UNARY_OPERATOR, node, text(field(node, "operator")));
                addField(unary, node, "argument");
                yield unary;
            }
            case "conditional_expression" -> {
                TreeSitterCursor cond = cursor(CursorKind.CONDITIONAL_OPERATOR, node, "");
                addField(cond, node, "condition");
                addField(cond, node, "consequence");
                addField(cond, node, "alternative");
                yield cond;
            }
            case "call_expression" -> {
                TSNode function = field(node, "function");
                String name = function != null && function.getType().equals("identifier") ? text(function) : "";
                TreeSitterCursor call = cursor(CursorKind.CALL_EXPR, node, name);
                if (function != null) {
                    call.addChild(convert(function));
                }
                TSNode args = field(node, "arguments");
                if (args != null) {
                    for (TSNode arg : namedChildren(args)) {
                        if (!SKIPPED.contains(arg.getType())) {
                            call.addChild(convert(arg));
                        }
                    }
                }
                yield call;
            }
            case "number_literal" -> cursor(TypeSpelling.isIntegerLiteral(text(node))
                    ? CursorKind.INTEGER_LITERAL : CursorKind.FLOATING_LITERAL, node, text(node));
            case "char_literal" -> cursor(CursorKind.CHARACTER_LITERAL, node, text(node));
            case "string_literal", "concatenated_string" -> cursor(CursorKind.STRING_LITERAL, node, text(node));
            case "true", "false" -> typed(cursor(CursorKind.UNEXPOSED_EXPR, node, text(node)), "int");
            case "null" -> typed(cursor(CursorKind.UNEXPOSED_EXPR, node, text(node)), "void *");
            case "identifier" -> cursor(CursorKind.DECL_REF_EXPR, node, text(node));
            case "field_expression" -> {
                TreeSitterCursor member = cursor(CursorKind.MEMBER_REF_EXPR, node, text(field(node, "field")));
                addField(member, node, "argument");
                yield member;
            }
            case "subscript_expression" -> {
                TreeSitterCursor subscript = cursor(CursorKind.ARRAY_SUBSCRIPT_EXPR, node, "");
                for (TSNode child : namedChildren(node)) {
                    if (!SKIPPED.contains(child.getType())) {
                        subscript.addChild(convert(child));
                    }
                }
                yield subscript;
            }
            case "cast_expression" -> {
                TreeSitterCursor cast = cursor(CursorKind.CSTYLE_CAST_EXPR, node, "");
                String castType = TypeSpelling.normalize(text(field(node, "type")));
                cast.setType(castType, "");
                addField(cast, node, "value");
                yield cast;
            }
            case "parenthesized_expression" -> withChildren(CursorKind.PAREN_EXPR, node);
            case "sizeof_expression", "alignof_expression" -> {
                TreeSitterCursor sizeof = cursor(CursorKind.SIZEOF_EXPR, node, "");
                addField(sizeof, node, "value");
                yield sizeof;
            }
            case "initializer_list" -> withChildren(CursorKind.INIT_LIST_EXPR, node);
            case "compound_literal_expression" -> {
                TreeSitterCursor literal = cursor(CursorKind.UNEXPOSED_EXPR, node, "");
                literal.setType(TypeSpelling.normalize(text(field(node, "type"))), "");
                addField(literal, node, "value");
                yield literal;
            }
            default -> withChildren(type.endsWith("_statement") ? CursorKind.UNEXPOSED_STMT : CursorKind.UNEXPOSED_EXPR,
                    node);
        };
    }

    private TreeSitterCursor binary(CursorKind kind, TSNode node) {
        TreeSitterCursor binary = cursor(kind, node, text(field(node, "operator")));
        addField(binary, node, "left");
        addField(binary, node, "right");
        return binary;
    }

    /**
     * Condition of a statement without the parentheses required by the statement syntax.
     */
    private TreeSitterCursor condition(TSNode node) {
        if (node == null) {
            return null;
        }
        if (node.getType().equals("parenthesized_expression")) {
            List<TSNode> inner = namedChildren(node);
            if (inner.size() == 1) {
                return convert(inner.get(0));
            }
        }
        return convert(node);
    }

    private TreeSitterCursor withChildren(CursorKind kind, TSNode node) {
        TreeSitterCursor result = cursor(kind, node, "");
        for (TSNode child : namedChildren(node)) {
            if (!SKIPPED.contains(child.getType())) {
                result.addChild(convert(child));
            }
        }
        return result;
    }

    private void addField(TreeSitterCursor owner, TSNode node, String name) {
        TSNode child = field(node, name);
        if (child != null && !SKIPPED.contains(child.getType())) {
            owner.addChild(convert(child));
        }
    }

    private static TreeSitterCursor typed(TreeSitterCursor cursor, String type) {
        cursor.setType(type, type);
        return cursor;
    }

    private TreeSitterCursor cursor(CursorKind kind, TSNode node, String spelling) {
        return new TreeSitterCursor(kind, node.getType(), source, start(node), end(node), spelling);
    }

    private int start(TSNode node) {
        return source.charOffset(node.getStartByte());
    }

    private int end(TSNode node) {
        return source.charOffset(node.getEndByte());
    }

    private String text(TSNode node) {
        if (node == null) {
            return "";
        }
        return source.slice(start(node), end(node));
    }

    // tree-sitter access

    static TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    static List<TSNode> fieldChildren(TSNode node, String name) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (name.equals(node.getFieldNameForChild(i))) {
                result.add(node.getChild(i));
            }
        }
        return result;
    }

    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.isNamed()) {
                result.add(child);
            }
        }
        return result;
    }
}
