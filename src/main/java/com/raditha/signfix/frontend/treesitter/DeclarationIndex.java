package com.raditha.signfix.frontend.treesitter;

import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name resolution for a parsed file.
 * <p>
 * Walks the tree once with a stack of scopes (file, function parameters, blocks and
 * {@code for} initializers) and links every {@link CursorKind#DECL_REF_EXPR} to the
 * innermost visible declaration. Only declarations seen earlier in the walk are visible.
 * Typedefs and record fields are collected for the typer.
 */
final class DeclarationIndex {

    private final Deque<Map<String, TreeSitterCursor>> scopes = new ArrayDeque<>();
    private final Map<String, TreeSitterCursor> typedefs = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> recordFields = new HashMap<>();

    private DeclarationIndex() {
    }

    static DeclarationIndex build(TreeSitterCursor root) {
        DeclarationIndex index = new DeclarationIndex();
        index.scopes.push(new HashMap<>());
        index.walk(root);
        return index;
    }

    Map<String, TreeSitterCursor> typedefs() {
        return typedefs;
    }

    /**
     * Field types of a record, keyed by {@code "struct tag"} or by typedef name.
     */
    Map<String, String> fields(String recordType) {
        return recordFields.getOrDefault(recordType, Map.of());
    }

    private void walk(TreeSitterCursor node) {
        switch (node.kind()) {
            case FUNCTION_DECL -> {
                declare(node);
                scopes.push(new HashMap<>());
                walkChildren(node);
                scopes.pop();
            }
            case VAR_DECL, PARM_DECL, ENUM_CONSTANT_DECL -> {
                walkChildren(node);
                declare(node);
            }
            case TYPEDEF_DECL -> {
                walkChildren(node);
                typedefs.put(node.spelling(), node);
                for (Cursor child : node.children()) {
                    if (child.kind() == CursorKind.STRUCT_DECL) {
                        recordFields.put(node.spelling(), fieldsOf(child));
                    }
                }
            }
            case STRUCT_DECL -> {
                recordFields.put(node.typeSpelling(), fieldsOf(node));
                walkChildren(node);
            }
            case COMPOUND_STMT, FOR_STMT -> {
                scopes.push(new HashMap<>());
                walkChildren(node);
                scopes.pop();
            }
            case DECL_REF_EXPR -> node.setReferenced(lookup(node.spelling()));
            case CALL_EXPR -> {
                walkChildren(node);
                if (!node.children().isEmpty()) {
                    node.child(0).referenced().ifPresent(d -> node.setReferenced((TreeSitterCursor) d));
                }
            }
            default -> walkChildren(node);
        }
    }

    private void walkChildren(TreeSitterCursor node) {
        for (int i = 0; i < node.children().size(); i++) {
            walk(node.child(i));
        }
    }

    private void declare(TreeSitterCursor declaration) {
        if (!declaration.spelling().isEmpty()) {
            scopes.peek().put(declaration.spelling(), declaration);
        }
    }

    private TreeSitterCursor lookup(String name) {
        for (Map<String, TreeSitterCursor> scope : scopes) {
            TreeSitterCursor found = scope.get(name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static Map<String, String> fieldsOf(Cursor record) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Cursor child : record.children()) {
            if (child.kind() == CursorKind.FIELD_DECL) {
                fields.put(child.spelling(), child.typeSpelling());
            }
        }
        return fields;
    }
}
