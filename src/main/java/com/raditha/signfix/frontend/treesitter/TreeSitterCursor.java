package com.raditha.signfix.frontend.treesitter;

import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.frontend.CursorToken;
import com.raditha.signfix.frontend.SourceExtent;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link Cursor} built eagerly from a tree-sitter node. References and types are filled in
 * by {@link DeclarationIndex} and {@link ExpressionTyper} after the tree is complete.
 */
final class TreeSitterCursor implements Cursor {

    private final CursorKind kind;
    private final String nodeType;
    private final SourceText source;
    private final SourceExtent extent;
    private final List<Cursor> children = new ArrayList<>();
    private String spelling;
    private TreeSitterCursor parent;
    private TreeSitterCursor referenced;
    private String typeSpelling = "";
    private String canonicalTypeSpelling = "";
    private List<CursorToken> tokens;

    TreeSitterCursor(CursorKind kind, String nodeType, SourceText source, int start, int end, String spelling) {
        this.kind = kind;
        this.nodeType = nodeType;
        this.source = source;
        this.extent = source.extent(start, end);
        this.spelling = spelling == null ? "" : spelling;
    }

    void addChild(TreeSitterCursor child) {
        if (child != null) {
            child.parent = this;
            children.add(child);
        }
    }

    void setReferenced(TreeSitterCursor declaration) {
        this.referenced = declaration;
    }

    void setType(String type, String canonical) {
        this.typeSpelling = type == null ? "" : type;
        this.canonicalTypeSpelling = canonical == null ? "" : canonical;
    }

    void setSpelling(String spelling) {
        this.spelling = spelling;
    }

    String nodeType() {
        return nodeType;
    }

    TreeSitterCursor child(int index) {
        return (TreeSitterCursor) children.get(index);
    }

    @Override
    public CursorKind kind() {
        return kind;
    }

    @Override
    public String spelling() {
        return spelling;
    }

    @Override
    public List<Cursor> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public @Nullable Cursor parent() {
        return parent;
    }

    @Override
    public SourceExtent extent() {
        return extent;
    }

    @Override
    public String text() {
        return source.slice(extent.startOffset(), extent.endOffset());
    }

    @Override
    public List<CursorToken> tokens() {
        if (tokens == null) {
            tokens = List.copyOf(source.tokens(extent.startOffset(), extent.endOffset()));
        }
        return tokens;
    }

    @Override
    public Optional<Cursor> referenced() {
        return Optional.ofNullable(referenced);
    }

    @Override
    public String typeSpelling() {
        return typeSpelling;
    }

    @Override
    public String canonicalTypeSpelling() {
        return canonicalTypeSpelling;
    }

    @Override
    public String toString() {
        return kind + " '" + spelling + "' " + extent.startLine() + ":" + extent.startColumn()
                + (typeSpelling.isEmpty() ? "" : " <" + typeSpelling + ">");
    }
}
