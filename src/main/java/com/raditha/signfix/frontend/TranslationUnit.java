package com.raditha.signfix.frontend;

import com.raditha.signfix.preprocess.PreprocessedSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A parsed file: the root cursor and the preprocessed source it was parsed from.
 */
public class TranslationUnit {

    private final PreprocessedSource source;
    private final Cursor root;

    public TranslationUnit(PreprocessedSource source, Cursor root) {
        this.source = source;
        this.root = root;
    }

    public PreprocessedSource source() {
        return source;
    }

    public Cursor root() {
        return root;
    }

    /**
     * Top-level declarations (function definitions, prototypes, variables, typedefs).
     */
    public List<Cursor> topLevel() {
        return root.children();
    }

    /**
     * The top-level declaration whose extent covers a preprocessed line.
     */
    public Optional<Cursor> enclosingTopLevel(int preprocessedLine) {
        for (Cursor c : topLevel()) {
            if (c.extent().containsLine(preprocessedLine)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Function definitions and prototypes in declaration order.
     */
    public List<Cursor> functions() {
        List<Cursor> result = new ArrayList<>();
        for (Cursor c : topLevel()) {
            if (c.kind() == CursorKind.FUNCTION_DECL) {
                result.add(c);
            }
        }
        return result;
    }
}
