package com.raditha.signfix.session;

import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.alias.TypeTable;
import com.raditha.signfix.frontend.TranslationUnit;
import com.raditha.signfix.functions.FunctionTable;
import com.raditha.signfix.preprocess.LineMap;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything built once per source file and shared read-only by every fix request on it.
 *
 * @param sourceFile  the original C file
 * @param sourceLines its lines as read, without line terminators
 * @param unit        parsed preprocessed text
 * @param macros      Macro Table of the file
 * @param types       Type Table of the file
 * @param functions   Function Table of the file
 */
public record Session(
        Path sourceFile,
        List<String> sourceLines,
        TranslationUnit unit,
        MacroTable macros,
        TypeTable types,
        FunctionTable functions) {

    public Session {
        sourceLines = List.copyOf(sourceLines);
    }

    public LineMap lineMap() {
        return unit.source().lineMap();
    }

    /**
     * Original source line (1-indexed), or null when out of range.
     */
    public String sourceLine(int line) {
        if (line < 1 || line > sourceLines.size()) {
            return null;
        }
        return sourceLines.get(line - 1);
    }

    public String fileName() {
        return sourceFile.toString();
    }
}
