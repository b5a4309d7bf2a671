package com.raditha.signfix.functions;

import com.raditha.signfix.frontend.Cursor;
import com.raditha.signfix.frontend.CursorKind;
import com.raditha.signfix.frontend.TranslationUnit;
import com.raditha.signfix.preprocess.LineMap;
import com.raditha.signfix.types.TypeSpelling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link FunctionTable} built from the function declarations of a translation unit that map
 * back to the analyzed file. Declarations pulled in from headers are left out. When a name
 * is both declared and defined, the definition wins.
 */
public class AstFunctionTable implements FunctionTable {

    private static final Logger logger = LoggerFactory.getLogger(AstFunctionTable.class);

    private final Map<String, FunctionSignature> functions = new LinkedHashMap<>();

    public AstFunctionTable(TranslationUnit unit, String originalFile) {
        LineMap lineMap = unit.source().lineMap();
        String fileName = Path.of(originalFile).getFileName().toString();
        for (Cursor fn : unit.functions()) {
            String mappedFile = lineMap.toOriginal(fn.extent().startLine()).file();
            if (!lineMap.isEmpty() && !Path.of(mappedFile).getFileName().toString().equals(fileName)) {
                continue;
            }
            FunctionSignature signature = signature(fn, lineMap.toOriginal(fn.extent().startLine()).line());
            boolean definition = fn.children().stream().anyMatch(c -> c.kind() == CursorKind.COMPOUND_STMT);
            if (definition || !functions.containsKey(signature.name())) {
                functions.put(signature.name(), signature);
            }
        }
        logger.debug("Function table for {} has {} entries", originalFile, functions.size());
    }

    private static FunctionSignature signature(Cursor fn, int line) {
        List<FunctionSignature.Parameter> params = new ArrayList<>();
        for (Cursor child : fn.children()) {
            if (child.kind() == CursorKind.PARM_DECL && !TypeSpelling.normalize(child.typeSpelling()).equals("void")) {
                params.add(new FunctionSignature.Parameter(child.spelling(), child.typeSpelling()));
            }
        }
        return new FunctionSignature(fn.spelling(), params, TypeSpelling.returnTypeOf(fn.typeSpelling()), line);
    }

    @Override
    public Optional<FunctionSignature> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    @Override
    public Collection<FunctionSignature> all() {
        return Collections.unmodifiableCollection(functions.values());
    }
}
