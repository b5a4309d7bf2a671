package com.raditha.signfix.session;

import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.alias.TypeTable;
import com.raditha.signfix.config.FixerConfig;
import com.raditha.signfix.config.PreprocessorMode;
import com.raditha.signfix.frontend.CFrontEnd;
import com.raditha.signfix.frontend.ParseFailureException;
import com.raditha.signfix.frontend.TranslationUnit;
import com.raditha.signfix.frontend.treesitter.TreeSitterFrontEnd;
import com.raditha.signfix.functions.AstFunctionTable;
import com.raditha.signfix.preprocess.ExternalPreprocessor;
import com.raditha.signfix.preprocess.MacroExpandingPreprocessor;
import com.raditha.signfix.preprocess.PreprocessedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Builds a {@link Session} for a source file: alias tables from the raw text, then the
 * preprocessed text, its AST and the Function Table.
 */
public class SessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(SessionFactory.class);

    private final FixerConfig config;
    private final CFrontEnd frontEnd;

    public SessionFactory(FixerConfig config) {
        this(config, new TreeSitterFrontEnd());
    }

    public SessionFactory(FixerConfig config, CFrontEnd frontEnd) {
        this.config = config;
        this.frontEnd = frontEnd;
    }

    /**
     * Open a session on a file.
     *
     * @throws ParseFailureException when the file cannot be read, preprocessed or parsed
     */
    public Session open(Path sourceFile) throws ParseFailureException {
        List<String> lines;
        try {
            lines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ParseFailureException("Cannot read " + sourceFile + ": " + e.getMessage(), e);
        }
        String file = sourceFile.toString();
        MacroTable macros = MacroTable.parse(file, lines);
        TypeTable types = TypeTable.parse(file, lines);

        PreprocessedSource preprocessed;
        if (config.preprocessor() == PreprocessorMode.EXTERNAL) {
            List<String> command = Arrays.asList(config.preprocessorCommand().trim().split("\\s+"));
            preprocessed = new ExternalPreprocessor(command, config.compileArgs(), config.timeoutSeconds())
                    .preprocess(sourceFile);
        } else {
            preprocessed = new MacroExpandingPreprocessor().preprocess(file, lines, macros);
        }

        TranslationUnit unit = frontEnd.parse(preprocessed);
        logger.info("Opened {}: {} lines, {} macros, {} typedefs", sourceFile, lines.size(), macros.size(),
                types.size());
        return new Session(sourceFile, lines, unit, macros, types, new AstFunctionTable(unit, file));
    }
}
