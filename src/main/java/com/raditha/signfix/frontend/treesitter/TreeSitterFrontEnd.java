package com.raditha.signfix.frontend.treesitter;

import com.raditha.signfix.frontend.CFrontEnd;
import com.raditha.signfix.frontend.ParseFailureException;
import com.raditha.signfix.frontend.TranslationUnit;
import com.raditha.signfix.preprocess.LineMapper;
import com.raditha.signfix.preprocess.PreprocessedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;

/**
 * {@link CFrontEnd} backed by tree-sitter-c.
 * <p>
 * Line markers are blanked to spaces before parsing so that offsets, lines and columns of
 * the parsed text are those of the preprocessed text. Syntax errors do not fail the parse;
 * the affected region becomes unexposed cursors.
 */
public class TreeSitterFrontEnd implements CFrontEnd {

    private static final Logger logger = LoggerFactory.getLogger(TreeSitterFrontEnd.class);

    @Override
    public TranslationUnit parse(PreprocessedSource source) throws ParseFailureException {
        String text = blankMarkers(source.text());
        TSNode rootNode;
        try {
            TSParser parser = new TSParser();
            parser.setLanguage(new TreeSitterC());
            TSTree tree = parser.parseString(null, text);
            rootNode = tree == null ? null : tree.getRootNode();
        } catch (UnsatisfiedLinkError e) {
            throw new ParseFailureException("tree-sitter native library unavailable: " + e.getMessage(), e);
        }
        if (rootNode == null || rootNode.isNull()) {
            throw new ParseFailureException("Parser produced no tree for " + source.originalFile());
        }
        if (rootNode.hasError()) {
            logger.warn("Syntax errors in {}; affected regions are left unexposed", source.originalFile());
        }

        TreeSitterCursor root = new CursorBuilder(new SourceText(text)).build(rootNode);
        DeclarationIndex index = DeclarationIndex.build(root);
        new ExpressionTyper(index).type(root);
        logger.debug("Parsed {}: {} top-level declarations, {} typedefs", source.originalFile(),
                root.children().size(), index.typedefs().size());
        return new TranslationUnit(source, root);
    }

    static String blankMarkers(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            String line = lines[i];
            out.append(LineMapper.isMarker(line) || line.trim().startsWith("#") ? " ".repeat(line.length()) : line);
        }
        return out.toString();
    }
}
