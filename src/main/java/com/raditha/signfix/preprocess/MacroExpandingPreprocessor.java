package com.raditha.signfix.preprocess;

import com.raditha.signfix.alias.MacroDefinition;
import com.raditha.signfix.alias.MacroTable;
import com.raditha.signfix.frontend.ParseFailureException;
import com.raditha.signfix.lexer.CLexer;
import com.raditha.signfix.lexer.LexToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in preprocessor working from the {@code #define}s of the file itself.
 * <p>
 * Output has the same number of lines as the input plus one leading {@code # 1 "<file>"}
 * marker. Directive lines and their continuations become empty lines, conditional directives
 * are not evaluated (every branch stays), and {@code #include} is not followed. Macros are
 * expanded only after the line of their definition. Object-like and function-like macros
 * are supported with stringizing, token pasting and {@code __VA_ARGS__}; a hide set stops
 * recursive expansion.
 */
public class MacroExpandingPreprocessor implements Preprocessor {

    private static final Logger logger = LoggerFactory.getLogger(MacroExpandingPreprocessor.class);

    @Override
    public PreprocessedSource preprocess(Path sourceFile) throws ParseFailureException {
        List<String> lines;
        try {
            lines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ParseFailureException("Cannot read " + sourceFile + ": " + e.getMessage(), e);
        }
        String file = sourceFile.toString();
        return preprocess(file, lines, MacroTable.parse(file, lines));
    }

    /**
     * Preprocess source lines with an already built macro table.
     */
    public PreprocessedSource preprocess(String file, List<String> lines, MacroTable macros) {
        StringBuilder out = new StringBuilder();
        out.append("# 1 \"").append(file).append("\"\n");
        boolean continuation = false;
        int expanded = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean directive = continuation || line.trim().startsWith("#");
            if (directive) {
                continuation = line.stripTrailing().endsWith("\\");
                out.append('\n');
                continue;
            }
            String result = expandLine(line, i + 1, macros);
            if (!result.equals(line)) {
                expanded++;
            }
            out.append(result).append('\n');
        }
        logger.debug("Expanded macros on {} of {} lines of {}", expanded, lines.size(), file);
        return PreprocessedSource.of(file, out.toString());
    }

    /**
     * Expand the macros defined before {@code lineNumber} in one line of text.
     */
    public String expandLine(String text, int lineNumber, MacroTable macros) {
        return new Expander(macros, lineNumber).expand(text, Set.of());
    }

    private static final class Expander {
        private final MacroTable macros;
        private final int lineNumber;

        Expander(MacroTable macros, int lineNumber) {
            this.macros = macros;
            this.lineNumber = lineNumber;
        }

        String expand(String text, Set<String> hidden) {
            List<LexToken> tokens = CLexer.tokenize(text);
            StringBuilder out = new StringBuilder();
            int copied = 0;
            int i = 0;
            while (i < tokens.size()) {
                LexToken token = tokens.get(i);
                Optional<MacroDefinition> def = visible(token, hidden);
                if (def.isEmpty()) {
                    i++;
                    continue;
                }
                MacroDefinition macro = def.get();
                Set<String> inner = new HashSet<>(hidden);
                inner.add(macro.name());
                if (!macro.isFunctionLike()) {
                    out.append(text, copied, token.start());
                    out.append(expand(macro.body(), inner));
                    copied = token.end();
                    i++;
                    continue;
                }
                Invocation call = collectArguments(text, tokens, i + 1);
                if (call == null) {
                    i++;
                    continue;
                }
                out.append(text, copied, token.start());
                out.append(expand(substitute(macro, call.arguments(), hidden), inner));
                copied = call.end();
                i = call.nextToken();
            }
            out.append(text.substring(copied));
            return out.toString();
        }

        private Optional<MacroDefinition> visible(LexToken token, Set<String> hidden) {
            if (!token.isIdentifier() || hidden.contains(token.text())) {
                return Optional.empty();
            }
            return macros.definition(token.text()).filter(d -> d.line() < lineNumber);
        }

        private String substitute(MacroDefinition macro, List<String> arguments, Set<String> hidden) {
            List<LexToken> body = CLexer.tokenize(macro.body());
            List<String> params = macro.parameters();
            StringBuilder out = new StringBuilder();
            int copied = 0;
            for (int k = 0; k < body.size(); k++) {
                LexToken token = body.get(k);
                if (token.is("#") && k + 1 < body.size() && params.contains(body.get(k + 1).text())) {
                    out.append(macro.body(), copied, token.start());
                    out.append(stringize(argument(macro, arguments, body.get(k + 1).text())));
                    copied = body.get(k + 1).end();
                    k++;
                    continue;
                }
                if (!token.isIdentifier() || !(params.contains(token.text()) || isVarArgs(macro, token))) {
                    continue;
                }
                boolean pasted = (k > 0 && body.get(k - 1).is("##"))
                        || (k + 1 < body.size() && body.get(k + 1).is("##"));
                String raw = argument(macro, arguments, token.text());
                out.append(macro.body(), copied, token.start());
                out.append(pasted ? raw : expand(raw, hidden));
                copied = token.end();
            }
            out.append(macro.body().substring(copied));
            return out.toString().replaceAll("\\s*##\\s*", "");
        }

        private static boolean isVarArgs(MacroDefinition macro, LexToken token) {
            return macro.isVariadic() && token.is("__VA_ARGS__");
        }

        private static String argument(MacroDefinition macro, List<String> arguments, String name) {
            List<String> params = macro.parameters();
            if (name.equals("__VA_ARGS__")) {
                int first = params.size() - 1;
                return first < arguments.size() ? String.join(", ", arguments.subList(first, arguments.size())) : "";
            }
            int index = params.indexOf(name);
            return index < arguments.size() ? arguments.get(index) : "";
        }

        private static String stringize(String argument) {
            return "\"" + argument.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }

        /**
         * Arguments of a function-like invocation whose {@code (} is at {@code open}, or null
         * when the name is not followed by a complete argument list on this line.
         */
        private static Invocation collectArguments(String text, List<LexToken> tokens, int open) {
            if (open >= tokens.size() || !tokens.get(open).is("(")) {
                return null;
            }
            List<String> arguments = new ArrayList<>();
            int depth = 0;
            int argStart = -1;
            int argEnd = -1;
            for (int k = open + 1; k < tokens.size(); k++) {
                LexToken token = tokens.get(k);
                if (depth == 0 && (token.is(",") || token.is(")"))) {
                    arguments.add(argStart < 0 ? "" : text.substring(argStart, argEnd));
                    if (token.is(")")) {
                        if (arguments.size() == 1 && arguments.get(0).isEmpty()) {
                            arguments.clear();
                        }
                        return new Invocation(arguments, token.end(), k + 1);
                    }
                    argStart = -1;
                    continue;
                }
                if (token.is("(") || token.is("[") || token.is("{")) {
                    depth++;
                } else if (token.is(")") || token.is("]") || token.is("}")) {
                    depth--;
                }
                if (argStart < 0) {
                    argStart = token.start();
                }
                argEnd = token.end();
            }
            return null;
        }
    }

    private record Invocation(List<String> arguments, int end, int nextToken) {
    }
}
