package com.raditha.signfix.cli;

import com.raditha.signfix.config.FixerConfig;
import com.raditha.signfix.config.FixerSettings;
import com.raditha.signfix.config.PreprocessorMode;
import com.raditha.signfix.export.ResultExporter;
import com.raditha.signfix.fix.SignednessFixer;
import com.raditha.signfix.frontend.ParseFailureException;
import com.raditha.signfix.model.Finding;
import com.raditha.signfix.model.FixRequest;
import com.raditha.signfix.model.FixResult;
import com.raditha.signfix.resolve.CastRecord;
import com.raditha.signfix.rewrite.DiffGenerator;
import com.raditha.signfix.rewrite.SourceLinePatcher;
import com.raditha.signfix.scan.SignednessScanner;
import com.raditha.signfix.session.Session;
import com.raditha.signfix.session.SessionFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the signedness fixer.
 * <p>
 * Usage:
 * java -jar signfix.jar fix [options] <file> <line> <operator> [occurrence]
 * java -jar signfix.jar scan [options] <file>
 * <p>
 * Configuration priority: CLI arguments > signfix.yml > defaults
 */
@Command(name = "signfix", mixinStandardHelpOptions = true, version = "signfix v1.0.0",
        description = "Signed/unsigned conflict fixer for C sources",
        subcommands = {SignfixCLI.FixCommand.class, SignfixCLI.ScanCommand.class})
public class SignfixCLI implements Callable<Integer> {

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>",
            scope = CommandLine.ScopeType.INHERIT)
    Path configFile;

    @Option(names = "--preset", description = "Configuration preset: default, strict or clang", paramLabel = "<name>",
            scope = CommandLine.ScopeType.INHERIT)
    String preset;

    @Option(names = "--preprocessor", description = "Preprocessor: builtin or external", paramLabel = "<mode>",
            converter = PreprocessorModeConverter.class, scope = CommandLine.ScopeType.INHERIT)
    PreprocessorMode preprocessor;

    @Option(names = "--cast-on-type-name-mismatch", negatable = true,
            description = "Also cast operands of equal signedness whose type names differ",
            scope = CommandLine.ScopeType.INHERIT)
    Boolean castOnTypeNameMismatch;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    FixerConfig loadConfig() throws IOException {
        if (preset != null && !List.of("default", "strict", "clang").contains(preset)) {
            throw new IllegalArgumentException("Preset must be 'default', 'strict' or 'clang', got: " + preset);
        }
        Map<String, Object> yaml = FixerSettings.readConfigMap(configFile);
        return FixerSettings.loadConfig(yaml, preset, castOnTypeNameMismatch, preprocessor);
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        CommandLine cmd = new CommandLine(new SignfixCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof ParseFailureException) {
                commandLine.getErr().println("Parse failure: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        return cmd.execute(args);
    }

    /**
     * Resolves one flagged operator.
     */
    @Command(name = "fix", mixinStandardHelpOptions = true, description = "Insert casts for one flagged operator")
    static class FixCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        SignfixCLI parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", description = "C source file")
        Path file;

        @Parameters(index = "1", description = "Line number (1-indexed)")
        int line;

        @Parameters(index = "2", description = "Operator as written, for example '+' or '<='")
        String operator;

        @Parameters(index = "3", arity = "0..1", description = "1-based occurrence of the operator on the line")
        int occurrence = 1;

        @Option(names = "--report-id", description = "Identifier echoed in the result", paramLabel = "<id>")
        String reportId = "0";

        @Option(names = "--apply", description = "Write the rewritten line back into the file")
        boolean apply;

        @Option(names = "--diff", description = "Print a unified diff of the change")
        boolean diff;

        @Option(names = "--output", description = "Result file (default from configuration)", paramLabel = "<path>")
        Path output;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(file)) {
                throw new IllegalArgumentException("Source file not found: " + file);
            }
            FixerConfig config = parent.loadConfig();
            PrintWriter out = spec.commandLine().getOut();

            Session session = new SessionFactory(config).open(file);
            FixRequest request = new FixRequest(reportId, line, operator, occurrence);
            FixResult result = new SignednessFixer(config.castOnTypeNameMismatch()).fix(session, request);

            printResult(out, result);
            if (diff && result.changed()) {
                out.println(new DiffGenerator(config.diffContextLines())
                        .generateUnifiedDiff(file, line, result.rewrittenLine()));
            }
            if (apply && result.changed()) {
                new SourceLinePatcher().apply(file, result.rewrittenLine(), line);
            }
            Path target = output != null ? output : config.resultFile() == null ? null : Path.of(config.resultFile());
            if (target != null) {
                new ResultExporter().exportResult(file, result, target);
                out.println("Result written to: " + target.toAbsolutePath());
            }
            return result.success() ? 0 : 1;
        }

        private static void printResult(PrintWriter out, FixResult result) {
            out.printf("Report %s, line %d: %s%n", result.reportId(), result.lineNumber(),
                    result.success() ? "OK" : "FAILED");
            out.println("  " + result.message());
            if (result.changed()) {
                out.println("  - " + result.originalLine());
                out.println("  + " + result.rewrittenLine());
                for (CastRecord cast : result.casts()) {
                    out.printf("    %s operand '%s' -> '%s'%n", cast.side(), cast.original(), cast.replacement());
                }
            }
        }
    }

    /**
     * Lists signedness conflicts.
     */
    @Command(name = "scan", mixinStandardHelpOptions = true, description = "List signed/unsigned conflicts in a file")
    static class ScanCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        SignfixCLI parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", description = "C source file")
        Path file;

        @Option(names = "--json", description = "Output findings in JSON format")
        boolean json;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(file)) {
                throw new IllegalArgumentException("Source file not found: " + file);
            }
            FixerConfig config = parent.loadConfig();
            PrintWriter out = spec.commandLine().getOut();
            Session session = new SessionFactory(config).open(file);
            List<Finding> findings = new SignednessScanner().scan(session);

            if (json) {
                out.println(new ResultExporter().toJson(findings));
                return 0;
            }
            out.println("=".repeat(80));
            out.println("SIGNEDNESS CONFLICTS: " + file.getFileName());
            out.println("=".repeat(80));
            if (findings.isEmpty()) {
                out.println("No signed/unsigned conflicts found.");
            }
            for (Finding f : findings) {
                out.printf("%s:%d  '%s' #%d in %s%n", file.getFileName(), f.line(), f.operator(),
                        f.occurrenceIndex(), f.function());
                out.printf("    %s (%s)  vs  %s (%s)%n", f.leftText(), f.leftType(), f.rightText(), f.rightType());
            }
            out.printf("Total: %d%n", findings.size());
            return 0;
        }
    }

    /**
     * Custom converter for PreprocessorMode enum to handle CLI string values.
     */
    public static class PreprocessorModeConverter implements ITypeConverter<PreprocessorMode> {
        @Override
        public PreprocessorMode convert(String value) {
            return PreprocessorMode.fromString(value);
        }
    }
}
