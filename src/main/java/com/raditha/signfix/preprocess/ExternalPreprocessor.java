package com.raditha.signfix.preprocess;

import com.raditha.signfix.frontend.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external preprocessor, by default {@code clang -E <file> <compile args>}, and reads
 * its standard output. Both output streams go to temporary files so the timeout applies to the
 * whole run.
 */
public class ExternalPreprocessor implements Preprocessor {

    private static final Logger logger = LoggerFactory.getLogger(ExternalPreprocessor.class);

    public static final List<String> DEFAULT_COMMAND = List.of("clang", "-E");

    private final List<String> command;
    private final List<String> compileArgs;
    private final long timeoutSeconds;

    public ExternalPreprocessor(List<String> command, List<String> compileArgs, long timeoutSeconds) {
        this.command = command == null || command.isEmpty() ? DEFAULT_COMMAND : List.copyOf(command);
        this.compileArgs = compileArgs == null ? List.of() : List.copyOf(compileArgs);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public PreprocessedSource preprocess(Path sourceFile) throws ParseFailureException {
        List<String> cmd = commandLine(sourceFile);
        logger.debug("Running {}", cmd);
        Path output = null;
        Path errors = null;
        try {
            output = Files.createTempFile("signfix-cpp", ".out");
            errors = Files.createTempFile("signfix-cpp", ".err");
            ProcessBuilder pb = new ProcessBuilder(cmd);
            pb.redirectOutput(output.toFile());
            pb.redirectError(errors.toFile());
            Process process = pb.start();

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ParseFailureException("Preprocessor timed out after " + timeoutSeconds + "s: " + cmd);
            }
            if (process.exitValue() != 0) {
                String stderr = Files.readString(errors, StandardCharsets.UTF_8).trim();
                throw new ParseFailureException("Preprocessor exited with " + process.exitValue() + ": " + stderr);
            }
            return PreprocessedSource.of(sourceFile.toString(), Files.readString(output, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ParseFailureException("Failed to run preprocessor: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ParseFailureException("Interrupted while preprocessing " + sourceFile, e);
        } finally {
            deleteQuietly(output);
            deleteQuietly(errors);
        }
    }

    List<String> commandLine(Path sourceFile) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add(sourceFile.toString());
        cmd.addAll(compileArgs);
        return cmd;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
