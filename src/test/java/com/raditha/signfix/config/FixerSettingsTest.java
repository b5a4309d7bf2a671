package com.raditha.signfix.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FixerSettingsTest {

    @TempDir
    Path tempDir;

    private static Path testConfig() throws URISyntaxException {
        return Path.of(FixerSettingsTest.class.getResource("/signfix-test.yml").toURI());
    }

    @Test
    void testYamlValuesAreRead() throws Exception {
        Map<String, Object> map = FixerSettings.readConfigMap(testConfig());

        FixerConfig config = FixerSettings.loadConfig(map, null, null, null);

        assertTrue(config.castOnTypeNameMismatch());
        assertEquals(PreprocessorMode.EXTERNAL, config.preprocessor());
        assertEquals("gcc -E", config.preprocessorCommand());
        assertEquals(List.of("-std=c99", "-DNDEBUG"), config.compileArgs());
        assertEquals("out/result.json", config.resultFile());
        assertEquals(1, config.diffContextLines());
        assertEquals(60, config.timeoutSeconds());
    }

    @Test
    void testCliOverridesYaml() throws Exception {
        Map<String, Object> map = FixerSettings.readConfigMap(testConfig());

        FixerConfig config = FixerSettings.loadConfig(map, null, false, PreprocessorMode.BUILTIN);

        assertFalse(config.castOnTypeNameMismatch());
        assertEquals(PreprocessorMode.BUILTIN, config.preprocessor());
        assertEquals("gcc -E", config.preprocessorCommand());
    }

    @Test
    void testPresets() {
        assertEquals(FixerConfig.defaults(), FixerSettings.loadConfig(Map.of(), null, null, null));
        assertEquals(FixerConfig.strict(), FixerSettings.loadConfig(Map.of(), "strict", null, null));
        assertEquals(FixerConfig.clang(), FixerSettings.loadConfig(Map.of("preset", "clang"), null, null, null));
        assertTrue(FixerSettings.loadConfig(Map.of("preset", "clang"), "strict", null, null).castOnTypeNameMismatch());
    }

    @Test
    void testCompileArgsAsList() {
        FixerConfig config = FixerSettings.loadConfig(Map.of("compile_args", List.of("-I", "include")), null, null, null);

        assertEquals(List.of("-I", "include"), config.compileArgs());
    }

    @Test
    void testMissingExplicitFileFails() {
        assertThrows(IOException.class, () -> FixerSettings.readConfigMap(tempDir.resolve("absent.yml")));
    }

    @Test
    void testFileWithoutSection() throws IOException {
        Path file = tempDir.resolve("other.yml");
        Files.writeString(file, "other_tool:\n  threshold: 3\n");

        assertTrue(FixerSettings.readConfigMap(file).isEmpty());
    }

    @Test
    void testInvalidPreprocessorMode() {
        Map<String, Object> map = Map.of("preprocessor", "cpp");

        assertThrows(IllegalArgumentException.class, () -> FixerSettings.loadConfig(map, null, null, null));
    }

    @Test
    void testConfigValidation() {
        FixerConfig defaults = FixerConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withPreprocessor(null));
        assertThrows(IllegalArgumentException.class,
                () -> new FixerConfig(false, PreprocessorMode.BUILTIN, null, null, null, -1, 60));
        assertEquals(FixerConfig.DEFAULT_COMMAND,
                new FixerConfig(false, PreprocessorMode.BUILTIN, " ", null, null, 0, 1).preprocessorCommand());
    }
}
