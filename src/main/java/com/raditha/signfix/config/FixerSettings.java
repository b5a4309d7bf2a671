package com.raditha.signfix.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads fixer configuration from {@code signfix.yml} with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > signfix.yml > defaults
 */
public class FixerSettings {

    private static final Logger logger = LoggerFactory.getLogger(FixerSettings.class);

    public static final String DEFAULT_FILE = "signfix.yml";
    private static final String CONFIG_KEY = "signfix";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private FixerSettings() {
    }

    /**
     * Read the {@code signfix} section of a YAML file.
     *
     * @param configFile file to read; null means {@value #DEFAULT_FILE} in the working
     *                   directory, which may be missing
     * @return the section, empty when there is none
     * @throws IOException when an explicitly named file cannot be read
     */
    public static Map<String, Object> readConfigMap(Path configFile) throws IOException {
        Path file = configFile != null ? configFile : Path.of(DEFAULT_FILE);
        if (!Files.exists(file)) {
            if (configFile != null) {
                throw new IOException("Config file not found: " + configFile);
            }
            return Map.of();
        }
        Map<String, Object> root = YAML.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
        });
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            logger.debug("Loaded {} keys from {}", config.size(), file);
            return config;
        }
        return Map.of();
    }

    /**
     * Build the configuration.
     *
     * @param config                    the {@code signfix} section, possibly empty
     * @param presetCLI                 CLI preset name (null = use YAML/default)
     * @param castOnTypeNameMismatchCLI CLI policy flag (null = use YAML/default)
     * @param preprocessorCLI           CLI preprocessor mode (null = use YAML/default)
     * @return complete configuration
     */
    public static FixerConfig loadConfig(Map<String, Object> config, String presetCLI,
                                         Boolean castOnTypeNameMismatchCLI, PreprocessorMode preprocessorCLI) {
        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        FixerConfig base = preset(preset);

        boolean cast = castOnTypeNameMismatchCLI != null
                ? castOnTypeNameMismatchCLI
                : getBoolean(config, "cast_on_type_name_mismatch", base.castOnTypeNameMismatch());

        PreprocessorMode mode = preprocessorCLI;
        if (mode == null) {
            String yamlMode = getString(config, "preprocessor", null);
            mode = yamlMode != null ? PreprocessorMode.fromString(yamlMode) : base.preprocessor();
        }

        List<String> compileArgs = getListString(config, "compile_args");

        return new FixerConfig(
                cast,
                mode,
                getString(config, "preprocessor_command", base.preprocessorCommand()),
                compileArgs.isEmpty() ? base.compileArgs() : compileArgs,
                getString(config, "result_file", base.resultFile()),
                getInt(config, "diff_context_lines", base.diffContextLines()),
                getInt(config, "timeout_seconds", base.timeoutSeconds()));
    }

    private static FixerConfig preset(String name) {
        if (name == null) {
            return FixerConfig.defaults();
        }
        return switch (name) {
            case "strict" -> FixerConfig.strict();
            case "clang" -> FixerConfig.clang();
            default -> FixerConfig.defaults();
        };
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String s && !s.isBlank()) {
            return List.of(s.trim().split("\\s+"));
        }
        return List.of();
    }
}
