package com.raditha.exprdetect.config;

import com.raditha.exprdetect.analysis.NamingConvention;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads detector configuration from exprdetect.yml with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > exprdetect.yml > defaults
 */
public class DetectorSettings {

    static final String CONFIG_KEY = "expression_detector";
    static final String DEFAULT_RESOURCE = "exprdetect.yml";

    private DetectorSettings() {
    }

    /**
     * Read the YAML file given on the command line.
     *
     * @return the top level mapping, empty if the file holds no document
     */
    public static Map<String, Object> loadConfigMap(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return asMap(new Yaml().load(reader));
        }
    }

    /**
     * Read exprdetect.yml from the classpath, or nothing when it is absent.
     */
    public static Map<String, Object> loadConfigMap() throws IOException {
        try (InputStream in = DetectorSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return Map.of();
            }
            return asMap(new Yaml().load(in));
        }
    }

    /**
     * Build the configuration, applying CLI overrides where provided.
     *
     * @param yaml              top level mapping of the configuration file
     * @param instanceNumberCLI CLI instance number text (null = use YAML/default)
     * @param noVerifyCLI       whether --no-verify was given
     * @return complete detector configuration
     */
    public static DetectorConfig loadConfig(Map<String, Object> yaml, String instanceNumberCLI,
            boolean noVerifyCLI) {
        Map<String, Object> config = asMap(yaml.get(CONFIG_KEY));

        NamingConvention naming = new NamingConvention(
                getString(config, "temp_prefix", NamingConvention.DEFAULT_TEMPORARY_PREFIX),
                getString(config, "printed_prefix", NamingConvention.DEFAULT_PRINTED_PREFIX),
                getString(config, "checked_prefix", NamingConvention.DEFAULT_CHECKED_PREFIX));

        DetectorConfig fromFile = new DetectorConfig(naming,
                getString(config, "instance_number", DetectorConfig.DEFAULT_INSTANCE_NUMBER),
                getBoolean(config, "verify", true));

        if (instanceNumberCLI != null) {
            fromFile = fromFile.withInstanceNumber(instanceNumberCLI);
        }
        if (noVerifyCLI) {
            fromFile = fromFile.withVerify(false);
        }
        return fromFile;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object raw) {
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        return Map.of();
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
}
