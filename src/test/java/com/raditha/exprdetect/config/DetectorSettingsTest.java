package com.raditha.exprdetect.config;

import com.raditha.exprdetect.analysis.NamingConvention;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DetectorSettingsTest {

    @TempDir
    Path dir;

    private Path write(String yaml) throws IOException {
        Path file = dir.resolve("settings.yml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void testClasspathDefaults() throws IOException {
        Map<String, Object> yaml = DetectorSettings.loadConfigMap();
        assertTrue(yaml.containsKey(DetectorSettings.CONFIG_KEY));

        DetectorConfig config = DetectorSettings.loadConfig(yaml, null, false);
        assertEquals(DetectorConfig.defaults(), config);
    }

    @Test
    void testFileValuesOverrideDefaults() throws IOException {
        Path file = write("""
                expression_detector:
                  temp_prefix: t_
                  checked_prefix: chk_
                  instance_number: 7
                  verify: false
                """);

        DetectorConfig config = DetectorSettings.loadConfig(DetectorSettings.loadConfigMap(file), null, false);

        assertEquals("t_", config.naming().temporaryPrefix());
        assertEquals(NamingConvention.DEFAULT_PRINTED_PREFIX, config.naming().printedPrefix());
        assertEquals("chk_", config.naming().checkedPrefix());
        assertEquals("7", config.instanceNumber());
        assertFalse(config.verify());
    }

    @Test
    void testCommandLineOverridesFile() throws IOException {
        Path file = write("expression_detector:\n  instance_number: 7\n  verify: true\n");

        DetectorConfig config = DetectorSettings.loadConfig(DetectorSettings.loadConfigMap(file), "12", true);

        assertEquals("12", config.instanceNumber());
        assertFalse(config.verify());
    }

    @Test
    void testEmptyOrForeignFileFallsBackToDefaults() throws IOException {
        assertEquals(DetectorConfig.defaults(),
                DetectorSettings.loadConfig(DetectorSettings.loadConfigMap(write("")), null, false));
        assertEquals(DetectorConfig.defaults(),
                DetectorSettings.loadConfig(DetectorSettings.loadConfigMap(write("other: 1\n")), null, false));
    }

    @Test
    void testBlankPrefixIsRejected() throws IOException {
        Path file = write("expression_detector:\n  temp_prefix: ''\n");
        Map<String, Object> yaml = DetectorSettings.loadConfigMap(file);
        assertThrows(IllegalArgumentException.class, () -> DetectorSettings.loadConfig(yaml, null, false));
    }

    @Test
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new DetectorConfig(null, DetectorConfig.DEFAULT_INSTANCE_NUMBER, true));
        assertThrows(IllegalArgumentException.class,
                () -> DetectorConfig.defaults().withInstanceNumber(" "));
        assertFalse(DetectorConfig.defaults().withVerify(false).verify());
    }
}
