package com.raditha.structdiff.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StructuralDiffSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadConfig_Defaults() {
        StructuralDiffConfig config = StructuralDiffSettings.fromMap(Map.of(), Map.of());

        assertEquals(0.8, config.similarityThreshold(), 0.001);
        assertEquals(0.8, config.renameThreshold(), 0.001);
        assertEquals(0.95, config.moveThreshold(), 0.001);
        assertTrue(config.detectRenames());
        assertTrue(config.detectMoves());
        assertTrue(config.includeContent());
        assertFalse(config.includeNestedTypes());
        assertEquals("JAVA_17", config.languageLevel());
        assertTrue(config.customProfiles().isEmpty());
    }

    @Test
    void testLoadConfig_YamlFileWithPreset() throws IOException {
        Path yaml = tempDir.resolve("structdiff.yml");
        Files.writeString(yaml, """
                structural_diff:
                  preset: strict
                  rename_threshold: 0.85
                  detect_moves: false
                  parallelism: 2
                  profiles:
                    android: [ANDROID, JAVA_8]
                    embedded: "EMBEDDED, JAVA_11"
                """);

        StructuralDiffConfig config = StructuralDiffSettings.loadConfig(yaml, Map.of());

        assertEquals(0.9, config.similarityThreshold(), 0.001);
        assertEquals(0.85, config.renameThreshold(), 0.001);
        assertEquals(1.0, config.moveThreshold(), 0.001);
        assertFalse(config.detectMoves());
        assertEquals(2, config.parallelism());
        assertEquals(List.of("ANDROID", "JAVA_8"), config.customProfiles().get("android"));
        assertEquals(List.of("EMBEDDED", "JAVA_11"), config.customProfiles().get("embedded"));
    }

    @Test
    void testLoadConfig_OverridesWin() throws IOException {
        Path yaml = tempDir.resolve("structdiff.yml");
        Files.writeString(yaml, """
                structural_diff:
                  rename_threshold: 0.85
                  include_content: false
                """);

        StructuralDiffConfig config = StructuralDiffSettings.loadConfig(yaml,
                Map.of("rename_threshold", 0.75, "preset", "lenient"));

        assertEquals(0.75, config.renameThreshold(), 0.001);
        assertEquals(0.7, config.similarityThreshold(), 0.001);
        assertFalse(config.includeContent());
    }

    @Test
    void testLoadConfig_MissingFileFallsBackToDefaults() {
        StructuralDiffConfig config = StructuralDiffSettings.loadConfig(tempDir.resolve("absent.yml"), Map.of());

        assertEquals(StructuralDiffConfig.defaults().renameThreshold(), config.renameThreshold(), 0.001);
    }

    @Test
    void testLoadConfig_Classpath() {
        StructuralDiffConfig config = StructuralDiffSettings.loadConfig();

        assertTrue(config.includeNestedTypes());
        assertEquals(List.of("ANDROID"), config.customProfiles().get("android"));
    }

    @Test
    void testInvalidValuesRejected() {
        Map<String, Object> root = Map.of("structural_diff", Map.of("similarity_threshold", 1.5));

        assertThrows(IllegalArgumentException.class, () -> StructuralDiffSettings.fromMap(root, Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> StructuralDiffSettings.fromMap(Map.of(), Map.of("parallelism", 0)));
    }

    @Test
    void testUnknownPresetUsesDefaults() {
        StructuralDiffConfig config = StructuralDiffSettings.fromMap(Map.of(), Map.of("preset", "paranoid"));

        assertEquals(0.8, config.similarityThreshold(), 0.001);
    }

    @Test
    void testToDiffOptions() {
        StructuralDiffConfig config = StructuralDiffConfig.lenient();

        var options = config.toDiffOptions();

        assertEquals(0.7, options.renameThreshold(), 0.001);
        assertEquals(0.85, options.moveThreshold(), 0.001);
        assertTrue(options.detectsRelocations());
        assertEquals("Runnable", config.toClassMatchOptions("Runnable").interfaceName());
    }
}
