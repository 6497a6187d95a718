package com.raditha.structdiff.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link StructuralDiffConfig} from YAML with explicit overrides.
 * <p>
 * Settings live under the {@code structural_diff} key of {@code structdiff.yml}:
 * <pre>
 * structural_diff:
 *   preset: strict
 *   rename_threshold: 0.85
 *   detect_moves: false
 *   profiles:
 *     android: [ANDROID, JAVA_8]
 * </pre>
 * Configuration priority: overrides > YAML > preset > defaults.
 */
public class StructuralDiffSettings {

    private static final Logger logger = LoggerFactory.getLogger(StructuralDiffSettings.class);

    public static final String DEFAULT_RESOURCE = "structdiff.yml";
    static final String CONFIG_KEY = "structural_diff";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private StructuralDiffSettings() {
    }

    /**
     * Load from {@code structdiff.yml} on the classpath, or defaults when absent.
     */
    public static StructuralDiffConfig loadConfig() {
        return fromMap(readClasspath(DEFAULT_RESOURCE), Map.of());
    }

    /**
     * Load from a YAML file, applying overrides keyed like the YAML entries.
     * An unreadable file is logged and ignored.
     */
    public static StructuralDiffConfig loadConfig(Path yamlFile, Map<String, Object> overrides) {
        Map<String, Object> root = Map.of();
        try {
            root = readFile(yamlFile);
        } catch (IOException e) {
            logger.warn("Could not read configuration {}: {}", yamlFile, e.getMessage());
        }
        return fromMap(root, overrides);
    }

    /**
     * Read a YAML document into a map.
     *
     * @throws IOException if the file cannot be read or is not a YAML mapping
     */
    public static Map<String, Object> readFile(Path yamlFile) throws IOException {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            Map<String, Object> map = YAML.readValue(in, new TypeReference<Map<String, Object>>() {
            });
            return map != null ? map : Map.of();
        }
    }

    static Map<String, Object> readClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = StructuralDiffSettings.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", resource);
                return Map.of();
            }
            Map<String, Object> map = YAML.readValue(in, new TypeReference<Map<String, Object>>() {
            });
            return map != null ? map : Map.of();
        } catch (IOException e) {
            logger.warn("Could not read configuration {}: {}", resource, e.getMessage());
            return Map.of();
        }
    }

    /**
     * Build a configuration from a parsed YAML document.
     *
     * @param root      the whole document; settings are read from its {@code structural_diff} entry
     * @param overrides values that win over the document, keyed like the YAML entries
     */
    public static StructuralDiffConfig fromMap(Map<String, Object> root, Map<String, Object> overrides) {
        Map<String, Object> config = new LinkedHashMap<>();
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> yamlConfig = (Map<String, Object>) section;
            config.putAll(yamlConfig);
        } else if (section != null) {
            logger.warn("Ignoring '{}': expected a mapping but found {}", CONFIG_KEY, section.getClass().getSimpleName());
        }
        config.putAll(overrides);

        StructuralDiffConfig base = preset(getString(config, "preset", null));

        return new StructuralDiffConfig(
                getDouble(config, "similarity_threshold", base.similarityThreshold()),
                getDouble(config, "rename_threshold", base.renameThreshold()),
                getDouble(config, "move_threshold", base.moveThreshold()),
                getBoolean(config, "detect_renames", base.detectRenames()),
                getBoolean(config, "detect_moves", base.detectMoves()),
                getBoolean(config, "include_content", base.includeContent()),
                getBoolean(config, "include_nested_types", base.includeNestedTypes()),
                getInt(config, "parallelism", base.parallelism()),
                getString(config, "language_level", base.languageLevel()),
                getProfiles(config));
    }

    static StructuralDiffConfig preset(String name) {
        if (name == null) {
            return StructuralDiffConfig.defaults();
        }
        return switch (name) {
            case "strict" -> StructuralDiffConfig.strict();
            case "lenient" -> StructuralDiffConfig.lenient();
            case "default" -> StructuralDiffConfig.defaults();
            default -> {
                logger.warn("Unknown preset '{}', using defaults", name);
                yield StructuralDiffConfig.defaults();
            }
        };
    }

    private static Map<String, List<String>> getProfiles(Map<String, Object> config) {
        Object value = config.get("profiles");
        if (!(value instanceof Map<?, ?> profiles)) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        profiles.forEach((name, symbols) -> {
            List<String> list = new ArrayList<>();
            if (symbols instanceof List<?> items) {
                items.forEach(item -> list.add(String.valueOf(item)));
            } else if (symbols != null) {
                for (String symbol : symbols.toString().split("[,;\\s]+")) {
                    if (!symbol.isBlank()) {
                        list.add(symbol);
                    }
                }
            }
            result.put(String.valueOf(name), list);
        });
        return result;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
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
}
