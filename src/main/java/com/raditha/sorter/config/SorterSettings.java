package com.raditha.sorter.config;

import com.raditha.sorter.model.Visibility;
import com.raditha.sorter.syntax.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads sorter configuration from a YAML file with CLI overrides.
 * <p>
 * The file holds an {@code elements_sorter} section with snake_case keys:
 * <pre>
 * elements_sorter:
 *   sort_properties: true
 *   default_visibility: protected
 *   language: php
 * </pre>
 * Configuration priority: CLI arguments > YAML > defaults
 */
public class SorterSettings {

    private static final Logger logger = LoggerFactory.getLogger(SorterSettings.class);
    static final String CONFIG_KEY = "elements_sorter";

    private SorterSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile         YAML file, or null for defaults only
     * @param visibilityCLI      CLI default visibility (null = use YAML/default)
     * @param languageCLI        CLI language (null = use YAML/default)
     * @param removeUnusedCLI    CLI pruning switch (null = use YAML/default)
     * @return complete configuration
     * @throws IllegalArgumentException if the file cannot be read or holds invalid values
     */
    public static SorterConfig loadConfig(Path configFile, String visibilityCLI, String languageCLI,
            Boolean removeUnusedCLI) {
        Map<String, Object> config = configFile == null ? Map.of() : readSection(configFile);
        SorterConfig defaults = SorterConfig.defaults();

        String visibility = visibilityCLI != null
                ? visibilityCLI
                : getString(config, "default_visibility", defaults.defaultVisibility().keyword());
        String language = languageCLI != null
                ? languageCLI
                : getString(config, "language", defaults.language().tag());
        boolean removeUnused = removeUnusedCLI != null
                ? removeUnusedCLI
                : getBoolean(config, "remove_unused_imports", defaults.removeUnusedImports());

        return new SorterConfig(
                getBoolean(config, "sort_properties", defaults.sortProperties()),
                getBoolean(config, "sort_traits", defaults.sortTraits()),
                getBoolean(config, "sort_namespace_uses", defaults.sortNamespaceUses()),
                getBoolean(config, "sort_constants", defaults.sortConstants()),
                removeUnused,
                getBoolean(config, "add_newline_between_const_and_properties",
                        defaults.addNewlineBetweenConstAndProperties()),
                getBoolean(config, "add_visibility_spacing", defaults.addVisibilitySpacing()),
                Visibility.fromString(visibility),
                Language.fromString(language));
    }

    public static SorterConfig loadConfig(Path configFile) {
        return loadConfig(configFile, null, null, null);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> readSection(Path configFile) {
        Object root;
        try (InputStream in = Files.newInputStream(configFile)) {
            root = new Yaml().load(in);
        } catch (IOException | YAMLException e) {
            throw new IllegalArgumentException("Cannot read config file " + configFile + ": " + e.getMessage(), e);
        }
        if (root instanceof Map<?, ?> map && map.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            return (Map<String, Object>) section;
        }
        logger.warn("No {} section in {}, using defaults", CONFIG_KEY, configFile);
        return Map.of();
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value + ". Must be true or false");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
