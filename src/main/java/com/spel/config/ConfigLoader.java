package com.spel.config;

import com.spel.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads parser configuration from YAML files.
 * <pre>
 * spel:
 *   maximum-expression-length: 10000
 *   auto-grow-collections: false
 *   auto-grow-null-references: false
 *   template:
 *     prefix: "#{"
 *     suffix: "}"
 * </pre>
 * The {@code spel} section is optional; the keys may also sit at the document root.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     * @throws ConfigurationException if the file cannot be read or holds invalid values
     */
    public static ParserConfiguration load(String path) {
        log.info("Loading expression parser configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static ParserConfiguration parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        Map<String, Object> spelConfig = root.containsKey("spel")
                ? (Map<String, Object>) root.get("spel")
                : root;
        if (spelConfig == null) {
            spelConfig = Map.of();
        }

        Map<String, Object> templateConfig = (Map<String, Object>) spelConfig.get("template");
        if (templateConfig == null) {
            templateConfig = Map.of();
        }

        ParserConfiguration config = new ParserConfiguration(
                getInt(spelConfig, "maximum-expression-length", ParserConfiguration.DEFAULT_MAX_EXPRESSION_LENGTH),
                getBoolean(spelConfig, "auto-grow-collections", false),
                getBoolean(spelConfig, "auto-grow-null-references", false),
                getString(templateConfig, "prefix", ParserContext.DEFAULT_PREFIX),
                getString(templateConfig, "suffix", ParserContext.DEFAULT_SUFFIX)
        );

        log.info("Loaded expression parser configuration: max length {}, auto-grow collections {}, template {}...{}",
                config.maximumExpressionLength(), config.autoGrowCollections(),
                config.templatePrefix(), config.templateSuffix());

        return config;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
