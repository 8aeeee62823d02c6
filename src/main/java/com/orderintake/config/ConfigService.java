package com.orderintake.config;

import com.orderintake.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Central entry point for resolving configuration values.
 * <p>
 * Each key is looked up as a system property ({@code orderintake.<key>}), then as an
 * environment variable ({@code ORDERINTAKE_<KEY>}), then in the classpath file
 * {@value #PROPERTIES_RESOURCE}, and finally falls back to a built-in default.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    static final String PROPERTIES_RESOURCE = "order-intake.properties";

    static final String KEY_CATALOG_PATH = "catalog.path";
    static final String KEY_MATCH_THRESHOLD = "match.threshold";
    static final String KEY_CANDIDATE_THRESHOLD = "candidate.threshold";
    static final String KEY_SUGGESTION_CUTOFF = "suggestion.cutoff";
    static final String KEY_SUGGESTION_LIMIT = "suggestion.limit";
    static final String KEY_KEEP_CONFIDENCE = "keep.confidence";

    private static final String DEFAULT_CATALOG_PATH = "content/Product Catalog.csv";

    private static final ConfigService INSTANCE = new ConfigService(
        System::getProperty,
        System::getenv,
        loadFileProperties()
    );

    private final UnaryOperator<String> systemProperties;
    private final UnaryOperator<String> environment;
    private final Properties fileProperties;

    ConfigService(UnaryOperator<String> systemProperties,
                  UnaryOperator<String> environment,
                  Properties fileProperties) {
        this.systemProperties = systemProperties;
        this.environment = environment;
        this.fileProperties = fileProperties == null ? new Properties() : fileProperties;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public Path getCatalogPath() {
        String value = resolve(KEY_CATALOG_PATH);
        return Paths.get(value == null ? DEFAULT_CATALOG_PATH : value);
    }

    public ExtractionSettings getExtractionSettings() {
        return new ExtractionSettings(
            parseRatio(KEY_MATCH_THRESHOLD, ExtractionSettings.DEFAULT_MATCH_THRESHOLD),
            parseRatio(KEY_CANDIDATE_THRESHOLD, ExtractionSettings.DEFAULT_CANDIDATE_THRESHOLD),
            parseRatio(KEY_SUGGESTION_CUTOFF, ExtractionSettings.DEFAULT_SUGGESTION_CUTOFF),
            parseCount(KEY_SUGGESTION_LIMIT, ExtractionSettings.DEFAULT_SUGGESTION_LIMIT),
            parseRatio(KEY_KEEP_CONFIDENCE, ExtractionSettings.DEFAULT_KEEP_CONFIDENCE)
        );
    }

    String resolve(String key) {
        return firstNonBlank(
            systemProperties.apply("orderintake." + key),
            environment.apply("ORDERINTAKE_" + key.toUpperCase(Locale.ROOT).replace('.', '_')),
            fileProperties.getProperty(key)
        );
    }

    private double parseRatio(String key, double fallback) {
        String raw = resolve(key);
        if (raw == null) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw);
            if (value < 0.0 || value > 1.0) {
                LOGGER.warning("Ignoring out-of-range value for '%s': %s".formatted(key, raw));
                return fallback;
            }
            return value;
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring malformed value for '%s': %s".formatted(key, raw));
            return fallback;
        }
    }

    private int parseCount(String key, int fallback) {
        String raw = resolve(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Math.max(0, Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring malformed value for '%s': %s".formatted(key, raw));
            return fallback;
        }
    }

    private static Properties loadFileProperties() {
        Properties props = new Properties();
        try (InputStream stream = ConfigService.class
            .getClassLoader()
            .getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ex) {
            LOGGER.warning("Failed to read " + PROPERTIES_RESOURCE + ": " + ex.getMessage());
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
