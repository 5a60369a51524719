package com.gs.ep.pagetranslator.translate;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Translation settings loaded from classpath {@code config.properties}, optionally overlaid by an
 * external properties file and then by JVM system properties with the same keys.
 */
public class TranslationConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationConfig.class);
    private static final String DEFAULT_CONFIG = "config.properties";

    static final ImmutableList<String> KEYS = Lists.immutable.with(
            "translation.source.language", "translation.target.language", "translation.target.code",
            "api.key", "api.url", "api.model",
            "provider.chat.enabled", "provider.google.enabled", "provider.google.url", "provider.google.codes",
            "provider.libre.enabled", "provider.libre.url", "provider.libre.api.key",
            "http.timeout.seconds", "retry.max", "retry.backoff.base.seconds", "chunk.max.chars",
            "pipeline.concurrency", "pipeline.timeout.seconds", "extraction.granularity", "extraction.padding",
            "compositor.default.font.size", "compositor.min.font.size", "font.directory");

    private final Properties properties;

    public TranslationConfig() {
        this(DEFAULT_CONFIG, null);
    }

    /**
     * @param externalFile properties file overriding the classpath defaults, may be {@code null}
     */
    public TranslationConfig(Path externalFile) {
        this(DEFAULT_CONFIG, externalFile);
    }

    TranslationConfig(String classpathResource, Path externalFile) {
        this.properties = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (input == null) {
                LOGGER.warn("Unable to find {} on the classpath, using defaults", classpathResource);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + classpathResource, e);
        }
        if (externalFile != null) {
            if (!Files.isRegularFile(externalFile)) {
                throw new IllegalArgumentException("Configuration file not found: " + externalFile);
            }
            try (InputStream input = Files.newInputStream(externalFile)) {
                properties.load(input);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + externalFile, e);
            }
            LOGGER.info("Loaded configuration overrides from {}", externalFile);
        }
        for (String key : KEYS) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        validate();
    }

    /**
     * Configuration from the given properties only; used by tests and embedding callers.
     */
    public TranslationConfig(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        validate();
    }

    private void validate() {
        getHttpTimeoutSeconds();
        getMaxRetries();
        getBackoffBaseSeconds();
        getChunkMaxChars();
        getConcurrency();
        getPipelineTimeoutSeconds();
        getGranularity();
        getExtractionPadding();
        getDefaultFontSize();
        getMinFontSize();
        if (getMinFontSize() > getDefaultFontSize()) {
            throw new IllegalArgumentException("compositor.min.font.size must not exceed compositor.default.font.size");
        }
    }

    public String getSourceLanguage() {
        return get("translation.source.language", "auto");
    }

    public String getTargetLanguage() {
        return get("translation.target.language", "Swahili");
    }

    public String getTargetCode() {
        return get("translation.target.code", "sw");
    }

    public String getApiKey() {
        return get("api.key", "");
    }

    public String getModelName() {
        return get("api.model", "vendor/meta-llama/Llama-3.3-70B-Instruct");
    }

    public String getApiUrl() {
        return get("api.url", "https://api.siliconflow.cn/v1/chat/completions");
    }

    public boolean isChatProviderEnabled() {
        return Boolean.parseBoolean(get("provider.chat.enabled", "true"));
    }

    public boolean isGoogleProviderEnabled() {
        return Boolean.parseBoolean(get("provider.google.enabled", "true"));
    }

    public String getGoogleUrl() {
        return get("provider.google.url", "https://translate.googleapis.com/translate_a/single");
    }

    /**
     * Language codes the Google provider is tried under, in order; defaults to the target code.
     */
    public ImmutableList<String> getGoogleCodes() {
        String raw = get("provider.google.codes", "");
        if (raw.isEmpty()) {
            return Lists.immutable.with(getTargetCode());
        }
        return Lists.mutable.with(raw.split(","))
                .collect(String::trim)
                .reject(String::isEmpty)
                .toImmutable();
    }

    public boolean isLibreProviderEnabled() {
        return Boolean.parseBoolean(get("provider.libre.enabled", "false"));
    }

    public String getLibreUrl() {
        return get("provider.libre.url", "");
    }

    public String getLibreApiKey() {
        return get("provider.libre.api.key", "");
    }

    public int getHttpTimeoutSeconds() {
        return positiveInt("http.timeout.seconds", 60);
    }

    public int getMaxRetries() {
        return positiveInt("retry.max", 4);
    }

    public double getBackoffBaseSeconds() {
        double value = parseDouble("retry.backoff.base.seconds", 1.5);
        if (value < 0) {
            throw new IllegalArgumentException("retry.backoff.base.seconds must not be negative: " + value);
        }
        return value;
    }

    public int getChunkMaxChars() {
        return positiveInt("chunk.max.chars", 4500);
    }

    public int getConcurrency() {
        return positiveInt("pipeline.concurrency", 3);
    }

    /**
     * Overall deadline for one page's translations; 0 disables it.
     */
    public long getPipelineTimeoutSeconds() {
        int value = parseInt("pipeline.timeout.seconds", 0);
        if (value < 0) {
            throw new IllegalArgumentException("pipeline.timeout.seconds must not be negative: " + value);
        }
        return value;
    }

    public ExtractionGranularity getGranularity() {
        return ExtractionGranularity.fromString(get("extraction.granularity", "LINE"));
    }

    public float getExtractionPadding() {
        double value = parseDouble("extraction.padding", 2);
        if (value < 0) {
            throw new IllegalArgumentException("extraction.padding must not be negative: " + value);
        }
        return (float) value;
    }

    public float getDefaultFontSize() {
        return positiveFloat("compositor.default.font.size", 12);
    }

    public float getMinFontSize() {
        return positiveFloat("compositor.min.font.size", 6);
    }

    /**
     * Directory holding a {@code *-Regular.ttf} family to embed; empty for Helvetica.
     */
    public String getFontDirectory() {
        return get("font.directory", "");
    }

    private String get(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }

    private int parseInt(String key, int defaultValue) {
        String value = get(key, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private double parseDouble(String key, double defaultValue) {
        String value = get(key, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private int positiveInt(String key, int defaultValue) {
        int value = parseInt(key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return value;
    }

    private float positiveFloat(String key, float defaultValue) {
        double value = parseDouble(key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return (float) value;
    }
}
