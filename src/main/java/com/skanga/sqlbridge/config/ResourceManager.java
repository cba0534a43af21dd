package com.skanga.sqlbridge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads externalized message templates from YAML resources on the classpath.
 * Loaded files are cached with a TTL.
 *
 * <p>Template formatting failures are propagated as {@link IllegalArgumentException}
 * so broken templates surface immediately.
 */
public class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    static final String ERROR_MESSAGES_RESOURCE = "error-messages.yaml";
    private static final long CACHE_TTL_MINUTES = 60;

    static final ConcurrentHashMap<String, CacheEntry> yamlCache = new ConcurrentHashMap<>();

    static class CacheEntry {
        final Map<String, String> data;
        final Instant timestamp;

        CacheEntry(Map<String, String> data) {
            this.data = data;
            this.timestamp = Instant.now();
        }

        boolean isExpired() {
            return Instant.now().isAfter(timestamp.plusSeconds(CACHE_TTL_MINUTES * 60));
        }
    }

    private ResourceManager() {
    }

    /**
     * Gets an error message with parameters.
     *
     * @param messageKey The error message template key
     * @param paramsList Parameters for {@link MessageFormat} placeholders
     * @return Formatted error message, or a "not found" marker naming the key
     * @throws IllegalArgumentException if template formatting fails
     */
    public static String getErrorMessage(String messageKey, Object... paramsList) {
        if (messageKey == null) {
            return "Error message not found: null";
        }

        Map<String, String> errorMessages = loadYamlResource(ERROR_MESSAGES_RESOURCE);
        String template = errorMessages.getOrDefault(messageKey, "Error message not found: " + messageKey);

        try {
            return MessageFormat.format(template, paramsList);
        } catch (IllegalArgumentException e) {
            String errorMsg = String.format("Failed to format error message '%s' with %d parameters: %s",
                    messageKey, paramsList != null ? paramsList.length : 0, e.getMessage());
            logger.error(errorMsg, e);
            throw new IllegalArgumentException(errorMsg, e);
        }
    }

    static Map<String, String> loadYamlResource(String resourcePath) {
        CacheEntry cachedEntry = yamlCache.get(resourcePath);
        if (cachedEntry != null && !cachedEntry.isExpired()) {
            return cachedEntry.data;
        }

        Map<String, String> yamlMap = new HashMap<>();
        try (InputStream inputStream = ResourceManager.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                logger.warn("YAML resource file not found: {}", resourcePath);
                return yamlMap;
            }
            JsonNode rootNode = yamlMapper.readTree(inputStream);
            rootNode.fields().forEachRemaining(entry -> yamlMap.put(entry.getKey(), entry.getValue().asText()));
            logger.debug("Loaded YAML resource file: {} with {} entries", resourcePath, yamlMap.size());
        } catch (IOException e) {
            logger.error("Failed to load YAML resource file: {}", resourcePath, e);
            return yamlMap;
        }

        yamlCache.put(resourcePath, new CacheEntry(yamlMap));
        return yamlMap;
    }
}
