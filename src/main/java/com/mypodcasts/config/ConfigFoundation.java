package com.mypodcasts.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Type safe accessors over a map read from a JSON5 file.
 * <p>Keys may be dotted to reach into nested objects.
 * A system property named <i>mypodcasts.&lt;key&gt;</i> takes precedence over the file value for scalar lookups.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    /**
     * System property prefix.
     */
    public static final String PROPERTY_PREFIX = "mypodcasts.";

    private static final Gson GSON = new GsonBuilder()
            .setStrictness(Strictness.LENIENT)
            .create();

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new ConfigFoundation instance with an empty map.
     */
    public ConfigFoundation() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = GSON.fromJson(content, MAP_TYPE);
            this.map = parsed != null ? parsed : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks if key is set either in the map or as system property.
     *
     * @param key Dotted key.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        return System.getProperty(PROPERTY_PREFIX + key) != null || lookup(key) != null;
    }

    /**
     * Gets property as string.
     *
     * @param key Dotted key.
     * @return String or null.
     */
    public String getStringProperty(String key) {
        return getStringProperty(key, null);
    }

    /**
     * Gets property as string.
     *
     * @param key          Dotted key.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        Object value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }

        if (value instanceof Double && ((Double) value) == Math.rint((Double) value)) {
            return String.valueOf(((Double) value).longValue());
        }

        return String.valueOf(value);
    }

    /**
     * Gets property as long.
     * <p>JSON numbers come in as doubles and are truncated.
     *
     * @param key          Dotted key.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String key, Long defaultValue) {
        Object value = getProperty(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }

        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Configuration key " + key + " is not a number: " + value, e);
            }
        }

        return defaultValue;
    }

    /**
     * Gets property as boolean.
     *
     * @param key Dotted key.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key) {
        return getBooleanProperty(key, false);
    }

    /**
     * Gets property as boolean.
     *
     * @param key          Dotted key.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        Object value = getProperty(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }

        return defaultValue;
    }

    /**
     * Gets property as map.
     *
     * @param key Dotted key.
     * @return Map, empty if absent or not an object.
     */
    public Map<String, Object> getMapProperty(String key) {
        Object value = lookup(key);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    /**
     * Gets property as list.
     *
     * @param key Dotted key.
     * @return List, empty if absent or not an array.
     */
    public List<Object> getListProperty(String key) {
        Object value = lookup(key);
        return value instanceof List ? (List<Object>) value : Collections.emptyList();
    }

    /**
     * Gets scalar property with system property override.
     *
     * @param key Dotted key.
     * @return Object or null.
     */
    protected Object getProperty(String key) {
        String override = System.getProperty(PROPERTY_PREFIX + key);
        return override != null ? override : lookup(key);
    }

    /**
     * Walks dotted key through nested maps.
     *
     * @param key Dotted key.
     * @return Object or null.
     */
    private Object lookup(String key) {
        if (map.containsKey(key)) {
            return map.get(key);
        }

        Object current = map;
        for (String segment : key.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(segment);
        }

        return current;
    }
}
