package com.arbiter.ruleengine.infra.config;

/**
 * Reads settings from the environment, falling back to system properties.
 */
public final class Config {

    private Config() {
        throw new AssertionError("No instances");
    }

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " is not an integer: " + value, e);
        }
    }
}
