package com.social.application.ports;

/**
 * Abstraction over configuration sources.
 * Infrastructure provides implementation (process env, .env file, framework environment).
 */
@FunctionalInterface
public interface ConfigPort {

    /** Raw value for {@code key}, or {@code null} when the source does not define it. */
    String get(String key);

    default String get(String key, String defaultValue) {
        String v = get(key);
        return v == null ? defaultValue : v;
    }
}
