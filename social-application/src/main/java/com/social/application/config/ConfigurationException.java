package com.social.application.config;

import java.util.List;

/**
 * Configuration could not be resolved. Fatal at startup; the entry point decides how to exit.
 */
public final class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
