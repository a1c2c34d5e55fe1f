package com.social.api.diagnostics;

import com.social.application.config.ConfigurationException;
import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;

/**
 * Turns a configuration failure during startup into a readable report instead of a bean
 * creation stack trace.
 */
public class ConfigurationFailureAnalyzer extends AbstractFailureAnalyzer<ConfigurationException> {

  @Override
  protected FailureAnalysis analyze(Throwable rootFailure, ConfigurationException cause) {
    StringBuilder description = new StringBuilder("The service configuration could not be resolved:");
    for (String problem : cause.problems()) {
      description.append(System.lineSeparator()).append("  - ").append(problem);
    }
    return new FailureAnalysis(
        description.toString(),
        "Set the missing or invalid environment variables (see SERVICE_NAME, SERVER_PORT, DB_ADDR) and restart.",
        cause);
  }
}
