package com.social.api.diagnostics;

import com.social.application.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.diagnostics.FailureAnalysis;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationFailureAnalyzerTest {

  @Test
  void reportsEveryProblemFromWrappedCause() {
    var cause = new ConfigurationException(List.of("SERVICE_NAME is required"));
    var wrapped = new BeanCreationException("appConfig", "Failed to instantiate", cause);

    FailureAnalysis analysis = new ConfigurationFailureAnalyzer().analyze(wrapped);

    assertThat(analysis).isNotNull();
    assertThat(analysis.getDescription()).contains("SERVICE_NAME is required");
    assertThat(analysis.getAction()).contains("environment variables");
  }
}
