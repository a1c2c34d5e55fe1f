package com.social.api.wiring;

import com.social.application.config.AppConfig;
import com.social.application.config.ConfigResolver;
import com.social.application.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpringEnvironmentConfigPortTest {

  @Test
  void resolvesKeysThroughEnvironment() {
    MockEnvironment env = new MockEnvironment()
        .withProperty("SERVICE_NAME", "social")
        .withProperty("SERVER_PORT", "notanumber");

    AppConfig cfg = new ConfigResolver().resolve(new SpringEnvironmentConfigPort(env));

    assertThat(cfg.serviceName()).isEqualTo("social");
    assertThat(cfg.serverPort()).isEqualTo(8081);
  }

  @Test
  void missingServiceNameFails() {
    assertThatThrownBy(() -> new ConfigResolver().resolve(new SpringEnvironmentConfigPort(new MockEnvironment())))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("SERVICE_NAME");
  }
}
