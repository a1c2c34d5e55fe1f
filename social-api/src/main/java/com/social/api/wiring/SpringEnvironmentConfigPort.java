package com.social.api.wiring;

import com.social.application.ports.ConfigPort;
import org.springframework.core.env.Environment;

/**
 * {@link ConfigPort} over Spring's {@link Environment}: OS environment variables, system
 * properties and application/test properties all resolve by their exact key.
 */
public final class SpringEnvironmentConfigPort implements ConfigPort {

  private final Environment environment;

  public SpringEnvironmentConfigPort(Environment environment) {
    this.environment = environment;
  }

  @Override
  public String get(String key) {
    return environment.getProperty(key);
  }
}
