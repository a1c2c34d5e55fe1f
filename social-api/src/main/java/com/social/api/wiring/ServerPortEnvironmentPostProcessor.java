package com.social.api.wiring;

import com.social.application.config.ConfigResolver;
import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.SystemEnvironmentPropertySource;

import java.util.Map;

/**
 * Pins {@code server.port} to the resolved SERVER_PORT.
 *
 * Relaxed binding would otherwise read the raw SERVER_PORT variable as {@code server.port}
 * and fail startup on a value the resolver falls back from. A {@code server.port} set
 * anywhere other than the OS environment (command line, test properties, yml) is left alone.
 */
public class ServerPortEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

  static final String PROPERTY_SOURCE_NAME = "socialServerPort";
  static final String SERVER_PORT = "server.port";

  // wraps every other source, so it always "contains" server.port when anything does
  private static final String ATTACHED_SOURCE_NAME = "configurationProperties";

  private final Log log;

  public ServerPortEnvironmentPostProcessor(DeferredLogFactory logFactory) {
    this.log = logFactory.getLog(ServerPortEnvironmentPostProcessor.class);
  }

  @Override
  public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
    if (hasExplicitServerPort(environment)) {
      log.info("server.port is set explicitly; SERVER_PORT is not applied");
      return;
    }
    int port = new ConfigResolver().serverPort(environment::getProperty);
    environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(SERVER_PORT, port)));
  }

  private static boolean hasExplicitServerPort(ConfigurableEnvironment environment) {
    for (PropertySource<?> source : environment.getPropertySources()) {
      if (source instanceof SystemEnvironmentPropertySource) continue;
      if (ATTACHED_SOURCE_NAME.equals(source.getName())) continue;
      if (source.containsProperty(SERVER_PORT)) return true;
    }
    return false;
  }

  @Override
  public int getOrder() {
    // after config data, so profile yml files are visible
    return Ordered.LOWEST_PRECEDENCE;
  }
}
