package com.social.api.wiring;

import com.social.api.SocialApiApplication;
import com.social.application.config.AppConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.web.servlet.context.ServletWebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.env.SystemEnvironmentPropertySource;

import java.net.ServerSocket;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.core.env.StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME;

class ServerPortEnvironmentPostProcessorTest {

  private final ServerPortEnvironmentPostProcessor processor =
      new ServerPortEnvironmentPostProcessor(Supplier::get);

  /** Environment whose OS variables are exactly {@code osEnv}, attached the way Boot does it. */
  private static StandardEnvironment osEnvironment(Map<String, Object> osEnv) {
    StandardEnvironment env = new StandardEnvironment();
    env.getPropertySources().replace(SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME,
        new SystemEnvironmentPropertySource(SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME, osEnv));
    ConfigurationPropertySources.attach(env);
    return env;
  }

  private static Map<String, Object> osVars(String... kv) {
    Map<String, Object> m = new HashMap<>();
    m.put("SERVICE_NAME", "social-port-test");
    for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
    return m;
  }

  @Test
  void unparseableServerPortFallsBackInsteadOfReachingBinder() {
    StandardEnvironment env = osEnvironment(osVars("SERVER_PORT", "notanumber"));
    assertThat(env.getProperty("server.port")).isEqualTo("notanumber");

    processor.postProcessEnvironment(env, new SpringApplication());

    assertThat(env.getProperty("server.port", Integer.class)).isEqualTo(8081);
  }

  @Test
  void outOfRangeServerPortFallsBack() {
    StandardEnvironment env = osEnvironment(osVars("SERVER_PORT", "70000"));

    processor.postProcessEnvironment(env, new SpringApplication());

    assertThat(env.getProperty("server.port", Integer.class)).isEqualTo(8081);
  }

  @Test
  void validServerPortIsApplied() {
    StandardEnvironment env = osEnvironment(osVars("SERVER_PORT", "9123"));

    processor.postProcessEnvironment(env, new SpringApplication());

    assertThat(env.getProperty("server.port", Integer.class)).isEqualTo(9123);
  }

  @Test
  void unsetServerPortUsesDefault() {
    StandardEnvironment env = osEnvironment(osVars());

    processor.postProcessEnvironment(env, new SpringApplication());

    assertThat(env.getProperty("server.port", Integer.class)).isEqualTo(8081);
  }

  @Test
  void explicitServerPortPropertyWins() {
    StandardEnvironment env = osEnvironment(osVars("SERVER_PORT", "9123"));
    env.getPropertySources().addFirst(new MapPropertySource("test", Map.of("server.port", "0")));

    processor.postProcessEnvironment(env, new SpringApplication());

    assertThat(env.getPropertySources().contains(ServerPortEnvironmentPostProcessor.PROPERTY_SOURCE_NAME)).isFalse();
    assertThat(env.getProperty("server.port", Integer.class)).isEqualTo(0);
  }

  @Test
  void applicationStartsWithUnparseableServerPort() {
    StandardEnvironment env = osEnvironment(osVars(
        "SERVER_PORT", "notanumber",
        "DB_ADDR", "jdbc:h2:mem:port_fallback;DB_CLOSE_DELAY=-1"));

    SpringApplication app = new SpringApplication(SocialApiApplication.class);
    app.setWebApplicationType(WebApplicationType.NONE);
    app.setEnvironment(env);

    try (ConfigurableApplicationContext ctx = app.run()) {
      assertThat(ctx.getBean(AppConfig.class).serverPort()).isEqualTo(8081);
      assertThat(ctx.getEnvironment().getProperty("server.port", Integer.class)).isEqualTo(8081);
    }
  }

  @Test
  void webServerBindsToServerPortFromOsEnvironment() throws Exception {
    int port;
    try (ServerSocket s = new ServerSocket(0)) {
      port = s.getLocalPort();
    }
    StandardEnvironment env = osEnvironment(osVars(
        "SERVER_PORT", String.valueOf(port),
        "DB_ADDR", "jdbc:h2:mem:port_bind;DB_CLOSE_DELAY=-1"));

    SpringApplication app = new SpringApplication(SocialApiApplication.class);
    app.setEnvironment(env);

    try (ConfigurableApplicationContext ctx = app.run()) {
      assertThat(((ServletWebServerApplicationContext) ctx).getWebServer().getPort()).isEqualTo(port);
    }
  }
}
