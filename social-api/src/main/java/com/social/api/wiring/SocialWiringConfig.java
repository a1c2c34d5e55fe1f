package com.social.api.wiring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.application.config.AppConfig;
import com.social.application.config.ConfigResolver;
import com.social.application.http.ApiErrors;
import com.social.application.http.JsonMappers;
import com.social.application.ports.ConfigPort;
import com.social.application.ports.PasswordHasher;
import com.social.application.ports.UserStore;
import com.social.application.routing.ApiDispatcher;
import com.social.application.routing.ApiRoutes;
import com.social.application.service.UserService;
import com.social.infrastructure.db.DataSourceFactory;
import com.social.infrastructure.db.JdbcUserStore;
import com.social.infrastructure.security.BcryptPasswordHasher;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Framework-side wiring. Every component gets the resolved {@link AppConfig} by injection;
 * there is no static configuration holder.
 */
@Configuration
public class SocialWiringConfig {

  @Bean
  public ConfigPort configPort(Environment environment) {
    return new SpringEnvironmentConfigPort(environment);
  }

  @Bean
  public AppConfig appConfig(ConfigPort configPort) {
    return new ConfigResolver().resolve(configPort);
  }

  @Bean
  public ObjectMapper objectMapper() {
    return JsonMappers.standard();
  }

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(AppConfig config) {
    return DataSourceFactory.create(config.database(), config.serviceName() + "-pool");
  }

  @Bean
  public UserStore userStore(JdbcTemplate jdbcTemplate) {
    return new JdbcUserStore(jdbcTemplate);
  }

  @Bean
  public PasswordHasher passwordHasher() {
    return new BcryptPasswordHasher();
  }

  @Bean
  public UserService userService(UserStore userStore, PasswordHasher passwordHasher) {
    return new UserService(userStore, passwordHasher);
  }

  @Bean
  public ApiErrors apiErrors(ObjectMapper objectMapper) {
    return new ApiErrors(objectMapper);
  }

  @Bean
  public ApiDispatcher apiDispatcher(AppConfig config, UserService userService, ObjectMapper objectMapper, ApiErrors apiErrors) {
    return new ApiDispatcher(ApiRoutes.create(config, userService, objectMapper, apiErrors), apiErrors);
  }
}
