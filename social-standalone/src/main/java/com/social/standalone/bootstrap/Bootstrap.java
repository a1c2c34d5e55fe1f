package com.social.standalone.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.application.config.AppConfig;
import com.social.application.config.ConfigResolver;
import com.social.application.http.ApiErrors;
import com.social.application.http.JsonMappers;
import com.social.application.ports.ConfigPort;
import com.social.application.routing.ApiDispatcher;
import com.social.application.routing.ApiRoutes;
import com.social.application.service.UserService;
import com.social.infrastructure.db.DataSourceFactory;
import com.social.infrastructure.db.JdbcUserStore;
import com.social.infrastructure.security.BcryptPasswordHasher;
import com.social.standalone.server.StandaloneServer;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;

/**
 * Hand wiring for the standalone listener: the same components the Spring entry point
 * registers as beans, built in dependency order.
 */
public final class Bootstrap {

    private Bootstrap() {
    }

    /**
     * Resolves configuration from {@code source} and binds to SERVER_PORT.
     */
    public static StandaloneServer createServer(ConfigPort source) throws IOException {
        AppConfig config = new ConfigResolver().resolve(source);
        return createServer(config, config.serverPort());
    }

    /**
     * Wires a server for an already resolved config. {@code port} 0 picks an ephemeral port.
     */
    public static StandaloneServer createServer(AppConfig config, int port) throws IOException {
        HikariDataSource dataSource = DataSourceFactory.create(config.database(), config.serviceName() + "-pool");
        try {
            ObjectMapper json = JsonMappers.standard();
            ApiErrors errors = new ApiErrors(json);
            UserService users = new UserService(
                    new JdbcUserStore(new JdbcTemplate(dataSource)),
                    new BcryptPasswordHasher()
            );
            ApiDispatcher dispatcher = new ApiDispatcher(ApiRoutes.create(config, users, json, errors), errors);

            return StandaloneServer.bind(config, port, dispatcher, dataSource);
        } catch (IOException | RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }
}
