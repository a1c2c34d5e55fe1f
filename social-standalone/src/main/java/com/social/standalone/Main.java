package com.social.standalone;

import com.social.application.config.ConfigurationException;
import com.social.infrastructure.config.EnvConfigService;
import com.social.standalone.bootstrap.Bootstrap;
import com.social.standalone.server.StandaloneServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        StandaloneServer server;
        try {
            server = Bootstrap.createServer(EnvConfigService.fromProcess());
        } catch (ConfigurationException e) {
            log.error("Startup aborted: {}", e.getMessage());
            System.exit(1);
            return;
        } catch (IOException e) {
            log.error("Startup aborted: cannot bind listener", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "social-shutdown"));
        server.start();
    }
}
