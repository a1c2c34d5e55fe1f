package com.social.standalone.server;

import com.social.application.config.AppConfig;
import com.social.application.routing.ApiDispatcher;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JDK {@link HttpServer} over the route table, served by a fixed pool of
 * SERVER_WORKER_THREADS workers. {@link #close()} stops accepting, drains in-flight
 * exchanges for up to {@link #STOP_DELAY_SECONDS} and releases the connection pool.
 */
public final class StandaloneServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StandaloneServer.class);

    public static final int STOP_DELAY_SECONDS = 5;

    private final AppConfig config;
    private final HttpServer server;
    private final ExecutorService workers;
    private final AutoCloseable resources;
    private final AtomicBoolean closed = new AtomicBoolean();

    private StandaloneServer(AppConfig config, HttpServer server, ExecutorService workers, AutoCloseable resources) {
        this.config = config;
        this.server = server;
        this.workers = workers;
        this.resources = resources;
    }

    /**
     * Binds the listener without starting it.
     *
     * @param resources closed after the listener stops (typically the connection pool)
     * @throws IOException when the port cannot be bound
     */
    public static StandaloneServer bind(AppConfig config, int port, ApiDispatcher dispatcher, AutoCloseable resources)
            throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        ExecutorService workers = Executors.newFixedThreadPool(config.serverWorkerThreads(), workerThreads());
        server.setExecutor(workers);
        server.createContext("/", new RouteTableHttpHandler(dispatcher, config.requestTimeout()));
        return new StandaloneServer(config, server, workers, resources);
    }

    public void start() {
        server.start();
        log.info("{} listening on port {} ({} workers, env={})",
                config.serviceName(), port(), config.serverWorkerThreads(), config.envName());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        log.info("Shutting down {}", config.serviceName());
        server.stop(STOP_DELAY_SECONDS);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(STOP_DELAY_SECONDS, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            resources.close();
        } catch (Exception e) {
            log.warn("Failed to release resources on shutdown", e);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "http-worker-" + seq.incrementAndGet());
            t.setDaemon(false);
            return t;
        };
    }
}
