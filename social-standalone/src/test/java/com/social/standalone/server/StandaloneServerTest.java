package com.social.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.application.config.AppConfig;
import com.social.application.config.DatabaseConfig;
import com.social.standalone.bootstrap.Bootstrap;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class StandaloneServerTest {

    private static final String DB_URL = "jdbc:h2:mem:standalone_test;DB_CLOSE_DELAY=-1";

    private static StandaloneServer server;
    private static final HttpClient http = HttpClient.newHttpClient();
    private static final ObjectMapper json = new ObjectMapper();

    @BeforeAll
    static void startServer() throws Exception {
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql"))
                .execute(new DriverManagerDataSource(DB_URL));

        AppConfig config = new AppConfig("social-standalone-test", "test", 8081, Duration.ofSeconds(10), 4,
                new DatabaseConfig(DB_URL, 4, 1, Duration.ofMinutes(1)));
        server = Bootstrap.createServer(config, 0);
        server.start();
    }

    @AfterAll
    static void stopServer() {
        if (server != null) server.close();
    }

    private static HttpResponse<String> send(HttpRequest.Builder b) throws Exception {
        return http.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static HttpRequest.Builder to(String path) {
        return HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path));
    }

    private static HttpRequest.Builder postJson(String path, String body) {
        return to(path).header("Content-Type", "application/json").POST(HttpRequest.BodyPublishers.ofString(body));
    }

    @Test
    void exampleReturnsExactBody() throws Exception {
        HttpResponse<String> res = send(to("/example").header("Accept", "text/plain").GET());

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.headers().firstValue("Content-Type")).hasValue("application/json");
        assertThat(res.body()).isEqualTo("{\"status\":\"ok\"}");
    }

    @Test
    void unregisteredMethodOrPathIs404() throws Exception {
        HttpResponse<String> wrongPath = send(to("/missing").GET());
        HttpResponse<String> wrongMethod = send(postJson("/example", "{}"));

        assertThat(wrongPath.statusCode()).isEqualTo(404);
        assertThat(wrongMethod.statusCode()).isEqualTo(404);
        assertThat(json.readTree(wrongMethod.body()).get("reason").asText()).isEqualTo("not_found");
    }

    @Test
    void createsUserAndRejectsDuplicateEmail() throws Exception {
        String name = "dana-" + UUID.randomUUID();
        String email = name + "@example.com";

        HttpResponse<String> created = send(postJson("/v1/users",
                "{\"username\":\"" + name + "\",\"email\":\"" + email + "\",\"password\":\"hunter22\"}"));

        assertThat(created.statusCode()).isEqualTo(201);
        assertThat(created.body()).doesNotContain("hunter22");
        JsonNode body = json.readTree(created.body());
        assertThat(body.get("id").asLong()).isPositive();
        assertThat(body.get("created_at").asText()).isNotBlank();

        HttpResponse<String> dup = send(postJson("/v1/users",
                "{\"username\":\"other-" + name + "\",\"email\":\"" + email + "\",\"password\":\"hunter22\"}"));

        assertThat(dup.statusCode()).isEqualTo(409);
        assertThat(json.readTree(dup.body()).get("message").asText()).isEqualTo("email already exists");
    }

    @Test
    void echoesProvidedRequestId() throws Exception {
        HttpResponse<String> res = send(postJson("/v1/users", "[]").header("X-Request-Id", "trace-77"));

        assertThat(res.statusCode()).isEqualTo(400);
        assertThat(res.headers().firstValue("X-Request-Id")).hasValue("trace-77");
        assertThat(json.readTree(res.body()).get("requestId").asText()).isEqualTo("trace-77");
    }

    @Test
    void generatesRequestIdWhenAbsent() throws Exception {
        HttpResponse<String> res = send(to("/example").GET());

        assertThat(res.headers().firstValue("X-Request-Id")).isPresent().get().asString().isNotBlank();
    }

    @Test
    void closeIsIdempotent() throws Exception {
        AppConfig config = new AppConfig("svc", "test", 8081, Duration.ofSeconds(1), 1,
                new DatabaseConfig(DB_URL, 1, 0, Duration.ofMinutes(1)));
        StandaloneServer other = Bootstrap.createServer(config, 0);
        other.start();

        other.close();
        other.close();
    }
}
