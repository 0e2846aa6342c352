package com.structura.labeling.service.remote;

import com.structura.labeling.domain.FailureClassification;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Exercises the HTTP transport against an in-process JDK HTTP server.
 */
class HttpClassifierTransportTest {

    private HttpServer server;
    private ExecutorService executor;
    private HttpClient httpClient;
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/v1/chat/completions", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"choices\":[]}");
        });
        server.createContext("/unauthorized/chat/completions", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 401, "{\"error\":\"invalid key\"}");
        });
        server.createContext("/broken/chat/completions", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 503, "upstream\nunavailable");
        });
        server.createContext("/slow/chat/completions", exchange -> {
            exchange.getRequestBody().readAllBytes();
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{}");
        });
        server.start();
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private String baseUrl(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    @Test
    void postsPayloadWithBearerKey() throws IOException {
        HttpClassifierTransport transport = new HttpClassifierTransport(httpClient, baseUrl("/v1/"), "sk-test");

        String body = transport.send("{\"model\":\"gpt-4o\"}", Duration.ofSeconds(5));

        assertThat(body).isEqualTo("{\"choices\":[]}");
        assertThat(lastAuthorization.get()).isEqualTo("Bearer sk-test");
        assertThat(lastBody.get()).isEqualTo("{\"model\":\"gpt-4o\"}");
        assertThat(transport.getEndpoint().getPath()).isEqualTo("/v1/chat/completions");
    }

    @Test
    void unauthorizedStatusIsAuthenticationRejection() {
        HttpClassifierTransport transport = new HttpClassifierTransport(httpClient, baseUrl("/unauthorized"), "bad");

        Throwable thrown = catchThrowable(() -> transport.send("{}", Duration.ofSeconds(5)));

        assertThat(thrown).isInstanceOf(AuthenticationRejectedException.class);
        assertThat(((AuthenticationRejectedException) thrown).getStatusCode()).isEqualTo(401);
        assertThat(FailureClassifier.classify(thrown)).isEqualTo(FailureClassification.AUTH_ERROR);
    }

    @Test
    void otherErrorStatusKeepsCodeAndPreview() {
        HttpClassifierTransport transport = new HttpClassifierTransport(httpClient, baseUrl("/broken"), "key");

        Throwable thrown = catchThrowable(() -> transport.send("{}", Duration.ofSeconds(5)));

        assertThat(thrown).isInstanceOf(TransportStatusException.class)
                .hasMessage("HTTP 503: upstream unavailable");
        assertThat(FailureClassifier.classify(thrown)).isEqualTo(FailureClassification.OTHER_ERROR);
    }

    @Test
    void missingKeyFailsWithoutSending() {
        HttpClassifierTransport transport = new HttpClassifierTransport(httpClient, baseUrl("/v1"), "  ");

        assertThatThrownBy(() -> transport.send("{}", Duration.ofSeconds(5)))
                .isInstanceOf(AuthenticationRejectedException.class);
        assertThat(lastBody.get()).isNull();
    }

    @Test
    void slowResponseIsReadTimeout() {
        HttpClassifierTransport transport = new HttpClassifierTransport(httpClient, baseUrl("/slow"), "key");

        Throwable thrown = catchThrowable(() -> transport.send("{}", Duration.ofMillis(200)));

        assertThat(thrown).isInstanceOf(HttpTimeoutException.class);
        assertThat(FailureClassifier.classify(thrown)).isEqualTo(FailureClassification.READ_TIMEOUT);
    }

    @Test
    void refusedConnectionIsConnectError() throws IOException {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        HttpClassifierTransport transport = new HttpClassifierTransport(
                httpClient, "http://127.0.0.1:" + freePort + "/v1", "key");

        Throwable thrown = catchThrowable(() -> transport.send("{}", Duration.ofSeconds(2)));

        assertThat(thrown).isInstanceOf(IOException.class);
        assertThat(FailureClassifier.classify(thrown)).isEqualTo(FailureClassification.CONNECT_ERROR);
    }
}
