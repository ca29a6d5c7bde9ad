package fun.fengwk.rp.core.service.readme;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReadmeTemplateFetcher tests.
 *
 * @author fengwk
 */
class ReadmeTemplateFetcherTest {

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldReturnBodyOnSuccess() throws Exception {
        AtomicReference<String> pathRef = new AtomicReference<>();
        server = startServer(exchange -> {
            pathRef.set(exchange.getRequestURI().getPath());
            write(exchange, 200, "# Library\n\n## Components\n");
        });
        ReadmeTemplateFetcher fetcher = new ReadmeTemplateFetcher(new ReadmeProperties());

        String template = fetcher.fetch(baseUrl(server) + "/owner/repo/main/README.md");

        assertThat(template).isEqualTo("# Library\n\n## Components\n");
        assertThat(pathRef.get()).isEqualTo("/owner/repo/main/README.md");
    }

    @Test
    void shouldFailOnNonOkStatus() throws Exception {
        server = startServer(exchange -> write(exchange, 404, "404: Not Found"));
        ReadmeTemplateFetcher fetcher = new ReadmeTemplateFetcher(new ReadmeProperties());

        assertThatThrownBy(() -> fetcher.fetch(baseUrl(server) + "/missing.md"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Failed to fetch README content, status code: 404");
    }

    @Test
    void shouldFetchWithoutTimeoutWhenDisabled() throws Exception {
        server = startServer(exchange -> write(exchange, 200, "# Template"));
        ReadmeProperties props = new ReadmeProperties();
        props.setFetchTimeoutMs(0);
        ReadmeTemplateFetcher fetcher = new ReadmeTemplateFetcher(props);

        assertThat(fetcher.fetch(baseUrl(server) + "/README.md")).isEqualTo("# Template");
    }

    @Test
    void shouldRejectBlankUrl() {
        ReadmeTemplateFetcher fetcher = new ReadmeTemplateFetcher(new ReadmeProperties());

        assertThatThrownBy(() -> fetcher.fetch(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static HttpServer startServer(HttpHandler handler) throws IOException {
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", handler);
        httpServer.start();
        return httpServer;
    }

    private static String baseUrl(HttpServer httpServer) {
        return "http://127.0.0.1:" + httpServer.getAddress().getPort();
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

}
