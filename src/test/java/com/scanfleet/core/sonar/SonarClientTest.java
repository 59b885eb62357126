package com.scanfleet.core.sonar;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SonarClientTest {

    private HttpServer server;
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresBeforeSuccess = new AtomicInteger();
    private volatile int failureStatus = 500;
    private volatile String searchBody = "{\"paging\":{\"pageIndex\":1,\"pageSize\":100,\"total\":0}}";

    private record Recorded(String method, String pathAndQuery, String authorization, String body) {}

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String query = exchange.getRequestURI().getRawQuery();
        requests.add(new Recorded(exchange.getRequestMethod(),
                exchange.getRequestURI().getPath() + (query == null ? "" : "?" + query),
                exchange.getRequestHeaders().getFirst("Authorization"), body));

        int status;
        String response;
        if (failuresBeforeSuccess.getAndDecrement() > 0) {
            status = failureStatus;
            response = "{\"errors\":[{\"msg\":\"nope\"}]}";
        } else if (exchange.getRequestURI().getPath().equals(SonarClient.SEARCH_PATH)) {
            status = 200;
            response = searchBody;
        } else {
            status = 200;
            response = "{}";
        }
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

    private SonarClient client() {
        return SonarClient.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                .token("squ_secret")
                .maxRetries(2)
                .retryPause(Duration.ZERO)
                .build();
    }

    @Test
    @DisplayName("existence check reads paging.total and sends the bearer token")
    void projectExists() {
        assertFalse(client().projectExists("acme_widgets"));

        searchBody = "{\"paging\":{\"total\":1},\"components\":[{\"key\":\"acme_widgets\"}]}";
        assertTrue(client().projectExists("acme_widgets"));

        var first = requests.get(0);
        assertEquals("GET", first.method());
        assertEquals("/api/projects/search?projects=acme_widgets", first.pathAndQuery());
        assertEquals("Bearer squ_secret", first.authorization());
    }

    @Test
    @DisplayName("create posts a form-encoded key and name")
    void createProject() {
        client().createProject("acme_my-app", "acme-my app");

        var request = requests.get(0);
        assertEquals("POST", request.method());
        assertEquals(SonarClient.CREATE_PATH, request.pathAndQuery());
        assertEquals("project=acme_my-app&name=acme-my+app", request.body());
    }

    @Test
    @DisplayName("branch rename posts project and branch name")
    void renameBranch() {
        client().renameDefaultBranch("acme_widgets", "develop");

        assertEquals(SonarClient.RENAME_BRANCH_PATH, requests.get(0).pathAndQuery());
        assertEquals("project=acme_widgets&name=develop", requests.get(0).body());
    }

    @Test
    @DisplayName("metadata update goes to the configured endpoint")
    void updateMetadata() {
        SonarClient.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort())
                .token("t")
                .metadataEndpoint("/api/custom/update")
                .retryPause(Duration.ZERO)
                .build()
                .updateMetadata("k", "n", "d");

        assertEquals("/api/custom/update", requests.get(0).pathAndQuery());
        assertEquals("project=k&name=n&description=d", requests.get(0).body());
    }

    @Test
    @DisplayName("server errors are retried until success")
    void retriesServerErrors() {
        failuresBeforeSuccess.set(2);

        assertDoesNotThrow(() -> client().createProject("k", "n"));
        assertEquals(3, requests.size());
    }

    @Test
    @DisplayName("server errors beyond the retry budget surface with the status")
    void exhaustsRetries() {
        failuresBeforeSuccess.set(10);

        var ex = assertThrows(SonarApiException.class, () -> client().createProject("k", "n"));
        assertEquals(500, ex.getStatusCode());
        assertEquals(3, requests.size());
    }

    @Test
    @DisplayName("client errors are not retried")
    void clientErrorsNotRetried() {
        failureStatus = 401;
        failuresBeforeSuccess.set(10);

        var ex = assertThrows(SonarApiException.class, () -> client().projectExists("k"));
        assertEquals(401, ex.getStatusCode());
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("connection failures are retried and then reported without status")
    void transportFailure() {
        int port = server.getAddress().getPort();
        server.stop(0);
        server = null;

        var unreachable = SonarClient.builder()
                .baseUrl("http://127.0.0.1:" + port)
                .token("t")
                .maxRetries(1)
                .connectTimeout(Duration.ofSeconds(2))
                .retryPause(Duration.ZERO)
                .build();

        var ex = assertThrows(SonarApiException.class, () -> unreachable.projectExists("k"));
        assertEquals(-1, ex.getStatusCode());
    }

    @Test
    void formEncodesSpecialCharacters() {
        assertEquals("name=a%26b%3Dc&description=", SonarClient.form("name", "a&b=c", "description", null));
    }
}
