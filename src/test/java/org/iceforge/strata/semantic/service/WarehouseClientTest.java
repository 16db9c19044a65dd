package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.iceforge.strata.semantic.config.StrataProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WarehouseClientTest {

    private MockWebServer warehouse;
    private WarehouseClient client;

    @BeforeEach
    void setup() throws IOException {
        warehouse = new MockWebServer();
        warehouse.start();

        StrataProperties props = new StrataProperties();
        props.getWarehouse().setSubmitPath("/api/v1/queries");
        props.getWarehouse().setJdbcUrl("jdbc:bigquery://example");
        props.getWarehouse().setUsername("svc");

        client = new WarehouseClient(WebClient.builder().baseUrl(warehouse.url("/").toString()).build(), props);
    }

    @AfterEach
    void tearDown() throws IOException {
        warehouse.shutdown();
    }

    @Test
    void submitsSqlAndReturnsRowCount() throws Exception {
        warehouse.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"queryId\":\"q-1\",\"totalRows\":56,\"elapsedMs\":120}"));

        StepVerifier.create(client.execute("SELECT COUNT(*) AS order_count\nFROM orders"))
                .assertNext(r -> {
                    assertThat(r.queryId()).isEqualTo("q-1");
                    assertThat(r.totalRows()).isEqualTo(56);
                })
                .verifyComplete();

        RecordedRequest req = warehouse.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getPath()).isEqualTo("/api/v1/queries");

        JsonNode body = new ObjectMapper().readTree(req.getBody().readUtf8());
        assertThat(body.get("sql").asText()).isEqualTo("SELECT COUNT(*) AS order_count\nFROM orders");
        assertThat(body.at("/jdbc/jdbcUrl").asText()).isEqualTo("jdbc:bigquery://example");
        assertThat(body.at("/jdbc/username").asText()).isEqualTo("svc");
    }

    @Test
    void missingRowCountIsAnError() {
        warehouse.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"queryId\":\"q-2\"}"));

        StepVerifier.create(client.execute("SELECT 1"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("totalRows"))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void httpErrorsPropagate() {
        warehouse.enqueue(new MockResponse().setResponseCode(400).setBody("syntax error"));

        StepVerifier.create(client.execute("SELEC 1"))
                .expectError(WebClientResponseException.BadRequest.class)
                .verify(Duration.ofSeconds(5));
    }
}
