package org.iceforge.strata.semantic.service;

import org.iceforge.strata.semantic.config.StrataProperties;
import org.iceforge.strata.semantic.web.WarehouseQueryRequest;
import org.iceforge.strata.semantic.web.WarehouseQueryResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Runs compiled SQL on the warehouse execution service. Used to check compiled SQL end to end.
 */
@Component
public class WarehouseClient {

    private final WebClient webClient;
    private final StrataProperties props;

    public WarehouseClient(WebClient warehouseWebClient, StrataProperties props) {
        this.webClient = Objects.requireNonNull(warehouseWebClient);
        this.props = Objects.requireNonNull(props);
    }

    public Mono<WarehouseResult> execute(String sql) {
        StrataProperties.Warehouse cfg = props.getWarehouse();
        WarehouseQueryRequest body = WarehouseQueryRequest.of(cfg, sql);

        return webClient.post()
                .uri(cfg.getSubmitPath())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body))
                .retrieve()
                .bodyToMono(WarehouseQueryResponse.class)
                .flatMap(r -> {
                    if (r.getTotalRows() == null) {
                        return Mono.error(new IllegalStateException("Warehouse response did not include totalRows."));
                    }
                    return Mono.just(new WarehouseResult(r.getQueryId(), r.getTotalRows()));
                })
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Warehouse returned an empty response.")));
    }

    public record WarehouseResult(String queryId, long totalRows) {}
}
