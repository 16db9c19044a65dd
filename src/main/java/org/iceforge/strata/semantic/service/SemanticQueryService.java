package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.strata.semantic.config.StrataProperties;
import org.iceforge.strata.semantic.model.GeneratedQuery;
import org.iceforge.strata.semantic.model.QuerySpec;
import org.iceforge.strata.semantic.model.SemanticLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
public class SemanticQueryService {

    private static final Logger log = LoggerFactory.getLogger(SemanticQueryService.class);

    static final String GENERATION_TARGET = "query-generation";

    private final SemanticLayerLoader loader;
    private final SemanticSqlCompiler compiler;
    private final QueryGenerator generator;
    private final JsonResponseCache cache;
    private final AdaptiveRateLimiter rateLimiter;
    private final WarehouseClient warehouseClient;
    private final ObjectMapper mapper;
    private final StrataProperties props;

    public SemanticQueryService(SemanticLayerLoader loader,
                                SemanticSqlCompiler compiler,
                                QueryGenerator generator,
                                JsonResponseCache cache,
                                AdaptiveRateLimiter rateLimiter,
                                WarehouseClient warehouseClient,
                                ObjectMapper objectMapper,
                                StrataProperties props) {
        this.loader = Objects.requireNonNull(loader);
        this.compiler = Objects.requireNonNull(compiler);
        this.generator = Objects.requireNonNull(generator);
        this.cache = Objects.requireNonNull(cache);
        this.rateLimiter = Objects.requireNonNull(rateLimiter);
        this.warehouseClient = Objects.requireNonNull(warehouseClient);
        this.mapper = Objects.requireNonNull(objectMapper);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Compiles the request's query against its own semantic layer, or the default layer when it has none.
     */
    public SemanticSqlCompiler.CompiledQuery compile(GeneratedQuery req) {
        QuerySpec query = req.getQuery() == null ? new QuerySpec() : req.getQuery();
        SemanticLayer layer = req.getSemanticLayer() == null ? loader.load() : req.getSemanticLayer();
        return compiler.compile(query, layer);
    }

    /**
     * Answers a natural-language question: cached or freshly generated query spec, compiled, and
     * optionally executed for its row count.
     */
    public Mono<AskResult> ask(String question, String model, boolean execute) {
        String resolvedModel = StringUtils.hasText(model) ? model : props.getGenerator().getDefaultModel();

        List<String> cacheModels = new ArrayList<>(props.getGenerator().getCacheModels());
        if (!cacheModels.contains(resolvedModel)) {
            cacheModels.add(resolvedModel);
        }

        return Mono.defer(() -> {
                    Optional<JsonNode> hit = cache.lookup(question, cacheModels);
                    if (hit.isPresent()) {
                        log.info("Hit cache for question: {}", question);
                        return Mono.just(new Answer(hit.get(), true));
                    }
                    log.info("No cache hit, generating with model: {}", resolvedModel);
                    return generateAndCache(question, resolvedModel).map(node -> new Answer(node, false));
                })
                .flatMap(answer -> {
                    String sql = compile(toGeneratedQuery(answer.json())).sql();
                    if (!execute) {
                        return Mono.just(new AskResult(resolvedModel, answer.cached(), sql, null));
                    }
                    return warehouseClient.execute(sql)
                            .map(r -> new AskResult(resolvedModel, answer.cached(), sql, r.totalRows()));
                });
    }

    private Mono<JsonNode> generateAndCache(String question, String model) {
        return rateLimiter.call(GENERATION_TARGET, () -> generator.generate(question, model))
                .flatMap(node -> Mono.fromRunnable(() -> cache.put(JsonResponseCache.key(model, question), node))
                        .subscribeOn(Schedulers.boundedElastic())
                        .thenReturn(node));
    }

    private GeneratedQuery toGeneratedQuery(JsonNode json) {
        try {
            return mapper.treeToValue(json, GeneratedQuery.class);
        } catch (JsonProcessingException e) {
            throw new QueryGenerationException("Generated query does not match the expected shape", e);
        }
    }

    private record Answer(JsonNode json, boolean cached) {}

    public record AskResult(String model, boolean cached, String sql, Long totalRows) {}
}
