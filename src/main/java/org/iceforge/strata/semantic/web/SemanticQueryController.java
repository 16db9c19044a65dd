package org.iceforge.strata.semantic.web;

import jakarta.validation.Valid;
import org.iceforge.strata.semantic.compiler.SemanticCompileException;
import org.iceforge.strata.semantic.model.GeneratedQuery;
import org.iceforge.strata.semantic.service.QueryGenerationException;
import org.iceforge.strata.semantic.service.RateLimitExhaustedException;
import org.iceforge.strata.semantic.service.SemanticQueryService;
import org.iceforge.strata.semantic.service.SemanticSqlCompiler;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.Objects;

@RestController
@RequestMapping("/api/semantic")
public class SemanticQueryController {

    private final SemanticQueryService service;

    public SemanticQueryController(SemanticQueryService service) {
        this.service = Objects.requireNonNull(service);
    }

    /**
     * Compiles a query spec (and optional semantic layer) to SQL.
     */
    @PostMapping(value = "/compile", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<SemanticSqlCompiler.CompiledQuery> compile(@RequestBody GeneratedQuery req) {
        return Mono.fromCallable(() -> service.compile(req));
    }

    /**
     * Generates a query spec from a question (cached when possible), compiles it and optionally executes it.
     */
    @PostMapping(value = "/ask", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<SemanticQueryService.AskResult> ask(@Valid @RequestBody AskRequest req) {
        return service.ask(req.getQuestion(), req.getModel(), req.isExecute());
    }

    @ExceptionHandler(SemanticCompileException.class)
    public ResponseEntity<ErrorResponse> badRequest(SemanticCompileException e) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(e));
    }

    @ExceptionHandler({QueryGenerationException.class, RateLimitExhaustedException.class})
    public ResponseEntity<ErrorResponse> generationFailed(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of("GENERATION_FAILED", e.getMessage()));
    }

    @ExceptionHandler(WebClientException.class)
    public ResponseEntity<ErrorResponse> warehouseFailed(WebClientException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of("WAREHOUSE_ERROR", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> serverError(RuntimeException e) {
        return ResponseEntity.internalServerError().contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of("SERVER_ERROR", e.getMessage()));
    }
}
