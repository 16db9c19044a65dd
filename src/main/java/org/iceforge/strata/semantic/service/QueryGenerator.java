package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Turns a natural-language question into a JSON object with {@code query_json} and
 * {@code semantic_layer_json} members.
 */
public interface QueryGenerator {

    Mono<JsonNode> generate(String question, String model);
}
