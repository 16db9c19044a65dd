package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.strata.semantic.config.StrataProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * {@link QueryGenerator} backed by an OpenAI-compatible chat completions endpoint.
 */
@Component
public class ChatCompletionQueryGenerator implements QueryGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionQueryGenerator.class);

    private final WebClient webClient;
    private final StrataProperties props;
    private final QueryPromptBuilder promptBuilder;
    private final ObjectMapper mapper;

    public ChatCompletionQueryGenerator(WebClient generatorWebClient,
                                        StrataProperties props,
                                        QueryPromptBuilder promptBuilder,
                                        ObjectMapper objectMapper) {
        this.webClient = Objects.requireNonNull(generatorWebClient);
        this.props = Objects.requireNonNull(props);
        this.promptBuilder = Objects.requireNonNull(promptBuilder);
        this.mapper = Objects.requireNonNull(objectMapper);
    }

    @Override
    public Mono<JsonNode> generate(String question, String model) {
        QueryPromptBuilder.Prompt prompt = promptBuilder.build(question);

        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.putArray("messages")
                .add(mapper.createObjectNode().put("role", "system").put("content", prompt.system()))
                .add(mapper.createObjectNode().put("role", "user").put("content", prompt.user()));

        log.info("Calling query generator with model: {}", model);
        return webClient.post()
                .uri(props.getGenerator().getCompletionsPath())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(detail -> new QueryGenerationException(
                                "Generator returned HTTP " + resp.statusCode().value() + ": " + detail)))
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> new QueryGenerationException("Generator returned an empty body")))
                .map(this::parseAnswer);
    }

    JsonNode parseAnswer(JsonNode completion) {
        String content = completion.path("choices").path(0).path("message").path("content").asText("");
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new QueryGenerationException("Generator answer contains no JSON object");
        }

        JsonNode answer;
        try {
            answer = mapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new QueryGenerationException("Generator answer is not valid JSON", e);
        }

        if (!answer.path("query_json").isObject()) {
            throw new QueryGenerationException("Generator answer has no 'query_json' object");
        }
        return answer;
    }
}
