package org.iceforge.strata.semantic.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.iceforge.strata.semantic.service.AdaptiveRateLimiter;
import org.iceforge.strata.semantic.service.JsonResponseCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(StrataProperties.class)
public class AppConfig {

    /**
     * JSON mapper for the web layer and the cache. Declared explicitly so the YAML mapper below
     * does not replace Boot's default.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    @Bean
    public ObjectMapper yamlObjectMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    @Bean
    public WebClient warehouseWebClient(StrataProperties props) {
        return WebClient.builder()
                .baseUrl(props.getWarehouse().getBaseUrl())
                .build();
    }

    @Bean
    public WebClient generatorWebClient(StrataProperties props) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getGenerator().getBaseUrl())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024));
        if (StringUtils.hasText(props.getGenerator().getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getGenerator().getApiKey());
        }
        return builder.build();
    }

    @Bean
    public JsonResponseCache responseCache(ObjectMapper objectMapper, StrataProperties props) {
        return new JsonResponseCache(Path.of(props.getCache().getPath()), objectMapper);
    }

    @Bean
    public AdaptiveRateLimiter rateLimiter(StrataProperties props) {
        StrataProperties.RateLimiter rl = props.getRateLimiter();
        return new AdaptiveRateLimiter(rl.getMinDelay(), rl.getMaxDelay(), rl.getTimeout(),
                rl.getSlowdownInterval(), rl.getMaxAttempts());
    }
}
