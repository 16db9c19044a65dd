package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.strata.semantic.compiler.SemanticCatalog;
import org.iceforge.strata.semantic.compiler.SemanticCompileException;
import org.iceforge.strata.semantic.config.StrataProperties;
import org.iceforge.strata.semantic.model.SemanticLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Supplies the default semantic layer, used for compile requests that do not carry a layer of their own.
 *
 * <p>The layer is read from the classpath once and checked by building a {@link SemanticCatalog} over it,
 * so a broken default layer surfaces as a server error rather than as a client's bad request.
 */
@Component
public class SemanticLayerLoader {

    private static final Logger log = LoggerFactory.getLogger(SemanticLayerLoader.class);

    private final ObjectMapper yamlMapper;
    private final String resource;

    private volatile SemanticLayer defaultLayer;

    public SemanticLayerLoader(@Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper, StrataProperties props) {
        this.yamlMapper = Objects.requireNonNull(yamlObjectMapper);
        this.resource = Objects.requireNonNull(props).getModelResource();
    }

    public SemanticLayer load() {
        SemanticLayer layer = defaultLayer;
        if (layer != null) return layer;

        synchronized (this) {
            if (defaultLayer == null) {
                defaultLayer = readAndValidate();
            }
            return defaultLayer;
        }
    }

    /**
     * Drops the loaded layer; the next {@link #load()} reads the resource again.
     */
    public void reload() {
        defaultLayer = null;
    }

    private SemanticLayer readAndValidate() {
        SemanticLayer layer;
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            layer = yamlMapper.readValue(in, SemanticLayer.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load semantic layer resource: " + resource, e);
        }
        if (layer == null) {
            throw new IllegalStateException("Semantic layer resource is empty: " + resource);
        }

        try {
            SemanticCatalog.of(layer);
        } catch (SemanticCompileException e) {
            throw new IllegalStateException("Default semantic layer " + resource + " is invalid: " + e.getMessage(), e);
        }

        log.info("Loaded default semantic layer from {}: {} metrics, {} dimensions, {} joins",
                resource, layer.getMetrics().size(), layer.getDimensions().size(), layer.getJoins().size());
        return layer;
    }
}
