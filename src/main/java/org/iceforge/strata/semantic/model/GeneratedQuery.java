package org.iceforge.strata.semantic.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Query plus the semantic layer it should be compiled against, in the shape the
 * query generator produces.
 */
public class GeneratedQuery {

    @JsonProperty("query_json")
    private QuerySpec query;

    @JsonProperty("semantic_layer_json")
    private SemanticLayer semanticLayer;

    public GeneratedQuery() {
    }

    public GeneratedQuery(QuerySpec query, SemanticLayer semanticLayer) {
        this.query = query;
        this.semanticLayer = semanticLayer;
    }

    public QuerySpec getQuery() {
        return query;
    }

    public void setQuery(QuerySpec query) {
        this.query = query;
    }

    public SemanticLayer getSemanticLayer() {
        return semanticLayer;
    }

    public void setSemanticLayer(SemanticLayer semanticLayer) {
        this.semanticLayer = semanticLayer;
    }
}
