package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.strata.semantic.config.StrataProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Builds the system and user messages asking a model to emit a query spec plus its semantic layer.
 */
@Component
public class QueryPromptBuilder {

    private final ObjectMapper mapper;
    private final String databaseSchema;

    @Autowired
    public QueryPromptBuilder(ObjectMapper objectMapper, StrataProperties props) {
        this(objectMapper, readResource(props.getGenerator().getSchemaResource()));
    }

    QueryPromptBuilder(ObjectMapper objectMapper, String databaseSchema) {
        this.mapper = Objects.requireNonNull(objectMapper);
        this.databaseSchema = Objects.requireNonNull(databaseSchema);
    }

    public Prompt build(String question) {
        List<String> system = List.of(
                "You are an AI assistant specialized in converting natural language queries into structured JSON formats suitable for database querying.",
                "You have access to the following database schema:",
                databaseSchema,
                "Your task is to interpret the user's natural language query and generate a JSON object that includes both 'query_json' and 'semantic_layer_json'.",
                "Ensure that all metrics, dimensions, and filters are accurately identified based on the query and correctly mapped to the database schema.",
                "If the query involves multiple tables, include the necessary join conditions in the 'semantic_layer_json'.",
                "Dimensions may be truncated to a date grain by suffixing their name with __week, __month or __year.",
                "The output JSON should adhere strictly to the specified structure without additional explanations or text.");

        List<String> user = List.of(
                "Please convert the following natural language query into the specified JSON format:",
                "\"" + question + "\"",
                "",
                "The JSON should have the following structure:",
                "```json",
                outputShape(),
                "```",
                "",
                "Ensure that:",
                "- All metrics are listed under the 'metrics' key in 'query_json'.",
                "- All dimensions are listed under the 'dimensions' key in 'query_json'.",
                "- All filters are listed under the 'filters' key in 'query_json' with their respective fields, operators, and values.",
                "- The 'semantic_layer_json' accurately defines each metric and dimension with their corresponding SQL expressions and associated tables.",
                "- If joins between tables are necessary, include them under a 'joins' key within 'semantic_layer_json'.",
                "- The output is a single valid JSON object.");

        return new Prompt(String.join(" ", system), String.join(" ", user));
    }

    private String outputShape() {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode query = root.putObject("query_json");
        query.put("metrics", "List of metrics to be calculated (e.g., ['total_revenue'])");
        query.put("dimensions", "List of dimensions to group by (e.g., ['status'])");
        query.putArray("filters").addObject()
                .put("field", "Field to filter on (e.g., 'status')")
                .put("operator", "Operator for filtering (e.g., '=', '>', '<')")
                .put("value", "Value for the filter (e.g., 'Complete', 1000)");

        ObjectNode layer = root.putObject("semantic_layer_json");
        layer.putArray("metrics").addObject()
                .put("name", "Name of the metric (e.g., 'total_revenue')")
                .put("sql", "SQL expression for the metric (e.g., 'SUM(sale_price)')")
                .put("table", "Table associated with the metric (e.g., 'order_items')");
        layer.putArray("dimensions").addObject()
                .put("name", "Name of the dimension (e.g., 'status')")
                .put("sql", "SQL expression for the dimension (e.g., 'status')")
                .put("table", "Table associated with the dimension (e.g., 'order_items')");
        layer.putArray("joins").addObject()
                .put("one", "Primary table in the join (e.g., 'orders')")
                .put("many", "Secondary table in the join (e.g., 'order_items')")
                .put("join", "Join condition (e.g., 'order_items.order_id = orders.order_id')");

        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render prompt output shape", e);
        }
    }

    private static String readResource(String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load prompt schema resource: " + resource, e);
        }
    }

    public record Prompt(String system, String user) {}
}
