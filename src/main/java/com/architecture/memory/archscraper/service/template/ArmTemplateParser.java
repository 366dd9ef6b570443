package com.architecture.memory.archscraper.service.template;

import com.architecture.memory.archscraper.exception.TemplateParseException;
import com.architecture.memory.archscraper.model.ParsedTemplate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient reader for ARM template JSON.
 *
 * <p>Accepts comments and trailing commas (both legal in ARM templates), array or symbolic-name
 * object {@code resources}, and partial documents. Rejects input that is not JSON, whose root is
 * not an object, or that has none of the resources/parameters/outputs sections.</p>
 */
@Component
@Slf4j
public class ArmTemplateParser {

    private static final String BOM = "\uFEFF";

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    public ParsedTemplate parse(String content) {
        if (content == null || content.isBlank()) {
            throw new TemplateParseException("Template is empty");
        }

        String text = content.startsWith(BOM) ? content.substring(1) : content;

        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new TemplateParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new TemplateParseException("Template root is not a JSON object");
        }
        if (!root.has("resources") && !root.has("parameters") && !root.has("outputs")) {
            throw new TemplateParseException("Document has no resources, parameters or outputs section");
        }

        return ParsedTemplate.builder()
                .resources(parseResources(root.get("resources")))
                .parameters(parseParameters(root.get("parameters")))
                .outputs(parseOutputs(root.get("outputs")))
                .schema(textOrNull(root.get("$schema")))
                .contentVersion(textOrNull(root.get("contentVersion")))
                .build();
    }

    private List<ParsedTemplate.Resource> parseResources(JsonNode node) {
        List<ParsedTemplate.Resource> resources = new ArrayList<>();
        if (node == null || node.isNull()) {
            return resources;
        }

        if (node.isArray()) {
            for (JsonNode element : node) {
                addResource(resources, element, null);
            }
        } else if (node.isObject()) {
            // languageVersion 2.0 templates key resources by symbolic name
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addResource(resources, field.getValue(), field.getKey());
            }
        } else {
            log.debug("Ignoring resources section of type {}", node.getNodeType());
        }
        return resources;
    }

    private void addResource(List<ParsedTemplate.Resource> target, JsonNode node, String symbolicName) {
        if (node == null || !node.isObject()) {
            return;
        }
        String type = textOrNull(node.get("type"));
        if (type == null || type.isBlank()) {
            return;
        }

        String name = textOrNull(node.get("name"));
        if (name == null) {
            name = symbolicName != null ? symbolicName : "";
        }

        List<String> dependsOn = new ArrayList<>();
        JsonNode dependsNode = node.get("dependsOn");
        if (dependsNode != null && dependsNode.isArray()) {
            for (JsonNode dependency : dependsNode) {
                if (dependency.isTextual()) {
                    dependsOn.add(dependency.asText());
                }
            }
        }

        target.add(ParsedTemplate.Resource.builder()
                .type(type.trim())
                .name(name)
                .apiVersion(textOrNull(node.get("apiVersion")))
                .dependsOn(dependsOn)
                .children(parseResources(node.get("resources")))
                .build());
    }

    private Map<String, ParsedTemplate.Parameter> parseParameters(JsonNode node) {
        Map<String, ParsedTemplate.Parameter> parameters = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return parameters;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode definition = field.getValue();
            JsonNode defaultValue = definition != null && definition.isObject() ? definition.get("defaultValue") : null;
            parameters.put(field.getKey(), ParsedTemplate.Parameter.builder()
                    .type(definition != null ? textOrNull(definition.get("type")) : null)
                    .defaultValue(defaultValue)
                    .build());
        }
        return parameters;
    }

    private Map<String, ParsedTemplate.Output> parseOutputs(JsonNode node) {
        Map<String, ParsedTemplate.Output> outputs = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return outputs;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode definition = field.getValue();
            outputs.put(field.getKey(), ParsedTemplate.Output.builder()
                    .type(definition != null ? textOrNull(definition.get("type")) : null)
                    .build());
        }
        return outputs;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
