package fun.fengwk.rp.core.service.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Component catalog JSON helpers.
 *
 * <p>A catalog is any JSON structure; every object carrying a {@code task} field is one component.
 * Arrays and other objects are searched recursively, depth first, in document order.
 *
 * @author fengwk
 */
@Component
public class ComponentCatalog {

    public static final String FIELD_TASK = "task";
    public static final String FIELD_CATEGORY = "category";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();

    public JsonNode parse(String json) {
        if (!StringUtils.hasText(json)) {
            throw new IllegalArgumentException("component catalog json is empty");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid component catalog json: " + ex.getOriginalMessage(), ex);
        }
    }

    public List<JsonNode> flatten(JsonNode node) {
        List<JsonNode> components = new ArrayList<>();
        collect(node, components);
        return components;
    }

    public JsonNode findByTask(JsonNode root, String componentName) {
        String expected = componentName == null ? "" : componentName.toLowerCase(Locale.ROOT);
        for (JsonNode component : flatten(root)) {
            if (text(component, FIELD_TASK).toLowerCase(Locale.ROOT).equals(expected)) {
                return component;
            }
        }
        throw new IllegalArgumentException("Component not found!");
    }

    public List<JsonNode> filterByCategory(JsonNode root, String category) {
        String expected = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
        List<JsonNode> matched = new ArrayList<>();
        for (JsonNode component : flatten(root)) {
            if (text(component, FIELD_CATEGORY).trim().toLowerCase(Locale.ROOT).equals(expected)) {
                matched.add(component);
            }
        }
        return matched;
    }

    public Map<String, Object> toMap(JsonNode component) {
        return objectMapper.convertValue(component, MAP_TYPE);
    }

    public String text(JsonNode component, String field) {
        JsonNode value = component.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private void collect(JsonNode node, List<JsonNode> components) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collect(item, components);
            }
        } else if (node.isObject()) {
            if (node.has(FIELD_TASK)) {
                components.add(node);
                return;
            }
            Iterator<JsonNode> values = node.elements();
            while (values.hasNext()) {
                collect(values.next(), components);
            }
        }
    }

}
