package fun.fengwk.rp.core.service.readme;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.rp.core.service.readme.model.CategoryDetails;
import fun.fengwk.rp.core.service.readme.model.CategoryReadmeInput;
import fun.fengwk.rp.core.service.readme.model.ComponentDetails;
import fun.fengwk.rp.core.service.readme.model.ComponentPaths;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Parses the JSON inputs of README workflows. Missing fields become empty values.
 *
 * @author fengwk
 */
@Component
public class ReadmeInputParser {

    private static final TypeReference<List<Object>> OBJECT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();

    public CategoryReadmeInput parseCategoryReadmeInput(String json) {
        JsonNode root = readObject(json);
        return CategoryReadmeInput.builder()
            .categoryInfo(list(root.get("category_info"), OBJECT_LIST))
            .readmeTemplate(text(root, "readme_template"))
            .screenshotLinks(list(root.get("screenshot_links"), STRING_LIST))
            .build();
    }

    public ComponentDetails parseComponentDetails(String json) {
        JsonNode root = readObject(json);
        return ComponentDetails.builder()
            .url(text(root, "url"))
            .componentName(text(root, "component_name"))
            .build();
    }

    public CategoryDetails parseCategoryDetails(String json) {
        JsonNode root = readObject(json);
        return CategoryDetails.builder()
            .url(text(root, "url"))
            .categoryName(text(root, "category_name"))
            .build();
    }

    public ComponentPaths parseComponentPaths(String json) {
        JsonNode root = readObject(json);
        return ComponentPaths.builder()
            .url(text(root, "url"))
            .filePath(text(root, "file_path"))
            .build();
    }

    private JsonNode readObject(String json) {
        if (!StringUtils.hasText(json)) {
            throw new IllegalArgumentException("input json is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid input json: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("input json must be an object");
        }
        return root;
    }

    private String text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private <T> List<T> list(JsonNode node, TypeReference<List<T>> type) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("expected a json array but got: " + node.getNodeType());
        }
        return objectMapper.convertValue(node, type);
    }

}
