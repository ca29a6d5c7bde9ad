package fun.fengwk.rp.core.mcp;

import fun.fengwk.rp.core.service.catalog.CatalogService;
import fun.fengwk.rp.core.service.flow.FlowContext;
import fun.fengwk.rp.core.service.readme.ReadmeGenerator;
import fun.fengwk.rp.core.service.readme.ReadmeInputParser;
import fun.fengwk.rp.core.service.readme.ReadmeTemplateFetcher;
import fun.fengwk.rp.core.service.readme.model.CategoryDetails;
import fun.fengwk.rp.core.service.readme.model.CategoryReadmeInput;
import fun.fengwk.rp.core.service.readme.model.ComponentDetails;
import fun.fengwk.rp.core.service.readme.model.ComponentPaths;
import fun.fengwk.rp.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * README drafting tools.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadmeMcp {

    private static final String FIELDS_TEMPLATE = "rp_fields.ftl";

    private final ReadmeTemplateFetcher readmeTemplateFetcher;
    private final ReadmeGenerator readmeGenerator;
    private final ReadmeInputParser readmeInputParser;
    private final FlowContext flowContext;
    private final McpFormatter mcpFormatter;

    @Tool(name = "readme_fetch_template", description = "Fetch a README template, e.g. from a GitHub raw url.",
        resultConverter = StringToolCallResultConverter.class)
    public String fetchTemplate(@ToolParam(description = "template url") String url) {
        return run("readme_fetch_template", () -> readmeTemplateFetcher.fetch(url));
    }

    @Tool(name = "readme_generate",
        description = """
            Draft a README for a component category with the configured chat model and save it to disk.
            Pass either input, a JSON object {category_info, readme_template, screenshot_links},
            or readmeTemplate and screenshotLinks, in which case category_info comes from the flow
            variable set by catalog_extract_category_info.""",
        resultConverter = StringToolCallResultConverter.class)
    public String generate(
        @ToolParam(description = "JSON input object", required = false) String input,
        @ToolParam(description = "README template in Markdown", required = false) String readmeTemplate,
        @ToolParam(description = "screenshot links", required = false) List<String> screenshotLinks
    ) {
        return run("readme_generate", () -> {
            CategoryReadmeInput readmeInput = StringUtils.hasText(input)
                ? readmeInputParser.parseCategoryReadmeInput(input)
                : fromFlowContext(readmeTemplate, screenshotLinks);
            return readmeGenerator.generate(readmeInput);
        });
    }

    @Tool(name = "readme_parse_category_input",
        description = "Parse a JSON object {category_info, readme_template, screenshot_links}.",
        resultConverter = StringToolCallResultConverter.class)
    public String parseCategoryInput(@ToolParam(description = "JSON input object") String input) {
        return run("readme_parse_category_input", () -> {
            CategoryReadmeInput parsed = readmeInputParser.parseCategoryReadmeInput(input);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("category_info", parsed.getCategoryInfo().size() + " item(s)");
            fields.put("readme_template", parsed.getReadmeTemplate().length() + " char(s)");
            fields.put("screenshot_links", String.join(", ", parsed.getScreenshotLinks()));
            return fields(fields);
        });
    }

    @Tool(name = "readme_parse_component_details", description = "Parse a JSON object {url, component_name}.",
        resultConverter = StringToolCallResultConverter.class)
    public String parseComponentDetails(@ToolParam(description = "JSON input object") String input) {
        return run("readme_parse_component_details", () -> {
            ComponentDetails parsed = readmeInputParser.parseComponentDetails(input);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("url", parsed.getUrl());
            fields.put("component_name", parsed.getComponentName());
            return fields(fields);
        });
    }

    @Tool(name = "readme_parse_category_details", description = "Parse a JSON object {url, category_name}.",
        resultConverter = StringToolCallResultConverter.class)
    public String parseCategoryDetails(@ToolParam(description = "JSON input object") String input) {
        return run("readme_parse_category_details", () -> {
            CategoryDetails parsed = readmeInputParser.parseCategoryDetails(input);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("url", parsed.getUrl());
            fields.put("category_name", parsed.getCategoryName());
            return fields(fields);
        });
    }

    @Tool(name = "readme_parse_component_paths", description = "Parse a JSON object {url, file_path}.",
        resultConverter = StringToolCallResultConverter.class)
    public String parseComponentPaths(@ToolParam(description = "JSON input object") String input) {
        return run("readme_parse_component_paths", () -> {
            ComponentPaths parsed = readmeInputParser.parseComponentPaths(input);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("url", parsed.getUrl());
            fields.put("file_path", parsed.getFilePath());
            return fields(fields);
        });
    }

    private CategoryReadmeInput fromFlowContext(String readmeTemplate, List<String> screenshotLinks) {
        Object categoryInfo = flowContext.get(CatalogService.VAR_CATEGORY_INFO);
        if (!(categoryInfo instanceof List<?> components)) {
            throw new IllegalArgumentException(
                "category info missing, run catalog_extract_category_info first or pass input");
        }
        return CategoryReadmeInput.builder()
            .categoryInfo(new ArrayList<>(components))
            .readmeTemplate(readmeTemplate == null ? "" : readmeTemplate)
            .screenshotLinks(screenshotLinks == null ? List.of() : screenshotLinks)
            .build();
    }

    private String fields(Map<String, Object> fields) {
        return mcpFormatter.format(FIELDS_TEMPLATE, Map.of("fields", fields));
    }

    private String run(String tool, Supplier<String> supplier) {
        try {
            return supplier.get();
        } catch (Exception ex) {
            log.warn("readme tool failed, tool={}, error={}", tool, ex.getMessage(), ex);
            return mcpFormatter.formatError(tool, ex);
        }
    }

}
