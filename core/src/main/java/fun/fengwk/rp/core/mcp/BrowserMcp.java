package fun.fengwk.rp.core.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fun.fengwk.rp.core.service.browser.action.BrowserActionService;
import fun.fengwk.rp.core.service.browser.action.model.BrowserActionResult;
import fun.fengwk.rp.core.service.browser.action.model.ClickRequest;
import fun.fengwk.rp.core.service.browser.action.model.FillRequest;
import fun.fengwk.rp.core.service.browser.action.model.LocateRequest;
import fun.fengwk.rp.core.service.browser.action.model.ScreenshotRequest;
import fun.fengwk.rp.core.service.browser.action.model.ScrollRequest;
import fun.fengwk.rp.core.service.catalog.CatalogService;
import fun.fengwk.rp.core.service.flow.FlowContext;
import fun.fengwk.rp.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Browser workflow tools. All tools share one browser session.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrowserMcp {

    private static final String ACTION_TEMPLATE = "rp_browser_action_result.ftl";

    private final BrowserActionService browserActionService;
    private final CatalogService catalogService;
    private final FlowContext flowContext;
    private final McpFormatter mcpFormatter;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Tool(name = "browser_open",
        description = """
            Launch a Chromium browser, open a page and navigate to the url.
            An already open browser is closed first.""",
        resultConverter = StringToolCallResultConverter.class)
    public String open(
        @ToolParam(description = "url to visit") String url,
        @ToolParam(description = "run headless, default from configuration", required = false) Boolean headless
    ) {
        return action("browser_open", () -> browserActionService.openBrowser(url, headless));
    }

    @Tool(name = "browser_navigate", description = "Navigate the open page to a new url.",
        resultConverter = StringToolCallResultConverter.class)
    public String navigate(@ToolParam(description = "url to visit") String url) {
        return action("browser_navigate", () -> browserActionService.navigate(url));
    }

    @Tool(name = "browser_identify_element",
        description = """
            Identify an element and register it under an alias for later steps.
            The first given strategy wins: CSS selector, ARIA role (with optional name), label.
            Selectors may reference flow variables as {name}, e.g. {comp_info_task}.""",
        resultConverter = StringToolCallResultConverter.class)
    public String identifyElement(
        @ToolParam(description = "CSS selector", required = false) String selector,
        @ToolParam(description = "ARIA role, e.g. button, link, checkbox", required = false) String role,
        @ToolParam(description = "accessible name used with role", required = false) String name,
        @ToolParam(description = "label text", required = false) String label,
        @ToolParam(description = "alias to register, default 'default'", required = false) String alias
    ) {
        LocateRequest request = LocateRequest.builder()
            .selector(selector)
            .role(role)
            .name(name)
            .label(label)
            .alias(alias)
            .build();
        return action("browser_identify_element", () -> browserActionService.identifyElement(flowContext, request));
    }

    @Tool(name = "browser_click",
        description = """
            Click an identified element, a CSS selector, or a page position.
            With an element and a position, the position is relative to the element.""",
        resultConverter = StringToolCallResultConverter.class)
    public String click(
        @ToolParam(description = "alias of an identified element", required = false) String alias,
        @ToolParam(description = "CSS selector used when no alias is given", required = false) String selector,
        @ToolParam(description = "double click, default false", required = false) Boolean doubleClick,
        @ToolParam(description = "x position", required = false) Double x,
        @ToolParam(description = "y position", required = false) Double y
    ) {
        ClickRequest request = ClickRequest.builder()
            .alias(alias)
            .selector(selector)
            .doubleClick(Boolean.TRUE.equals(doubleClick))
            .x(x)
            .y(y)
            .build();
        return action("browser_click", () -> browserActionService.click(flowContext, request));
    }

    @Tool(name = "browser_fill", description = "Fill an identified input with text, optionally typing key by key.",
        resultConverter = StringToolCallResultConverter.class)
    public String fill(
        @ToolParam(description = "alias of an identified element", required = false) String alias,
        @ToolParam(description = "text to fill") String text,
        @ToolParam(description = "type key by key, default false", required = false) Boolean sequential,
        @ToolParam(description = "delay between keys in milliseconds, default 0", required = false) Integer delayMs
    ) {
        FillRequest request = FillRequest.builder()
            .alias(alias)
            .text(text)
            .sequential(Boolean.TRUE.equals(sequential))
            .delayMs(delayMs == null ? 0 : delayMs)
            .build();
        return action("browser_fill", () -> browserActionService.fill(request));
    }

    @Tool(name = "browser_press_key",
        description = "Press a key, e.g. Enter or Tab, on an identified element or globally on the page.",
        resultConverter = StringToolCallResultConverter.class)
    public String pressKey(
        @ToolParam(description = "key to press") String key,
        @ToolParam(description = "alias of an identified element, empty presses on the page", required = false) String alias
    ) {
        return action("browser_press_key", () -> browserActionService.pressKey(alias, key));
    }

    @Tool(name = "browser_hover", description = "Hover over an identified element.",
        resultConverter = StringToolCallResultConverter.class)
    public String hover(@ToolParam(description = "alias of an identified element", required = false) String alias) {
        return action("browser_hover", () -> browserActionService.hover(alias));
    }

    @Tool(name = "browser_focus", description = "Focus an identified element.",
        resultConverter = StringToolCallResultConverter.class)
    public String focus(@ToolParam(description = "alias of an identified element", required = false) String alias) {
        return action("browser_focus", () -> browserActionService.focus(alias));
    }

    @Tool(name = "browser_check",
        description = """
            Check a checkbox or radio button and assert it is checked.
            With expectChecked the check action is skipped and only the assertion runs.""",
        resultConverter = StringToolCallResultConverter.class)
    public String check(
        @ToolParam(description = "alias of an identified element", required = false) String alias,
        @ToolParam(description = "only assert, default false", required = false) Boolean expectChecked
    ) {
        return action("browser_check", () -> browserActionService.check(alias, Boolean.TRUE.equals(expectChecked)));
    }

    @Tool(name = "browser_select_options", description = "Select options of an identified select element.",
        resultConverter = StringToolCallResultConverter.class)
    public String selectOptions(
        @ToolParam(description = "alias of an identified element", required = false) String alias,
        @ToolParam(description = "options to select") List<String> options,
        @ToolParam(description = "match options by label, value or index, default value or label", required = false) String by
    ) {
        return action("browser_select_options", () -> browserActionService.selectOptions(alias, options, by));
    }

    @Tool(name = "browser_upload_files", description = "Set the files of an identified file input.",
        resultConverter = StringToolCallResultConverter.class)
    public String uploadFiles(
        @ToolParam(description = "alias of an identified element", required = false) String alias,
        @ToolParam(description = "file paths") List<String> files
    ) {
        return action("browser_upload_files", () -> browserActionService.uploadFiles(alias, files));
    }

    @Tool(name = "browser_scroll",
        description = """
            Scroll an identified element or the page.
            Methods: scroll_into_view (element only), mouse_wheel, evaluate (default), page_evaluate.""",
        resultConverter = StringToolCallResultConverter.class)
    public String scroll(
        @ToolParam(description = "alias of an identified element, empty scrolls the page", required = false) String alias,
        @ToolParam(description = "scroll method", required = false) String method,
        @ToolParam(description = "horizontal offset, default 0", required = false) Integer x,
        @ToolParam(description = "vertical offset, default 0", required = false) Integer y
    ) {
        ScrollRequest request = ScrollRequest.builder()
            .alias(alias)
            .method(method)
            .x(x == null ? 0 : x)
            .y(y == null ? 0 : y)
            .build();
        return action("browser_scroll", () -> browserActionService.scroll(request));
    }

    @Tool(name = "browser_drag_and_drop", description = "Drag one identified element onto another.",
        resultConverter = StringToolCallResultConverter.class)
    public String dragAndDrop(
        @ToolParam(description = "alias of the element to drag") String sourceAlias,
        @ToolParam(description = "alias of the drop target") String targetAlias
    ) {
        return action("browser_drag_and_drop", () -> browserActionService.dragAndDrop(sourceAlias, targetAlias));
    }

    @Tool(name = "browser_screenshot", description = "Save a screenshot of an identified element or the page.",
        resultConverter = StringToolCallResultConverter.class)
    public String screenshot(
        @ToolParam(description = "file path to save the png to") String path,
        @ToolParam(description = "alias of an identified element, empty captures the page", required = false) String alias,
        @ToolParam(description = "capture the full page, default false", required = false) Boolean fullPage
    ) {
        ScreenshotRequest request = ScreenshotRequest.builder()
            .path(path)
            .alias(alias)
            .fullPage(Boolean.TRUE.equals(fullPage))
            .build();
        return action("browser_screenshot", () -> browserActionService.screenshot(request));
    }

    @Tool(name = "browser_wait_for_element", description = "Wait until an identified element is visible.",
        resultConverter = StringToolCallResultConverter.class)
    public String waitForElement(
        @ToolParam(description = "alias of an identified element", required = false) String alias,
        @ToolParam(description = "timeout in milliseconds, default 30000", required = false) Integer timeoutMs
    ) {
        return action("browser_wait_for_element", () -> browserActionService.waitForElement(alias, timeoutMs));
    }

    @Tool(name = "browser_wait_for_time", description = "Pause for a number of seconds.",
        resultConverter = StringToolCallResultConverter.class)
    public String waitForTime(@ToolParam(description = "seconds, default 5", required = false) Integer seconds) {
        return action("browser_wait_for_time", () -> browserActionService.waitForTime(seconds));
    }

    @Tool(name = "browser_capture_endpoint",
        description = """
            Record finished network requests for three seconds and return the last url containing the pattern.
            The page is reloaded first unless reload is false.""",
        resultConverter = StringToolCallResultConverter.class)
    public String captureEndpoint(
        @ToolParam(description = "reload the page first, default true", required = false) Boolean reload,
        @ToolParam(description = "url fragment to match, default 'components/?'", required = false) String pattern
    ) {
        return action("browser_capture_endpoint", () -> browserActionService.captureEndpoint(reload, pattern));
    }

    @Tool(name = "browser_dynamic_element_handle",
        description = """
            Apply a JavaScript function to the first match of an identified element and register the resulting \
            element under a new alias, e.g. script "node => node.closest('.node')".""",
        resultConverter = StringToolCallResultConverter.class)
    public String dynamicElementHandle(
        @ToolParam(description = "alias of an identified element", required = false) String alias,
        @ToolParam(description = "JavaScript function applied to the element") String script,
        @ToolParam(description = "alias to register the result under, default 'default'", required = false) String targetAlias
    ) {
        return action("browser_dynamic_element_handle",
            () -> browserActionService.dynamicElementHandle(alias, script, targetAlias));
    }

    @Tool(name = "browser_close", description = "Close the open browser.",
        resultConverter = StringToolCallResultConverter.class)
    public String close() {
        return action("browser_close", browserActionService::closeBrowser);
    }

    @Tool(name = "catalog_extract_component_info",
        description = """
            Parse the component catalog JSON shown in the current page and find one component by task name.
            Stores comp_info, comp_info_category and comp_info_task as flow variables.""",
        resultConverter = StringToolCallResultConverter.class)
    public String extractComponentInfo(@ToolParam(description = "component task name") String componentName) {
        return run("catalog_extract_component_info", () -> {
            Map<String, Object> info = catalogService.extractComponentInfo(flowContext, componentName);
            return mcpFormatter.format("rp_component_info.ftl", Map.of(
                "name", componentName,
                "category", flowContext.getString(CatalogService.VAR_COMP_INFO_CATEGORY),
                "json", toJson(info)
            ));
        });
    }

    @Tool(name = "catalog_extract_category_info",
        description = """
            Parse the component catalog JSON shown in the current page and collect every component of a category.
            Stores the list as flow variable category_info.""",
        resultConverter = StringToolCallResultConverter.class)
    public String extractCategoryInfo(@ToolParam(description = "category, matched ignoring case") String category) {
        return run("catalog_extract_category_info", () -> {
            List<Map<String, Object>> components = catalogService.extractCategoryInfo(flowContext, category);
            return mcpFormatter.format("rp_category_info.ftl", Map.of(
                "category", category.trim(),
                "count", components.size(),
                "json", toJson(components)
            ));
        });
    }

    @Tool(name = "flow_set_variable", description = "Set a flow variable usable as {name} in selectors.",
        resultConverter = StringToolCallResultConverter.class)
    public String setVariable(
        @ToolParam(description = "variable name") String name,
        @ToolParam(description = "value, empty removes the variable", required = false) String value
    ) {
        return run("flow_set_variable", () -> {
            flowContext.put(name, value == null || value.isEmpty() ? null : value);
            Map<String, Object> fields = new LinkedHashMap<>();
            flowContext.snapshot().forEach((key, current) ->
                fields.put(key, current instanceof String ? current : toJson(current)));
            return mcpFormatter.format("rp_fields.ftl", Map.of("fields", fields));
        });
    }

    private String action(String tool, Supplier<BrowserActionResult> supplier) {
        return run(tool, () -> mcpFormatter.format(ACTION_TEMPLATE, supplier.get()));
    }

    private String run(String tool, Supplier<String> supplier) {
        try {
            return supplier.get();
        } catch (Exception ex) {
            log.warn("browser tool failed, tool={}, error={}", tool, ex.getMessage(), ex);
            return mcpFormatter.formatError(tool, ex);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize result: " + ex.getOriginalMessage(), ex);
        }
    }

}
