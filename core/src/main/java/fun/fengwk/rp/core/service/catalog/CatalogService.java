package fun.fengwk.rp.core.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import fun.fengwk.rp.core.service.browser.action.BrowserActionService;
import fun.fengwk.rp.core.service.flow.FlowContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Extracts component data from a catalog API response shown in the current page.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogService {

    public static final String VAR_COMP_INFO = "comp_info";
    public static final String VAR_COMP_INFO_CATEGORY = "comp_info_category";
    public static final String VAR_COMP_INFO_TASK = "comp_info_task";
    public static final String VAR_CATEGORY_INFO = "category_info";

    private final BrowserActionService browserActionService;
    private final ComponentCatalog componentCatalog;

    /**
     * Find one component by task name and publish it to the flow context.
     */
    public Map<String, Object> extractComponentInfo(FlowContext flowContext, String componentName) {
        if (!StringUtils.hasText(componentName)) {
            throw new IllegalArgumentException("component name must be provided");
        }
        JsonNode root = componentCatalog.parse(browserActionService.readBodyText());
        JsonNode component = componentCatalog.findByTask(root, componentName);
        Map<String, Object> info = componentCatalog.toMap(component);

        flowContext.put(VAR_COMP_INFO, info);
        flowContext.put(VAR_COMP_INFO_CATEGORY, componentCatalog.text(component, ComponentCatalog.FIELD_CATEGORY));
        flowContext.put(VAR_COMP_INFO_TASK, componentCatalog.text(component, ComponentCatalog.FIELD_TASK));
        log.info("component info extracted, name={}, category={}", componentName,
            flowContext.getString(VAR_COMP_INFO_CATEGORY));
        return info;
    }

    /**
     * Collect every component of one category and publish the list to the flow context.
     */
    public List<Map<String, Object>> extractCategoryInfo(FlowContext flowContext, String category) {
        if (!StringUtils.hasText(category)) {
            throw new IllegalArgumentException("category must be provided");
        }
        JsonNode root = componentCatalog.parse(browserActionService.readBodyText());
        List<Map<String, Object>> components = componentCatalog.filterByCategory(root, category).stream()
            .map(componentCatalog::toMap)
            .toList();

        flowContext.put(VAR_CATEGORY_INFO, components);
        log.info("category info extracted, category={}, components={}", category.trim(), components.size());
        return components;
    }

}
