package fun.fengwk.rp.core.mcp;

import freemarker.template.Template;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders tool results with FreeMarker templates.
 *
 * @author fengwk
 */
@Component
public class McpFormatter {

    static final String ERROR_TEMPLATE = "rp_error.ftl";

    private final freemarker.template.Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty response";
        }
        StringWriter result = new StringWriter(1024);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            Object root = model instanceof Map ? model : Map.of("data", model);
            template.process(root, result);
            return result.toString();
        } catch (Exception e) {
            return "format error: " + e.getMessage();
        }
    }

    public String formatError(String tool, Throwable error) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("tool", tool);
        model.put("kind", error.getClass().getSimpleName());
        model.put("error", error.getMessage() == null ? error.getClass().getName() : error.getMessage());
        return format(ERROR_TEMPLATE, model);
    }

}
