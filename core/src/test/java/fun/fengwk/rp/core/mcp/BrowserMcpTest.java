package fun.fengwk.rp.core.mcp;

import fun.fengwk.rp.core.configuration.FreeMarkerConfiguration;
import fun.fengwk.rp.core.service.browser.action.BrowserActionService;
import fun.fengwk.rp.core.service.browser.action.model.BrowserActionResult;
import fun.fengwk.rp.core.service.browser.action.model.ClickRequest;
import fun.fengwk.rp.core.service.browser.action.model.LocateRequest;
import fun.fengwk.rp.core.service.catalog.CatalogService;
import fun.fengwk.rp.core.service.catalog.ComponentCatalog;
import fun.fengwk.rp.core.service.flow.FlowContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class BrowserMcpTest {

    @Mock
    private BrowserActionService browserActionService;

    private FlowContext flowContext;
    private BrowserMcp browserMcp;

    @BeforeEach
    void setUp() {
        flowContext = new FlowContext();
        McpFormatter mcpFormatter = new McpFormatter(new FreeMarkerConfiguration().mcpTemplateConfiguration());
        CatalogService catalogService = new CatalogService(browserActionService, new ComponentCatalog());
        browserMcp = new BrowserMcp(browserActionService, catalogService, flowContext, mcpFormatter);
    }

    @Test
    public void shouldPassLocatorArgumentsWithSharedFlowContext() {
        when(browserActionService.identifyElement(eq(flowContext), any(LocateRequest.class)))
            .thenReturn(result("Element identified by role: button"));

        String text = browserMcp.identifyElement(null, "button", "Submit", null, "submit");

        ArgumentCaptor<LocateRequest> captor = ArgumentCaptor.forClass(LocateRequest.class);
        verify(browserActionService).identifyElement(eq(flowContext), captor.capture());
        assertThat(captor.getValue().getRole()).isEqualTo("button");
        assertThat(captor.getValue().getName()).isEqualTo("Submit");
        assertThat(captor.getValue().getAlias()).isEqualTo("submit");
        assertThat(text).startsWith("Element identified by role: button\n");
    }

    @Test
    public void shouldDefaultOptionalClickFlags() {
        when(browserActionService.click(eq(flowContext), any(ClickRequest.class))).thenReturn(result("Clicked on element."));

        browserMcp.click("submit", null, null, null, null);

        ArgumentCaptor<ClickRequest> captor = ArgumentCaptor.forClass(ClickRequest.class);
        verify(browserActionService).click(eq(flowContext), captor.capture());
        assertThat(captor.getValue().isDoubleClick()).isFalse();
        assertThat(captor.getValue().hasPosition()).isFalse();
    }

    @Test
    public void shouldRenderFailureAsText() {
        when(browserActionService.hover("ghost"))
            .thenThrow(new IllegalArgumentException("Missing page instance or locator."));

        String text = browserMcp.hover("ghost");

        assertThat(text).isEqualTo("""
            error: Missing page instance or locator.
            tool: browser_hover
            kind: IllegalArgumentException
            """);
    }

    @Test
    public void shouldExtractComponentInfoIntoFlowContext() {
        when(browserActionService.readBodyText()).thenReturn("[{\"task\": \"button\", \"category\": \"inputs\"}]");

        String text = browserMcp.extractComponentInfo("button");

        assertThat(text).startsWith("Extracted component info for 'button'.\ncategory: inputs\n");
        assertThat(text).contains("\"task\" : \"button\"");
        assertThat(flowContext.getString(CatalogService.VAR_COMP_INFO_TASK)).isEqualTo("button");
    }

    @Test
    public void shouldReportEmptyCategory() {
        when(browserActionService.readBodyText()).thenReturn("[{\"task\": \"button\", \"category\": \"inputs\"}]");

        String text = browserMcp.extractCategoryInfo("charts");

        assertThat(text).isEqualTo("""
            Extracted category info for 'charts'.
            Number of components in this category: 0
            """);
    }

    @Test
    public void shouldSetFlowVariable() {
        String text = browserMcp.setVariable("comp_info_task", "card");

        assertThat(flowContext.getString("comp_info_task")).isEqualTo("card");
        assertThat(text).isEqualTo("comp_info_task: card\n");
    }

    private static BrowserActionResult result(String message) {
        return BrowserActionResult.builder()
            .action("test")
            .message(message)
            .pageUrl("https://ui.example.com/")
            .build();
    }

}
