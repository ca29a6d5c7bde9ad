package fun.fengwk.rp.core.service.browser.action;

import fun.fengwk.rp.core.service.browser.action.model.BrowserActionResult;
import fun.fengwk.rp.core.service.browser.action.model.ClickRequest;
import fun.fengwk.rp.core.service.browser.action.model.FillRequest;
import fun.fengwk.rp.core.service.browser.action.model.LocateRequest;
import fun.fengwk.rp.core.service.browser.action.model.ScreenshotRequest;
import fun.fengwk.rp.core.service.browser.action.model.ScrollRequest;
import fun.fengwk.rp.core.service.flow.FlowContext;

import java.util.List;

/**
 * Browser workflow steps. Every step runs on the browser worker thread.
 *
 * <p>Elements are referenced by alias: {@link #identifyElement} registers a locator under an
 * alias and later steps act on it. A blank alias means {@code default}.
 *
 * @author fengwk
 */
public interface BrowserActionService {

    BrowserActionResult openBrowser(String url, Boolean headless);

    BrowserActionResult navigate(String url);

    BrowserActionResult identifyElement(FlowContext flowContext, LocateRequest request);

    BrowserActionResult click(FlowContext flowContext, ClickRequest request);

    BrowserActionResult fill(FillRequest request);

    BrowserActionResult pressKey(String alias, String key);

    BrowserActionResult hover(String alias);

    BrowserActionResult focus(String alias);

    BrowserActionResult check(String alias, boolean expectChecked);

    BrowserActionResult selectOptions(String alias, List<String> options, String by);

    BrowserActionResult uploadFiles(String alias, List<String> files);

    BrowserActionResult scroll(ScrollRequest request);

    BrowserActionResult dragAndDrop(String sourceAlias, String targetAlias);

    BrowserActionResult screenshot(ScreenshotRequest request);

    BrowserActionResult waitForElement(String alias, Integer timeoutMs);

    BrowserActionResult waitForTime(Integer seconds);

    BrowserActionResult captureEndpoint(Boolean reload, String urlPattern);

    BrowserActionResult dynamicElementHandle(String alias, String script, String targetAlias);

    BrowserActionResult closeBrowser();

    String readBodyText();

}
