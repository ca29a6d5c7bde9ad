package fun.fengwk.rp.core.service.browser.action.impl;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.JSHandle;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Request;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.SelectOption;
import com.microsoft.playwright.options.WaitForSelectorState;
import fun.fengwk.rp.core.service.browser.BrowserProperties;
import fun.fengwk.rp.core.service.browser.action.BrowserActionService;
import fun.fengwk.rp.core.service.browser.action.model.BrowserActionResult;
import fun.fengwk.rp.core.service.browser.action.model.ClickRequest;
import fun.fengwk.rp.core.service.browser.action.model.FillRequest;
import fun.fengwk.rp.core.service.browser.action.model.LocateRequest;
import fun.fengwk.rp.core.service.browser.action.model.ScreenshotRequest;
import fun.fengwk.rp.core.service.browser.action.model.ScrollMethod;
import fun.fengwk.rp.core.service.browser.action.model.ScrollRequest;
import fun.fengwk.rp.core.service.browser.action.model.SelectBy;
import fun.fengwk.rp.core.service.browser.runtime.BrowserSession;
import fun.fengwk.rp.core.service.browser.runtime.BrowserTask;
import fun.fengwk.rp.core.service.browser.runtime.BrowserWorkerManager;
import fun.fengwk.rp.core.service.flow.FlowContext;
import fun.fengwk.rp.core.service.flow.SelectorTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Browser workflow steps submitted to the browser worker.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrowserActionServiceImpl implements BrowserActionService {

    static final long CHECK_SETTLE_MS = 500;
    static final long CAPTURE_WAIT_MS = 3000;
    static final int DEFAULT_WAIT_FOR_ELEMENT_MS = 30000;
    static final int DEFAULT_WAIT_SECONDS = 5;
    static final String DEFAULT_ENDPOINT_PATTERN = "components/?";
    static final String ELEMENT_REF_ATTRIBUTE = "data-rp-ref";

    private final BrowserWorkerManager browserWorkerManager;
    private final BrowserProperties browserProperties;
    private final AtomicLong elementRefSeq = new AtomicLong(0);

    @Override
    public BrowserActionResult openBrowser(String url, Boolean headless) {
        requireText(url, "URL must be provided.");
        boolean headlessMode = headless == null ? browserProperties.isHeadless() : headless;
        return submit(session -> {
            Page page = session.launch(headlessMode);
            page.navigate(url);
            log.info("browser opened, url={}, headless={}", url, headlessMode);
            return result("open_browser", session, "Browser opened and navigated to: " + url, url);
        });
    }

    @Override
    public BrowserActionResult navigate(String url) {
        requireText(url, "URL must be provided.");
        return submit(session -> {
            session.requirePage().navigate(url);
            log.info("navigated, url={}", url);
            return result("navigate", session, "Navigated to URL: " + url, url);
        });
    }

    @Override
    public BrowserActionResult identifyElement(FlowContext flowContext, LocateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("locate request must not be null");
        }
        String alias = BrowserSession.normalizeAlias(request.getAlias());
        if (StringUtils.hasText(request.getSelector())) {
            String selector = SelectorTemplate.format(request.getSelector(), variables(flowContext));
            return submit(session -> {
                session.registerLocator(alias, session.requirePage().locator(selector));
                log.info("element identified by selector, selector={}, alias={}", selector, alias);
                return result("identify_element", session, "Element identified by CSS selector: " + selector, alias);
            });
        }
        if (StringUtils.hasText(request.getRole())) {
            String roleText = request.getRole();
            AriaRole role = parseRole(roleText);
            String name = request.getName();
            return submit(session -> {
                Page page = session.requirePage();
                Locator locator = StringUtils.hasText(name)
                    ? page.getByRole(role, new Page.GetByRoleOptions().setName(name))
                    : page.getByRole(role);
                session.registerLocator(alias, locator);
                log.info("element identified by role, role={}, name={}, alias={}", role, name, alias);
                return result("identify_element", session, "Element identified by role: " + roleText, alias);
            });
        }
        if (StringUtils.hasText(request.getLabel())) {
            String label = request.getLabel();
            return submit(session -> {
                session.registerLocator(alias, session.requirePage().getByLabel(label));
                log.info("element identified by label, label={}, alias={}", label, alias);
                return result("identify_element", session, "Element identified by label: " + label, alias);
            });
        }
        throw new IllegalArgumentException("Must provide at least one locator method (selector, role, or label).");
    }

    @Override
    public BrowserActionResult click(FlowContext flowContext, ClickRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("click request must not be null");
        }
        String selector = StringUtils.hasText(request.getSelector())
            ? SelectorTemplate.format(request.getSelector(), variables(flowContext))
            : null;
        String alias = StringUtils.hasText(request.getAlias()) ? request.getAlias().trim() : null;
        if (alias == null && selector == null && !request.hasPosition()) {
            throw new IllegalArgumentException("You must provide either a locator or a valid position dictionary.");
        }
        boolean doubleClick = request.isDoubleClick();
        boolean hasPosition = request.hasPosition();
        Double x = request.getX();
        Double y = request.getY();
        return submit(session -> {
            Page page = session.requirePage();
            Locator locator = alias != null ? session.requireLocator(alias)
                : selector != null ? page.locator(selector) : null;
            String message;
            if (locator == null) {
                if (doubleClick) {
                    page.mouse().dblclick(x, y);
                } else {
                    page.mouse().click(x, y);
                }
                message = (doubleClick ? "Double clicked" : "Clicked") + " at position (" + x + ", " + y + ") on the page.";
            } else if (hasPosition) {
                if (doubleClick) {
                    locator.dblclick(new Locator.DblclickOptions().setPosition(x, y));
                } else {
                    locator.click(new Locator.ClickOptions().setPosition(x, y));
                }
                message = (doubleClick ? "Double clicked" : "Clicked") + " on element at position (" + x + ", " + y + ").";
            } else {
                if (doubleClick) {
                    locator.dblclick();
                } else {
                    locator.click();
                }
                message = (doubleClick ? "Double clicked" : "Clicked") + " on element.";
            }
            log.info("click done, alias={}, selector={}, doubleClick={}", alias, selector, doubleClick);
            return result("click", session, message, null);
        });
    }

    @Override
    public BrowserActionResult fill(FillRequest request) {
        if (request == null || request.getText() == null) {
            throw new IllegalArgumentException("Missing page instance or locator.");
        }
        String alias = request.getAlias();
        String text = request.getText();
        boolean sequential = request.isSequential();
        int delayMs = Math.max(0, request.getDelayMs());
        return submit(session -> {
            session.requirePage();
            Locator locator = session.requireLocator(alias);
            String message;
            if (sequential) {
                locator.pressSequentially(text, new Locator.PressSequentiallyOptions().setDelay(delayMs));
                message = "Typed text sequentially with delay " + delayMs + "ms on the identified element.";
            } else {
                locator.fill(text);
                message = "Filled element with text.";
            }
            log.info("fill done, alias={}, sequential={}, length={}", alias, sequential, text.length());
            return result("fill", session, message, null);
        });
    }

    @Override
    public BrowserActionResult pressKey(String alias, String key) {
        requireText(key, "'key' must be provided.");
        return submit(session -> {
            Page page = session.requirePage();
            String message;
            if (StringUtils.hasText(alias)) {
                session.requireLocator(alias).press(key);
                message = "Pressed key: " + key + " on the identified element.";
            } else {
                page.keyboard().press(key);
                message = "Pressed key: " + key + " globally on the page.";
            }
            log.info("key pressed, key={}, alias={}", key, alias);
            return result("press_key", session, message, null);
        });
    }

    @Override
    public BrowserActionResult hover(String alias) {
        return submit(session -> {
            session.requirePage();
            session.requireLocator(alias).hover();
            log.info("hover done, alias={}", alias);
            return result("hover", session, "Hovered over the identified element.", null);
        });
    }

    @Override
    public BrowserActionResult focus(String alias) {
        return submit(session -> {
            session.requirePage();
            session.requireLocator(alias).focus();
            log.info("focus done, alias={}", alias);
            return result("focus", session, "Focused on the identified element.", null);
        });
    }

    @Override
    public BrowserActionResult check(String alias, boolean expectChecked) {
        return submit(session -> {
            Page page = session.requirePage();
            Locator locator = session.requireLocator(alias);
            if (!expectChecked) {
                locator.check();
            }
            page.waitForTimeout(CHECK_SETTLE_MS);
            if (!locator.isChecked()) {
                throw new IllegalStateException("Assertion failed: Element is not checked!");
            }
            log.info("check done, alias={}, expectChecked={}", alias, expectChecked);
            return result("check", session, "Assertion passed: Element is checked.", "true");
        });
    }

    @Override
    public BrowserActionResult selectOptions(String alias, List<String> options, String by) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("options must not be empty");
        }
        SelectBy selectBy = SelectBy.fromValue(by);
        List<String> values = List.copyOf(options);
        return submit(session -> {
            session.requirePage();
            Locator locator = session.requireLocator(alias);
            List<String> selected;
            if (selectBy == SelectBy.ANY) {
                selected = locator.selectOption(values.toArray(new String[0]));
            } else {
                selected = locator.selectOption(toSelectOptions(selectBy, values));
            }
            log.info("options selected, alias={}, by={}, options={}", alias, selectBy.getValue(), values);
            return result("select_options", session, "Selected options: " + values, String.join(",", selected));
        });
    }

    @Override
    public BrowserActionResult uploadFiles(String alias, List<String> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("files must not be empty");
        }
        Path[] paths = files.stream().map(Paths::get).toArray(Path[]::new);
        return submit(session -> {
            session.requirePage();
            session.requireLocator(alias).setInputFiles(paths);
            log.info("files uploaded, alias={}, files={}", alias, files);
            return result("upload_files", session, "Uploaded files: " + files, null);
        });
    }

    @Override
    public BrowserActionResult scroll(ScrollRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("scroll request must not be null");
        }
        ScrollMethod method = ScrollMethod.fromValue(request.getMethod());
        String alias = StringUtils.hasText(request.getAlias()) ? request.getAlias().trim() : null;
        if (method == ScrollMethod.SCROLL_INTO_VIEW && alias == null) {
            throw new IllegalArgumentException("'scroll_into_view' method requires a locator.");
        }
        int x = request.getX();
        int y = request.getY();
        Map<String, Object> offsets = Map.of("x", x, "y", y);
        return submit(session -> {
            Page page = session.requirePage();
            Locator locator = alias == null ? null : session.requireLocator(alias);
            String message;
            switch (method) {
                case SCROLL_INTO_VIEW -> {
                    locator.scrollIntoViewIfNeeded();
                    message = "Scrolled element into view.";
                }
                case MOUSE_WHEEL -> {
                    if (locator != null) {
                        locator.hover();
                    }
                    page.mouse().wheel(x, y);
                    message = "Scrolled using mouse wheel by offsets x: " + x + ", y: " + y + ".";
                }
                case EVALUATE -> {
                    if (locator != null) {
                        locator.evaluate("(e, d) => { e.scrollTop += d.y; e.scrollLeft += d.x; }", offsets);
                        message = "Scrolled element with offsets x: " + x + ", y: " + y + ".";
                    } else {
                        page.evaluate("d => window.scrollBy(d.x, d.y)", offsets);
                        message = "Scrolled page with offsets x: " + x + ", y: " + y + ".";
                    }
                }
                default -> {
                    page.evaluate("d => window.scrollBy(d.x, d.y)", offsets);
                    message = "Scrolled page with offsets x: " + x + ", y: " + y + ".";
                }
            }
            log.info("scroll done, method={}, alias={}, x={}, y={}", method.getValue(), alias, x, y);
            return result("scroll", session, message, null);
        });
    }

    @Override
    public BrowserActionResult dragAndDrop(String sourceAlias, String targetAlias) {
        if (!StringUtils.hasText(sourceAlias) || !StringUtils.hasText(targetAlias)) {
            throw new IllegalArgumentException("Missing page instance or source/target locator.");
        }
        return submit(session -> {
            session.requirePage();
            Locator source = session.requireLocator(sourceAlias);
            Locator target = session.requireLocator(targetAlias);
            source.dragTo(target);
            log.info("drag and drop done, source={}, target={}", sourceAlias, targetAlias);
            return result("drag_and_drop", session, "Drag and drop action performed.", null);
        });
    }

    @Override
    public BrowserActionResult screenshot(ScreenshotRequest request) {
        if (request == null || !StringUtils.hasText(request.getPath())) {
            throw new IllegalArgumentException("'file_path' must be provided to save the screenshot.");
        }
        Path path = Paths.get(request.getPath());
        String alias = StringUtils.hasText(request.getAlias()) ? request.getAlias().trim() : null;
        boolean fullPage = request.isFullPage();
        String pathText = request.getPath();
        return submit(session -> {
            Page page = session.requirePage();
            String message;
            if (alias != null) {
                session.requireLocator(alias).screenshot(new Locator.ScreenshotOptions().setPath(path));
                message = "Screenshot of the element saved to: " + path;
            } else {
                page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(fullPage));
                message = "Screenshot of the page saved to: " + path + " | full_page: " + fullPage;
            }
            log.info("screenshot saved, path={}, alias={}, fullPage={}", path, alias, fullPage);
            return result("screenshot", session, message, pathText);
        });
    }

    @Override
    public BrowserActionResult waitForElement(String alias, Integer timeoutMs) {
        int timeout = timeoutMs == null ? DEFAULT_WAIT_FOR_ELEMENT_MS : timeoutMs;
        return submit(session -> {
            session.requirePage();
            session.requireLocator(alias).waitFor(new Locator.WaitForOptions()
                .setState(WaitForSelectorState.VISIBLE)
                .setTimeout(timeout));
            log.info("element visible, alias={}, timeoutMs={}", alias, timeout);
            return result("wait_for_element", session, "Element is now visible (waited up to " + timeout + " ms).", null);
        });
    }

    @Override
    public BrowserActionResult waitForTime(Integer seconds) {
        int waitSeconds = seconds == null ? DEFAULT_WAIT_SECONDS : Math.max(0, seconds);
        // Plain delay, the browser thread stays free for other callers.
        try {
            Thread.sleep(waitSeconds * 1000L);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting", ex);
        }
        log.info("waited, seconds={}", waitSeconds);
        return BrowserActionResult.builder()
            .action("wait_for_time")
            .pageUrl("")
            .message("Done waiting " + waitSeconds + " seconds.")
            .build();
    }

    @Override
    public BrowserActionResult captureEndpoint(Boolean reload, String urlPattern) {
        boolean doReload = reload == null || reload;
        String pattern = StringUtils.hasText(urlPattern) ? urlPattern : DEFAULT_ENDPOINT_PATTERN;
        return submit(session -> {
            Page page = session.requirePage();
            AtomicReference<String> captured = new AtomicReference<>("");
            Consumer<Request> listener = request -> {
                if (request.url().contains(pattern)) {
                    log.debug("endpoint captured, url={}", request.url());
                    captured.set(request.url());
                }
            };
            page.onRequestFinished(listener);
            try {
                if (doReload) {
                    page.reload();
                }
                page.waitForTimeout(CAPTURE_WAIT_MS);
            } finally {
                page.offRequestFinished(listener);
            }
            String endpoint = captured.get();
            if (endpoint.isEmpty()) {
                log.info("no endpoint captured, pattern={}", pattern);
                return result("capture_endpoint", session, "No endpoint found that contains '" + pattern + "'.", "");
            }
            log.info("endpoint captured, pattern={}, url={}", pattern, endpoint);
            return result("capture_endpoint", session, "Endpoint found and stored: " + endpoint, endpoint);
        });
    }

    @Override
    public BrowserActionResult dynamicElementHandle(String alias, String script, String targetAlias) {
        requireText(script, "Missing JavaScript script input.");
        String ref = "rp-" + elementRefSeq.incrementAndGet();
        String target = BrowserSession.normalizeAlias(targetAlias);
        return submit(session -> {
            Page page = session.requirePage();
            ElementHandle handle = session.requireLocator(alias).first().elementHandle();
            if (handle == null) {
                throw new IllegalArgumentException("Element handle not found!");
            }
            JSHandle transformed = handle.evaluateHandle(script);
            ElementHandle element = transformed == null ? null : transformed.asElement();
            if (element == null) {
                throw new IllegalArgumentException("Transformed element not found!");
            }
            // Tag the element so later steps can reach it through a regular locator.
            element.evaluate("(e, ref) => e.setAttribute('" + ELEMENT_REF_ATTRIBUTE + "', ref)", ref);
            session.registerLocator(target, page.locator("[" + ELEMENT_REF_ATTRIBUTE + "=\"" + ref + "\"]"));
            log.info("dynamic element handle registered, source={}, target={}, script={}", alias, target, script);
            return result("dynamic_element_handle", session, "Dynamic element handle extracted using script: " + script, target);
        });
    }

    @Override
    public BrowserActionResult closeBrowser() {
        return submit(session -> {
            if (session.browser() == null) {
                throw new IllegalArgumentException("Missing page instance or browser.");
            }
            session.closeBrowser();
            log.info("browser closed");
            return result("close_browser", session, "Browser closed.", null);
        });
    }

    @Override
    public String readBodyText() {
        return submit(session -> session.requirePage().innerText("body"));
    }

    private <T> T submit(BrowserTask<T> task) {
        try {
            return browserWorkerManager.getOrCreate().submit(task);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("browser action failed: " + ex.getMessage(), ex);
        }
    }

    private BrowserActionResult result(String action, BrowserSession session, String message, String value) {
        Page page = session.page();
        return BrowserActionResult.builder()
            .action(action)
            .pageUrl(page == null ? "" : page.url())
            .message(message)
            .value(value)
            .build();
    }

    private Map<String, Object> variables(FlowContext flowContext) {
        return flowContext == null ? Map.of() : flowContext.snapshot();
    }

    private SelectOption[] toSelectOptions(SelectBy selectBy, List<String> values) {
        SelectOption[] selectOptions = new SelectOption[values.size()];
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            SelectOption option = new SelectOption();
            switch (selectBy) {
                case LABEL -> option.setLabel(value);
                case VALUE -> option.setValue(value);
                case INDEX -> option.setIndex(parseIndex(value));
                default -> throw new IllegalArgumentException("unsupported select option key: " + selectBy);
            }
            selectOptions[i] = option;
        }
        return selectOptions;
    }

    private int parseIndex(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("option index must be an integer: " + value, ex);
        }
    }

    private AriaRole parseRole(String role) {
        try {
            return AriaRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unsupported role: " + role, ex);
        }
    }

    private static void requireText(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(message);
        }
    }

}
