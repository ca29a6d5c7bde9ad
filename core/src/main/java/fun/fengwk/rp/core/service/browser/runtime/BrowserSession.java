package fun.fengwk.rp.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import fun.fengwk.rp.core.service.browser.BrowserProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Browser resources owned by the browser worker.
 *
 * <p>Playwright objects may only be used from the thread that created them, so a session is
 * created, used and closed exclusively on the worker thread. It carries no locks.
 *
 * @author fengwk
 */
public class BrowserSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserSession.class);

    public static final String DEFAULT_ALIAS = "default";

    private final Playwright playwright;
    private final BrowserProperties browserProperties;
    private final Map<String, Locator> locators = new HashMap<>();
    private Browser browser;
    private Page page;
    private boolean closed = false;

    public BrowserSession(Playwright playwright, BrowserProperties browserProperties) {
        this.playwright = playwright;
        this.browserProperties = browserProperties;
    }

    public Playwright playwright() {
        return playwright;
    }

    public Browser browser() {
        return browser;
    }

    public Page page() {
        return page;
    }

    public Page requirePage() {
        if (page == null) {
            throw new IllegalArgumentException("Missing Playwright page instance.");
        }
        return page;
    }

    /**
     * Launch a new browser with one page, closing any browser opened before.
     */
    public Page launch(boolean headless) {
        closeBrowser();
        browser = playwright.chromium().launch(buildLaunchOptions(headless));
        page = browser.newPage();
        if (browserProperties.getDefaultTimeoutMs() > 0) {
            page.setDefaultTimeout(browserProperties.getDefaultTimeoutMs());
        }
        return page;
    }

    public void registerLocator(String alias, Locator locator) {
        locators.put(normalizeAlias(alias), locator);
    }

    public Locator findLocator(String alias) {
        return locators.get(normalizeAlias(alias));
    }

    public Locator requireLocator(String alias) {
        Locator locator = findLocator(alias);
        if (locator == null) {
            throw new IllegalArgumentException("Missing page instance or locator.");
        }
        return locator;
    }

    public void closeBrowser() {
        locators.clear();
        Browser current = browser;
        browser = null;
        page = null;
        if (current != null) {
            current.close();
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            closeBrowser();
        } catch (Exception ex) {
            log.debug("failed to close browser, error={}", ex.getMessage());
        }
        playwright.close();
    }

    public static String normalizeAlias(String alias) {
        return StringUtils.hasText(alias) ? alias.trim() : DEFAULT_ALIAS;
    }

    private BrowserType.LaunchOptions buildLaunchOptions(boolean headless) {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(headless);
        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        if (browserProperties.getSlowMoMs() > 0) {
            options.setSlowMo(browserProperties.getSlowMoMs());
        }
        return options;
    }

}
