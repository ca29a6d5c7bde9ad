package fun.fengwk.rp.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import fun.fengwk.rp.core.service.browser.BrowserProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class BrowserSessionTest {

    private Playwright playwright;
    private BrowserType chromium;
    private Browser browser;
    private Page page;
    private BrowserProperties properties;

    @BeforeEach
    public void setUp() {
        playwright = mock(Playwright.class);
        chromium = mock(BrowserType.class);
        browser = mock(Browser.class);
        page = mock(Page.class);
        properties = new BrowserProperties();
        when(playwright.chromium()).thenReturn(chromium);
        when(chromium.launch(any(BrowserType.LaunchOptions.class))).thenReturn(browser);
        when(browser.newPage()).thenReturn(page);
    }

    @Test
    public void shouldLaunchWithConfiguredOptions() {
        properties.setBrowserChannel("chrome");
        properties.setLaunchArgs(List.of("--lang=en-US"));
        properties.setDefaultTimeoutMs(15000);
        BrowserSession session = new BrowserSession(playwright, properties);

        Page launched = session.launch(true);

        ArgumentCaptor<BrowserType.LaunchOptions> captor = ArgumentCaptor.forClass(BrowserType.LaunchOptions.class);
        verify(chromium).launch(captor.capture());
        assertThat(captor.getValue().headless).isTrue();
        assertThat(captor.getValue().channel).isEqualTo("chrome");
        assertThat(captor.getValue().args).containsExactly("--lang=en-US");
        assertThat(captor.getValue().ignoreDefaultArgs).isEqualTo(List.of("--enable-automation"));
        assertThat(launched).isSameAs(page);
        assertThat(session.requirePage()).isSameAs(page);
        verify(page).setDefaultTimeout(15000);
    }

    @Test
    public void shouldCloseBrowserBeforeRelaunch() {
        BrowserSession session = new BrowserSession(playwright, properties);
        session.launch(false);
        session.registerLocator("button", mock(Locator.class));

        session.launch(false);

        verify(browser, times(1)).close();
        assertThat(session.findLocator("button")).isNull();
    }

    @Test
    public void shouldRegisterLocatorsByAlias() {
        BrowserSession session = new BrowserSession(playwright, properties);
        Locator locator = mock(Locator.class);

        session.registerLocator("  ", locator);

        assertThat(session.requireLocator("default")).isSameAs(locator);
        assertThat(session.requireLocator(null)).isSameAs(locator);
        assertThatThrownBy(() -> session.requireLocator("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing page instance or locator.");
    }

    @Test
    public void shouldRequirePage() {
        BrowserSession session = new BrowserSession(playwright, properties);

        assertThatThrownBy(session::requirePage)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing Playwright page instance.");
    }

    @Test
    public void shouldClosePlaywrightOnceEvenIfBrowserCloseFails() {
        BrowserSession session = new BrowserSession(playwright, properties);
        session.launch(true);
        doThrow(new RuntimeException("target closed")).when(browser).close();

        session.close();
        session.close();

        verify(playwright, times(1)).close();
        assertThat(session.page()).isNull();
    }

    @Test
    public void shouldNotTouchBrowserWhenNeverLaunched() {
        BrowserSession session = new BrowserSession(playwright, properties);

        session.close();

        verify(playwright, never()).chromium();
        verify(playwright).close();
    }

}
