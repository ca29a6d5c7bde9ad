package fun.fengwk.rp.core;

import fun.fengwk.rp.core.mcp.BrowserMcp;
import fun.fengwk.rp.core.mcp.ReadmeMcp;
import fun.fengwk.rp.core.service.browser.BrowserProperties;
import fun.fengwk.rp.core.service.browser.runtime.BrowserWorkerManager;
import fun.fengwk.rp.core.service.readme.ReadmeProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class CoreAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CoreAutoConfiguration.class));

    @Test
    public void shouldWireToolsWithoutStartingBrowser() {
        contextRunner
            .withPropertyValues(
                "rp.browser.headless=true",
                "rp.browser.submit-timeout-ms=60000",
                "rp.readme.model=gpt-4o-mini")
            .run(context -> {
                assertThat(context).hasSingleBean(BrowserMcp.class);
                assertThat(context).hasSingleBean(ReadmeMcp.class);
                assertThat(context.getBean(BrowserProperties.class).isHeadless()).isTrue();
                assertThat(context.getBean(BrowserProperties.class).getSubmitTimeoutMs()).isEqualTo(60000);
                assertThat(context.getBean(ReadmeProperties.class).getModel()).isEqualTo("gpt-4o-mini");
                assertThat(context.getBean(BrowserWorkerManager.class).isInitialized()).isFalse();
            });
    }

}
