package fun.fengwk.rp.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Browser runtime configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rp.browser")
public class BrowserProperties {

    /**
     * Headless mode used when an open request does not specify one.
     */
    private boolean headless = false;

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of();

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    /**
     * Slow down every driver operation by this many milliseconds, 0 disables.
     */
    private double slowMoMs = 0;

    /**
     * Default timeout applied to newly opened pages, 0 keeps the driver default.
     */
    private long defaultTimeoutMs = 0;

    /**
     * How long a submitter waits for its task result, 0 means wait forever.
     */
    private long submitTimeoutMs = 0;

    /**
     * Pending task count above which the mailbox logs a warning, 0 disables.
     */
    private int mailboxWarnSize = 100;

    /**
     * Name of the dedicated browser thread.
     */
    private String workerThreadName = "rp-browser-worker";

}
