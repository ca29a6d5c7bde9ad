package fun.fengwk.rp.core.service.browser.runtime;

import com.microsoft.playwright.Playwright;
import fun.fengwk.rp.core.service.browser.BrowserProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Owns the single browser worker of this process.
 *
 * <p>The worker and its session are created lazily by the first {@link #getOrCreate()} call;
 * later calls return the same dispatcher. A failed creation leaves the manager uninitialized
 * so the next call retries.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserWorkerManager {

    private static final long SHUTDOWN_JOIN_TIMEOUT_MS = 5000;

    private final BrowserProperties browserProperties;
    private final BrowserSessionFactory sessionFactory;
    private final Object lock = new Object();
    private volatile BrowserDispatcher dispatcher;
    private volatile boolean shutdown = false;

    @Autowired
    public BrowserWorkerManager(BrowserProperties browserProperties) {
        this(browserProperties, () -> new BrowserSession(Playwright.create(), browserProperties));
    }

    BrowserWorkerManager(BrowserProperties browserProperties, BrowserSessionFactory sessionFactory) {
        this.browserProperties = browserProperties;
        this.sessionFactory = sessionFactory;
    }

    public BrowserDispatcher getOrCreate() {
        if (shutdown) {
            throw new IllegalStateException("browser worker manager is shutdown");
        }
        BrowserDispatcher current = dispatcher;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("browser worker manager is shutdown");
            }
            if (dispatcher == null) {
                dispatcher = createDispatcher();
            }
            return dispatcher;
        }
    }

    public boolean isInitialized() {
        return dispatcher != null;
    }

    @PreDestroy
    public void shutdown() {
        BrowserDispatcher current;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            current = dispatcher;
        }
        if (current != null) {
            current.worker().shutdown(SHUTDOWN_JOIN_TIMEOUT_MS);
        }
    }

    private BrowserDispatcher createDispatcher() {
        TaskMailbox mailbox = new TaskMailbox(browserProperties.getMailboxWarnSize());
        BrowserWorker worker = new BrowserWorker(browserProperties.getWorkerThreadName(), sessionFactory, mailbox);
        try {
            worker.start();
        } catch (RuntimeException ex) {
            log.warn("failed to start browser worker, error={}", ex.getMessage());
            throw ex;
        } catch (Exception ex) {
            log.warn("failed to start browser worker, error={}", ex.getMessage());
            throw new IllegalStateException("failed to start browser worker: " + ex.getMessage(), ex);
        }
        log.info("browser worker created, thread={}", browserProperties.getWorkerThreadName());
        return new BrowserDispatcher(worker, browserProperties.getSubmitTimeoutMs());
    }

}
