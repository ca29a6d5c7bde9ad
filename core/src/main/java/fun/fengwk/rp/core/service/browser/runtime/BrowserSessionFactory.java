package fun.fengwk.rp.core.service.browser.runtime;

/**
 * Creates the session owned by a browser worker. Invoked on the worker thread.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession create() throws Exception;

}
