package fun.fengwk.rp.core.service.browser.runtime;

/**
 * Operation executed on the browser thread against the owned session.
 *
 * @param <T> task result type
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserTask<T> {

    T execute(BrowserSession session) throws Exception;

}
