package fun.fengwk.rp.core.service.browser.action.model;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one browser action.
 *
 * @author fengwk
 */
@Data
@Builder
public class BrowserActionResult {

    private String action;

    /**
     * Current page url after the action, empty when no page is open.
     */
    private String pageUrl;

    private String message;

    /**
     * Action specific output, e.g. screenshot path or captured endpoint.
     */
    private String value;

}
