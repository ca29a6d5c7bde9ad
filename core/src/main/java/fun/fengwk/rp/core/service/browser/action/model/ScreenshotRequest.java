package fun.fengwk.rp.core.service.browser.action.model;

import lombok.Builder;
import lombok.Data;

/**
 * Screenshot request.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScreenshotRequest {

    /**
     * Optional element alias, blank captures the page.
     */
    private String alias;

    private String path;

    /**
     * Capture the full scrollable page, only used without an element.
     */
    private boolean fullPage;

}
