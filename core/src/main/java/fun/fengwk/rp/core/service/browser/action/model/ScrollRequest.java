package fun.fengwk.rp.core.service.browser.action.model;

import lombok.Builder;
import lombok.Data;

/**
 * Scroll request.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScrollRequest {

    /**
     * Optional element alias, blank scrolls the page.
     */
    private String alias;

    private String method;

    private int x;

    private int y;

}
