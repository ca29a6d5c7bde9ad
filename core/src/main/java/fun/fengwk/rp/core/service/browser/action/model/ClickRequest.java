package fun.fengwk.rp.core.service.browser.action.model;

import lombok.Builder;
import lombok.Data;

/**
 * Click request. Without an element the position is clicked on the page.
 *
 * @author fengwk
 */
@Data
@Builder
public class ClickRequest {

    /**
     * Alias of a previously identified element.
     */
    private String alias;

    /**
     * CSS selector used when no alias is given, may contain placeholders.
     */
    private String selector;

    private boolean doubleClick;

    private Double x;

    private Double y;

    public boolean hasPosition() {
        return x != null && y != null;
    }

}
