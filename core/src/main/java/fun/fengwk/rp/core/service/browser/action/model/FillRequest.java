package fun.fengwk.rp.core.service.browser.action.model;

import lombok.Builder;
import lombok.Data;

/**
 * Fill request.
 *
 * @author fengwk
 */
@Data
@Builder
public class FillRequest {

    private String alias;

    private String text;

    /**
     * Type key by key instead of setting the value at once.
     */
    private boolean sequential;

    /**
     * Delay between key presses in sequential mode.
     */
    private int delayMs;

}
