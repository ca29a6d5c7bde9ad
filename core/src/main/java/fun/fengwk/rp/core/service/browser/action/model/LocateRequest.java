package fun.fengwk.rp.core.service.browser.action.model;

import lombok.Builder;
import lombok.Data;

/**
 * Element lookup request. The first non-blank strategy wins: selector, role, label.
 *
 * @author fengwk
 */
@Data
@Builder
public class LocateRequest {

    /**
     * CSS selector, may contain {@code {variable}} placeholders.
     */
    private String selector;

    /**
     * ARIA role, e.g. button.
     */
    private String role;

    /**
     * Accessible name used together with role.
     */
    private String name;

    private String label;

    /**
     * Name under which the located element is registered for later steps.
     */
    private String alias;

}
