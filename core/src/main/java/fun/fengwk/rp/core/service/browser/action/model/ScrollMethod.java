package fun.fengwk.rp.core.service.browser.action.model;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Supported scroll methods.
 *
 * @author fengwk
 */
public enum ScrollMethod {

    SCROLL_INTO_VIEW("scroll_into_view"),
    MOUSE_WHEEL("mouse_wheel"),
    EVALUATE("evaluate"),
    PAGE_EVALUATE("page_evaluate");

    private final String value;

    ScrollMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ScrollMethod fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return EVALUATE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScrollMethod method : values()) {
            if (method.value.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown scrolling method: " + normalized);
    }

}
