package fun.fengwk.rp.core.service.browser.action.model;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * How option values of a select request are matched.
 *
 * @author fengwk
 */
public enum SelectBy {

    /**
     * Match by value or label, the driver default.
     */
    ANY(""),
    LABEL("label"),
    VALUE("value"),
    INDEX("index");

    private final String value;

    SelectBy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SelectBy fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return ANY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SelectBy by : values()) {
            if (by.value.equals(normalized)) {
                return by;
            }
        }
        throw new IllegalArgumentException("unsupported select option key: " + value);
    }

}
