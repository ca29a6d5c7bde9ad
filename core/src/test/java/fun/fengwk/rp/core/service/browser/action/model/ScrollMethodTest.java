package fun.fengwk.rp.core.service.browser.action.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ScrollMethodTest {

    @Test
    public void shouldParseMethods() {
        assertThat(ScrollMethod.fromValue("scroll_into_view")).isEqualTo(ScrollMethod.SCROLL_INTO_VIEW);
        assertThat(ScrollMethod.fromValue(" Mouse_Wheel ")).isEqualTo(ScrollMethod.MOUSE_WHEEL);
        assertThat(ScrollMethod.fromValue("page_evaluate")).isEqualTo(ScrollMethod.PAGE_EVALUATE);
    }

    @Test
    public void shouldDefaultToEvaluate() {
        assertThat(ScrollMethod.fromValue(null)).isEqualTo(ScrollMethod.EVALUATE);
        assertThat(ScrollMethod.fromValue("")).isEqualTo(ScrollMethod.EVALUATE);
    }

    @Test
    public void shouldRejectUnknownMethod() {
        assertThatThrownBy(() -> ScrollMethod.fromValue("teleport"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown scrolling method: teleport");
    }

}
