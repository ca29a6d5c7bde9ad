package fun.fengwk.rp.core.service.browser.action.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class SelectByTest {

    @Test
    public void shouldParseKeys() {
        assertThat(SelectBy.fromValue(null)).isEqualTo(SelectBy.ANY);
        assertThat(SelectBy.fromValue("LABEL")).isEqualTo(SelectBy.LABEL);
        assertThat(SelectBy.fromValue("index")).isEqualTo(SelectBy.INDEX);
    }

    @Test
    public void shouldRejectUnknownKey() {
        assertThatThrownBy(() -> SelectBy.fromValue("text"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("unsupported select option key: text");
    }

}
