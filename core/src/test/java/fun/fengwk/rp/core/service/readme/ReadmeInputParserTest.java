package fun.fengwk.rp.core.service.readme;

import fun.fengwk.rp.core.service.readme.model.CategoryDetails;
import fun.fengwk.rp.core.service.readme.model.CategoryReadmeInput;
import fun.fengwk.rp.core.service.readme.model.ComponentDetails;
import fun.fengwk.rp.core.service.readme.model.ComponentPaths;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ReadmeInputParserTest {

    private final ReadmeInputParser parser = new ReadmeInputParser();

    @Test
    public void shouldParseCategoryReadmeInput() {
        CategoryReadmeInput input = parser.parseCategoryReadmeInput("""
            {
              "category_info": [{"task": "button", "category": "inputs"}],
              "readme_template": "# Title",
              "screenshot_links": ["https://img.example.com/1.png"]
            }
            """);

        assertThat(input.getCategoryInfo()).hasSize(1);
        assertThat(input.getCategoryInfo().get(0)).isEqualTo(Map.of("task", "button", "category", "inputs"));
        assertThat(input.getReadmeTemplate()).isEqualTo("# Title");
        assertThat(input.getScreenshotLinks()).containsExactly("https://img.example.com/1.png");
    }

    @Test
    public void shouldDefaultMissingFieldsToEmpty() {
        CategoryReadmeInput input = parser.parseCategoryReadmeInput("{}");

        assertThat(input.getCategoryInfo()).isEmpty();
        assertThat(input.getReadmeTemplate()).isEmpty();
        assertThat(input.getScreenshotLinks()).isEmpty();
    }

    @Test
    public void shouldParseDetails() {
        ComponentDetails component = parser.parseComponentDetails(
            "{\"url\": \"https://ui.example.com\", \"component_name\": \"button\"}");
        CategoryDetails category = parser.parseCategoryDetails("{\"category_name\": \"inputs\"}");
        ComponentPaths paths = parser.parseComponentPaths(
            "{\"url\": \"https://ui.example.com\", \"file_path\": \"shots/button.png\"}");

        assertThat(component.getComponentName()).isEqualTo("button");
        assertThat(component.getUrl()).isEqualTo("https://ui.example.com");
        assertThat(category.getUrl()).isEmpty();
        assertThat(category.getCategoryName()).isEqualTo("inputs");
        assertThat(paths.getFilePath()).isEqualTo("shots/button.png");
    }

    @Test
    public void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> parser.parseComponentDetails(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("input json is empty");
        assertThatThrownBy(() -> parser.parseComponentDetails("{url:"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("invalid input json");
        assertThatThrownBy(() -> parser.parseComponentDetails("[1, 2]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("input json must be an object");
        assertThatThrownBy(() -> parser.parseCategoryReadmeInput("{\"screenshot_links\": \"a.png\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("expected a json array");
    }

}
