package fun.fengwk.rp.core.service.readme;

import fun.fengwk.rp.core.service.readme.model.CategoryReadmeInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class ReadmeGeneratorTest {

    @TempDir
    Path tempDir;

    private ChatModel chatModel;
    private ObjectProvider<ChatModel> chatModelProvider;
    private ReadmeProperties properties;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        chatModel = mock(ChatModel.class);
        chatModelProvider = mock(ObjectProvider.class);
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
        properties = new ReadmeProperties();
        properties.setOutputPath(tempDir.resolve("docs/README.md").toString());
    }

    @Test
    public void shouldGenerateAndSaveReadme() throws Exception {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("```markdown\n# Inputs\n\nButtons.\n```"));
        ReadmeGenerator generator = new ReadmeGenerator(chatModelProvider, properties);

        String readme = generator.generate(input());

        assertThat(readme).isEqualTo("# Inputs\n\nButtons.");
        assertThat(Files.readString(tempDir.resolve("docs/README.md"), StandardCharsets.UTF_8))
            .isEqualTo("# Inputs\n\nButtons.");

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        Prompt prompt = captor.getValue();
        assertThat(prompt.getOptions().getModel()).isEqualTo("gpt-4o");
        assertThat(prompt.getOptions().getMaxTokens()).isEqualTo(1500);
        assertThat(prompt.getOptions().getTemperature()).isEqualTo(0.5);
        assertThat(prompt.getContents())
            .contains("# {{library}}")
            .contains("\"task\" : \"button\"")
            .contains("https://img.example.com/button.png");
    }

    @Test
    public void shouldFailWithoutChatModel() {
        when(chatModelProvider.getIfAvailable()).thenReturn(null);
        ReadmeGenerator generator = new ReadmeGenerator(chatModelProvider, properties);

        assertThatThrownBy(() -> generator.generate(input()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Chat model not configured. Please set the OPENAI_API_KEY environment variable.");
    }

    @Test
    public void shouldFailOnBlankResponse() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("  "));
        ReadmeGenerator generator = new ReadmeGenerator(chatModelProvider, properties);

        assertThatThrownBy(() -> generator.generate(input()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("chat model returned an empty README");
        assertThat(tempDir.resolve("docs/README.md")).doesNotExist();
    }

    @Test
    public void shouldStripOnlyEnclosingCodeFence() {
        assertThat(ReadmeGenerator.stripCodeFence("```\nbody\n```")).isEqualTo("body");
        assertThat(ReadmeGenerator.stripCodeFence("# Title\n```java\ncode\n```")).isEqualTo("# Title\n```java\ncode\n```");
    }

    private static CategoryReadmeInput input() {
        return CategoryReadmeInput.builder()
            .categoryInfo(List.<Object>of(Map.of("task", "button")))
            .readmeTemplate("# {{library}}")
            .screenshotLinks(List.of("https://img.example.com/button.png"))
            .build();
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

}
