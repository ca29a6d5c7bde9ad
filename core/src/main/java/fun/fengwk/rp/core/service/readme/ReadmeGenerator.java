package fun.fengwk.rp.core.service.readme;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fun.fengwk.rp.core.service.readme.model.CategoryReadmeInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drafts a category README with a chat model and saves it to disk.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ReadmeGenerator {

    private static final Pattern CODE_FENCE = Pattern.compile("^\\s*```[a-zA-Z]*\\s*\\n(.*?)\\n\\s*```\\s*$", Pattern.DOTALL);

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ReadmeProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ReadmeGenerator(ObjectProvider<ChatModel> chatModelProvider, ReadmeProperties properties) {
        this.chatModelProvider = chatModelProvider;
        this.properties = properties;
    }

    public String generate(CategoryReadmeInput input) {
        if (input == null) {
            throw new IllegalArgumentException("readme input must not be null");
        }
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new IllegalStateException(
                "Chat model not configured. Please set the OPENAI_API_KEY environment variable.");
        }

        String prompt = buildPrompt(input);
        log.debug("readme prompt built, length={}", prompt.length());
        ChatOptions options = ChatOptions.builder()
            .model(properties.getModel())
            .maxTokens(properties.getMaxTokens())
            .temperature(properties.getTemperature())
            .build();
        ChatResponse response = chatModel.call(new Prompt(new UserMessage(prompt), options));
        String readme = response == null || response.getResult() == null
            ? null
            : response.getResult().getOutput().getText();
        if (!StringUtils.hasText(readme)) {
            throw new IllegalStateException("chat model returned an empty README");
        }
        readme = stripCodeFence(readme);

        Path outputPath = write(readme);
        log.info("README generated, model={}, length={}, path={}", properties.getModel(), readme.length(), outputPath);
        return readme;
    }

    String buildPrompt(CategoryReadmeInput input) {
        String template = input.getReadmeTemplate() == null ? "" : input.getReadmeTemplate();
        List<Object> categoryInfo = input.getCategoryInfo() == null ? List.of() : input.getCategoryInfo();
        List<String> screenshotLinks = input.getScreenshotLinks() == null ? List.of() : input.getScreenshotLinks();
        return "You are a documentation generator. Generate a new README in Markdown format for a component library "
            + "using the following details. The README must follow the style and structure of the provided template. "
            + "It should be concise, clear, and natural, without unnecessary filler or signs of AI generation.\n\n"
            + "Template (Markdown):\n"
            + template + "\n\n"
            + "Category Information (components library details):\n"
            + toJson(categoryInfo) + "\n\n"
            + "Screenshot Links for the first two components:\n"
            + toJson(screenshotLinks) + "\n\n"
            + "Using the above information, generate a new README in Markdown format that summarizes the key features "
            + "of the library, describes its main components, and includes the provided screenshot links as visual "
            + "references. Do not enclose the text within Markdown code fences such as ```markdown```. "
            + "You must strictly adhere to the given template, maintaining its exact structure, paragraph "
            + "organization, and formatting. Do not alter the writing style or add any unnecessary content.";
    }

    static String stripCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        return matcher.matches() ? matcher.group(1) : text;
    }

    private Path write(String readme) {
        Path path = Paths.get(properties.getOutputPath()).toAbsolutePath().normalize();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, readme, StandardCharsets.UTF_8);
            return path;
        } catch (IOException ex) {
            log.warn("failed to save README, path={}", path, ex);
            throw new IllegalStateException("failed to save README to " + path + ": " + ex.getMessage(), ex);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("readme input is not serializable: " + ex.getOriginalMessage(), ex);
        }
    }

}
