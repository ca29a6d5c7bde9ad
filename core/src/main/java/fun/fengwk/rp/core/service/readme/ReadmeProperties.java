package fun.fengwk.rp.core.service.readme;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * README drafting configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rp.readme")
public class ReadmeProperties {

    /**
     * Chat model used to draft READMEs.
     */
    private String model = "gpt-4o";

    private int maxTokens = 1500;

    private double temperature = 0.5;

    /**
     * File the generated README is written to.
     */
    private String outputPath = "README.md";

    /**
     * Timeout for fetching README templates, 0 or less means no timeout.
     */
    private int fetchTimeoutMs = 10000;

}
