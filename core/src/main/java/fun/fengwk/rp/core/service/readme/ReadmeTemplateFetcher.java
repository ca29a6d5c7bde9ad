package fun.fengwk.rp.core.service.readme;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetches README templates, typically from a GitHub raw url.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ReadmeTemplateFetcher {

    private final ReadmeProperties properties;
    private final HttpClient httpClient;

    @Autowired
    public ReadmeTemplateFetcher(ReadmeProperties properties) {
        this(properties, buildHttpClient(properties));
    }

    ReadmeTemplateFetcher(ReadmeProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    public String fetch(String url) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("README url must be provided");
        }
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(url.trim()))
            .GET();
        if (properties.getFetchTimeoutMs() > 0) {
            requestBuilder.timeout(Duration.ofMillis(properties.getFetchTimeoutMs()));
        }
        HttpRequest request = requestBuilder.build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            log.warn("fetch README failed, url={}, error={}", url, ex.getMessage());
            throw new IllegalStateException("Failed to fetch README content: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while fetching README content", ex);
        }

        if (response.statusCode() != 200) {
            log.warn("fetch README failed, url={}, status={}", url, response.statusCode());
            throw new IllegalStateException("Failed to fetch README content, status code: " + response.statusCode());
        }
        log.info("fetched README content, url={}, length={}", url, response.body().length());
        return response.body();
    }

    private static HttpClient buildHttpClient(ReadmeProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL);
        if (properties.getFetchTimeoutMs() > 0) {
            builder.connectTimeout(Duration.ofMillis(properties.getFetchTimeoutMs()));
        }
        return builder.build();
    }

}
