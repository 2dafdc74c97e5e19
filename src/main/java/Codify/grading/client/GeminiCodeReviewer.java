package Codify.grading.client;

import Codify.grading.config.GradingProperties;
import Codify.grading.exception.reviewexception.ReviewerUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class GeminiCodeReviewer implements CodeReviewer {

    private final GradingProperties.Reviewer props;
    private final RestClient restClient;

    public GeminiCodeReviewer(GradingProperties properties,
                              @Qualifier("reviewerRestClient") RestClient restClient) {
        this.props = properties.getReviewer();
        this.restClient = restClient;
        if (!isAvailable()) {
            log.warn("Reviewer API key not set. Reviews will use fallback scoring.");
        }
    }

    @Override
    public boolean isAvailable() {
        return StringUtils.hasText(props.getApiKey());
    }

    @Override
    public String review(String prompt) {
        if (!isAvailable()) {
            throw new ReviewerUnavailableException("Reviewer API key not configured");
        }

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "temperature", props.getTemperature(),
                        "topP", 0.95,
                        "topK", 40,
                        "maxOutputTokens", props.getMaxOutputTokens()));

        JsonNode response;
        try {
            // API 키는 URL이 아니라 헤더로 전달
            response = restClient.post()
                    .uri("/{version}/models/{model}:generateContent", props.getApiVersion(), props.getModel())
                    .header("x-goog-api-key", props.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ReviewerUnavailableException("Reviewer call failed: " + e.getMessage(), e);
        }

        String text = response == null ? "" : response.path("candidates").path(0)
                .path("content").path("parts").path(0).path("text").asText("");
        if (text.isBlank()) {
            throw new ReviewerUnavailableException("Reviewer returned no content");
        }
        return text;
    }
}
