package Codify.grading.client;

import Codify.grading.model.ProblemRubric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Optional;

@Slf4j
@Component
public class ProblemBankClient implements RubricProvider {

    private final RestClient restClient;

    public ProblemBankClient(@Qualifier("problemBankRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<ProblemRubric> fetch(String topicOrName) {
        if (topicOrName == null || topicOrName.isBlank()) {
            return Optional.empty();
        }
        String problemId = problemIdOf(topicOrName);

        try {
            ResponseEntity<ProblemRubric> response = restClient.get()
                    .uri("/problems/{id}", problemId)
                    .retrieve()
                    .toEntity(ProblemRubric.class);
            if (response.getStatusCode().value() == 200) {
                return Optional.ofNullable(response.getBody());
            }
            log.debug("Problem '{}' not available (HTTP {})", problemId, response.getStatusCode().value());
            return Optional.empty();
        } catch (RestClientResponseException e) {
            log.debug("Problem '{}' not found (HTTP {})", problemId, e.getStatusCode().value());
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("Failed to fetch problem '{}': {}", problemId, e.getMessage());
            return Optional.empty();
        }
    }

    // "binary_search.java" -> "binary_search"
    static String problemIdOf(String topicOrName) {
        String trimmed = topicOrName.trim();
        return trimmed.endsWith(".java") ? trimmed.substring(0, trimmed.length() - ".java".length()) : trimmed;
    }
}
