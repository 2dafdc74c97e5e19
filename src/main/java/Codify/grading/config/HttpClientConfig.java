package Codify.grading.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

// 외부 호출마다 고정 타임아웃을 둔다 (리뷰어, 문제 은행, 웹훅)
@Configuration
public class HttpClientConfig {

    @Bean("reviewerRestClient")
    public RestClient reviewerRestClient(RestClient.Builder builder, GradingProperties properties) {
        GradingProperties.Reviewer reviewer = properties.getReviewer();
        return builder.clone()
                .baseUrl(reviewer.getBaseUrl())
                .requestFactory(requestFactory(reviewer.getTimeout()))
                .build();
    }

    @Bean("problemBankRestClient")
    public RestClient problemBankRestClient(RestClient.Builder builder, GradingProperties properties) {
        GradingProperties.ProblemBank problemBank = properties.getProblemBank();
        return builder.clone()
                .baseUrl(problemBank.getBaseUrl())
                .defaultHeader("x-api-key", problemBank.getApiKey())
                .requestFactory(requestFactory(problemBank.getTimeout()))
                .build();
    }

    @Bean("webhookRestClient")
    public RestClient webhookRestClient(RestClient.Builder builder, GradingProperties properties) {
        return builder.clone()
                .requestFactory(requestFactory(properties.getWebhook().getTimeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }
}
