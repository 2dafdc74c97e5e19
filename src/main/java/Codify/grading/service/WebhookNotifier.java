package Codify.grading.service;

import Codify.grading.config.GradingProperties;
import Codify.grading.exception.jobexception.WebhookDeliveryException;
import Codify.grading.service.dto.WebhookPayload;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

// 웹훅 전송 실패는 로그만 남기고 job에는 전파하지 않는다
@Slf4j
@Component
public class WebhookNotifier {
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final RestClient restClient;
    private final Executor notificationExecutor;
    private final Retry retry;

    @Autowired
    public WebhookNotifier(@Qualifier("webhookRestClient") RestClient restClient,
                           @Qualifier("notificationExecutor") Executor notificationExecutor,
                           GradingProperties properties) {
        this(restClient, notificationExecutor, properties.getWebhook().getMaxAttempts(),
                properties.getWebhook().getBackoffUnit());
    }

    WebhookNotifier(RestClient restClient, Executor notificationExecutor, int maxAttempts, Duration backoffUnit) {
        this.restClient = restClient;
        this.notificationExecutor = notificationExecutor;
        this.retry = Retry.of("webhook", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                // n번째 실패 후 backoffUnit * 2^n 대기
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        backoffUnit.multipliedBy(2), BACKOFF_MULTIPLIER))
                .retryExceptions(RuntimeException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn("Webhook attempt {}/{} failed: {} (retry in {})",
                event.getNumberOfRetryAttempts(), maxAttempts,
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage(),
                event.getWaitInterval()));
    }

    public CompletableFuture<Boolean> dispatch(String callbackUrl, WebhookPayload payload) {
        try {
            return CompletableFuture.supplyAsync(() -> deliver(callbackUrl, payload), notificationExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Webhook to {} not scheduled (job={}): {}", callbackUrl, payload.jobId(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    public boolean deliver(String callbackUrl, WebhookPayload payload) {
        Supplier<Boolean> attempt = Retry.decorateSupplier(retry, () -> {
            post(callbackUrl, payload);
            return true;
        });
        try {
            attempt.get();
            log.info("Webhook sent to {} (job={})", callbackUrl, payload.jobId());
            return true;
        } catch (RuntimeException e) {
            log.error("Webhook delivery to {} failed after {} attempts (job={}): {}",
                    callbackUrl, retry.getRetryConfig().getMaxAttempts(), payload.jobId(), e.getMessage());
            return false;
        }
    }

    Retry retry() {
        return retry;
    }

    private void post(String callbackUrl, WebhookPayload payload) {
        ResponseEntity<Void> response = restClient.post()
                .uri(URI.create(callbackUrl))
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .toBodilessEntity();
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new WebhookDeliveryException("HTTP " + response.getStatusCode().value());
        }
    }
}
