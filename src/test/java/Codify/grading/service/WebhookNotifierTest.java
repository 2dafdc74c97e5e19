package Codify.grading.service;

import Codify.grading.model.JobSummary;
import Codify.grading.service.dto.WebhookPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("Webhook Notifier Tests")
class WebhookNotifierTest {

    private static final String CALLBACK = "http://hook.test/callback";

    private MockRestServiceServer server;
    private List<Duration> waits;
    private WebhookNotifier notifier;
    private WebhookPayload payload;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        waits = new ArrayList<>();
        notifier = new WebhookNotifier(builder.build(), Runnable::run, 3, Duration.ofMillis(10));
        notifier.retry().getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval()));
        payload = WebhookPayload.completed(UUID.fromString("6f1c2a34-0000-4000-8000-000000000001"),
                List.of(), new JobSummary(0, null, 0.1, 0));
    }

    @Test
    @DisplayName("Should post the payload once when the receiver accepts it")
    void dispatch_Success_ShouldPostOnce() {
        // Given
        server.expect(requestTo(CALLBACK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.event").value("grading_completed"))
                .andExpect(jsonPath("$.job_id").value("6f1c2a34-0000-4000-8000-000000000001"))
                .andExpect(jsonPath("$.summary.file_count").value(0))
                .andRespond(withSuccess());

        // When
        boolean delivered = notifier.dispatch(CALLBACK, payload).join();

        // Then
        assertTrue(delivered);
        assertTrue(waits.isEmpty());
        server.verify();
    }

    @Test
    @DisplayName("Should back off 2 then 4 units and succeed on the third attempt")
    void deliver_TwoFailures_ShouldRetryWithBackoff() {
        // Given
        server.expect(ExpectedCount.times(2), requestTo(CALLBACK)).andRespond(withServerError());
        server.expect(requestTo(CALLBACK)).andRespond(withSuccess());

        // When
        boolean delivered = notifier.deliver(CALLBACK, payload);

        // Then
        assertTrue(delivered);
        assertEquals(List.of(Duration.ofMillis(20), Duration.ofMillis(40)), waits);
        server.verify();
    }

    @Test
    @DisplayName("Should give up after the last attempt without sleeping again")
    void deliver_AllFailures_ShouldReturnFalse() {
        // Given
        server.expect(ExpectedCount.times(3), requestTo(CALLBACK)).andRespond(withBadRequest());

        // When
        boolean delivered = notifier.deliver(CALLBACK, payload);

        // Then
        assertFalse(delivered);
        assertEquals(List.of(Duration.ofMillis(20), Duration.ofMillis(40)), waits);
        server.verify();
    }

    @Test
    @DisplayName("A full notification queue should report non-delivery instead of throwing")
    void dispatch_Rejected_ShouldReturnFalse() {
        // Given
        WebhookNotifier rejecting = new WebhookNotifier(RestClient.create(), task -> {
            throw new RejectedExecutionException("webhook queue full");
        }, 3, Duration.ofMillis(10));

        // When
        boolean delivered = rejecting.dispatch(CALLBACK, payload).join();

        // Then
        assertFalse(delivered);
    }
}
