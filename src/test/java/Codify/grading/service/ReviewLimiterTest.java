package Codify.grading.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Review Limiter Tests")
class ReviewLimiterTest {

    @Test
    @DisplayName("Should never run more tasks at once than its capacity")
    void call_ShouldBoundConcurrency() throws Exception {
        // Given
        ReviewLimiter limiter = new ReviewLimiter(2);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(6);

        // When
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            final int n = i;
            futures.add(pool.submit(() -> limiter.call(() -> {
                peak.accumulateAndGet(active.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                active.decrementAndGet();
                return n;
            })));
        }
        for (Future<Integer> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        assertEquals(2, limiter.availablePermits());
    }

    @Test
    @DisplayName("Should release its permit when the task throws")
    void call_ShouldReleaseOnFailure() {
        // Given
        ReviewLimiter limiter = new ReviewLimiter(1);

        // When
        assertThrows(IllegalStateException.class, () -> limiter.call(() -> {
            throw new IllegalStateException("boom");
        }));

        // Then
        assertEquals(1, limiter.availablePermits());
    }
}
