package Codify.grading.service;

import Codify.grading.config.GradingProperties;
import Codify.grading.exception.ErrorCode;
import Codify.grading.exception.baseException.BaseException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

// 모든 job이 공유하는 리뷰 동시 실행 제한
@Component
public class ReviewLimiter {
    private final Semaphore permits;

    @Autowired
    public ReviewLimiter(GradingProperties properties) {
        this(properties.getMaxConcurrentReviews());
    }

    ReviewLimiter(int capacity) {
        this.permits = new Semaphore(capacity, true);
    }

    public <T> T call(Supplier<T> task) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BaseException(ErrorCode.JOB_INTERRUPTED, "Interrupted while waiting for a review slot", e);
        }
        try {
            return task.get();
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }
}
