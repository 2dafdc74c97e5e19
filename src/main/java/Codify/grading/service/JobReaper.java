package Codify.grading.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JobReaper {
    private final GradingJobStore jobStore;

    @Scheduled(fixedDelayString = "${grading.jobs.sweep-interval:PT1H}",
            initialDelayString = "${grading.jobs.sweep-interval:PT1H}")
    public void sweep() {
        int removed = jobStore.sweepExpired();
        if (removed > 0) {
            log.info("Cleaned up {} expired grading jobs", removed);
        }
    }
}
