package Codify.grading.service;

import Codify.grading.config.GradingProperties;
import Codify.grading.model.GradingJob;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

// TTL이 지난 job은 sweep 전이라도 없는 것으로 본다
@Component
public class GradingJobStore {
    private final ConcurrentMap<UUID, GradingJob> jobs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public GradingJobStore(Clock clock, GradingProperties properties) {
        this(clock, properties.getJobs().getTtl());
    }

    GradingJobStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public GradingJob create(String studentName) {
        GradingJob job = GradingJob.pending(UUID.randomUUID(), clock.instant(), studentName);
        jobs.put(job.getId(), job);
        return job;
    }

    public Optional<GradingJob> find(UUID jobId) {
        GradingJob job = jobs.get(jobId);
        if (job == null || isExpired(job, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(job);
    }

    public Optional<GradingJob> update(UUID jobId, UnaryOperator<GradingJob> change) {
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (id, current) -> change.apply(current)));
    }

    // 상태와 관계없이 만료된 job 제거
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<UUID, GradingJob> entry : jobs.entrySet()) {
            if (isExpired(entry.getValue(), now) && jobs.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return jobs.size();
    }

    private boolean isExpired(GradingJob job, Instant now) {
        return now.isAfter(job.getCreatedAt().plus(ttl));
    }
}
