package Codify.grading.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "grading")
public class GradingProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double plagiarismThreshold = 0.85;

    @Min(0)
    @Max(100)
    private int passScoreThreshold = 50;

    // 외부 리뷰어 동시 호출 상한 (모든 job 공유)
    @Min(1)
    private int maxConcurrentReviews = 50;

    @NotBlank
    private String anonymousStudentName = "Anonymous";

    @Valid
    private Jobs jobs = new Jobs();

    @Valid
    private Webhook webhook = new Webhook();

    @Valid
    private Reviewer reviewer = new Reviewer();

    @Valid
    private ProblemBank problemBank = new ProblemBank();

    @Data
    public static class Jobs {
        @NotNull
        private Duration ttl = Duration.ofHours(1);

        @NotNull
        private Duration sweepInterval = Duration.ofHours(1);
    }

    @Data
    public static class Webhook {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        // 실패 후 2^attempt * backoffUnit 만큼 대기
        @NotNull
        private Duration backoffUnit = Duration.ofSeconds(1);
    }

    @Data
    public static class Reviewer {
        // 비어 있으면 리뷰어 없이 대체 점수만 사용
        private String apiKey = "";

        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com";

        @NotBlank
        private String apiVersion = "v1beta";

        @NotBlank
        private String model = "gemini-2.0-flash";

        private double temperature = 0.1;

        private int maxOutputTokens = 4096;

        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ProblemBank {
        @NotBlank
        private String baseUrl = "http://localhost:8090";

        private String apiKey = "";

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }
}
