package Codify.grading.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {
    static final String GRADING_JOBS_TAG = "Grading Jobs";
    static final String SCORES_TAG = "Scores";

    @Bean
    public OpenAPI codifyGradingOpenApi() {
        Info info = new Info()
                .title("Codify Grading API")
                .description("""
                        Java 제출물 정적 분석, 리뷰어 채점, 배치 내 중복 제출 탐지.
                        - 채점은 비동기 job으로 실행되며 상태 조회 또는 callback_url 웹훅으로 결과를 받습니다.
                        - 저장된 점수는 학생별, 과제별, 통계로 조회할 수 있습니다.
                        """)
                .version("1.0.0");

        // 추후에 Spring Security 관련 설정 필요
        return new OpenAPI()
                .addServersItem(new Server().url("/"))
                .info(info)
                .addTagsItem(new Tag().name(GRADING_JOBS_TAG)
                        .description("POST /api/grading/jobs 로 채점 시작, GET /api/grading/jobs/{jobId} 로 상태 조회"))
                .addTagsItem(new Tag().name(SCORES_TAG)
                        .description("저장된 채점 기록 조회 (학생별, 과제별, 점수 분포)"));
    }
}
