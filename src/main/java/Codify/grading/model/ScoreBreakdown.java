package Codify.grading.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

// 리뷰어 점수는 항목별로 자르고 리뷰어의 total을 그대로 둔다
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScoreBreakdown(int total, int logic, int algorithm, int style, int optimization) {

    public static final int MAX_TOTAL = 100;
    public static final int MAX_LOGIC = 40;
    public static final int MAX_ALGORITHM = 40;
    public static final int MAX_STYLE = 10;
    public static final int MAX_OPTIMIZATION = 10;

    public static ScoreBreakdown of(int logic, int algorithm, int style, int optimization) {
        int l = clamp(logic, MAX_LOGIC);
        int a = clamp(algorithm, MAX_ALGORITHM);
        int s = clamp(style, MAX_STYLE);
        int o = clamp(optimization, MAX_OPTIMIZATION);
        return new ScoreBreakdown(l + a + s + o, l, a, s, o);
    }

    public static ScoreBreakdown reviewed(int total, int logic, int algorithm, int style, int optimization) {
        return new ScoreBreakdown(
                clamp(total, MAX_TOTAL),
                clamp(logic, MAX_LOGIC),
                clamp(algorithm, MAX_ALGORITHM),
                clamp(style, MAX_STYLE),
                clamp(optimization, MAX_OPTIMIZATION));
    }

    public static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
