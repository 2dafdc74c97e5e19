package Codify.grading.repository;

// 집계 결과가 없으면 합계/평균 값은 null
public interface GradeStatsView {
    Long getTotalSubmissions();

    Double getAvgScore();

    Integer getMaxScore();

    Integer getMinScore();

    Long getPassed();

    Long getFailed();

    Long getFlagged();
}
