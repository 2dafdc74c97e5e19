package Codify.grading.model;

public enum GradeStatus {
    PENDING,
    PASS,
    FAIL,
    // 보안 위반 또는 중복 제출. 한번 FLAG가 되면 이후 병합에서 바뀌지 않는다
    FLAG
}
