package Codify.grading.model;

import java.util.List;

public record GradingRequest(String studentName,
                             String topic,
                             String assignmentCode,
                             String callbackUrl,
                             List<SourceUnit> units) {

    public GradingRequest {
        units = units == null ? List.of() : List.copyOf(units);
    }

    public GradingRequest withStudentName(String name) {
        return new GradingRequest(name, topic, assignmentCode, callbackUrl, units);
    }

    public boolean hasCallback() {
        return callbackUrl != null && !callbackUrl.isBlank();
    }
}
