package Codify.grading.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    // common
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "C001", "Invalid input value"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C002", "Internal server error"),

    // analysis
    SOURCE_PARSE_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "A001", "Source could not be parsed"),

    // review
    REVIEWER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "R001", "Code reviewer is unavailable"),

    // job
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "J001", "Grading job not found"),
    JOB_INTERRUPTED(HttpStatus.INTERNAL_SERVER_ERROR, "J002", "Grading job was interrupted"),

    // notification
    WEBHOOK_DELIVERY_FAILED(HttpStatus.BAD_GATEWAY, "N001", "Webhook delivery failed");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
