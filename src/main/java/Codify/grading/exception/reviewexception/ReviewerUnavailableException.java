package Codify.grading.exception.reviewexception;

import Codify.grading.exception.ErrorCode;
import Codify.grading.exception.baseException.BaseException;

public class ReviewerUnavailableException extends BaseException {
    public ReviewerUnavailableException(String detail) {
        super(ErrorCode.REVIEWER_UNAVAILABLE, detail);
    }

    public ReviewerUnavailableException(String detail, Throwable cause) {
        super(ErrorCode.REVIEWER_UNAVAILABLE, detail, cause);
    }
}
