package Codify.grading.exception.jobexception;

import Codify.grading.exception.ErrorCode;
import Codify.grading.exception.baseException.BaseException;

public class JobNotFoundException extends BaseException {
    public JobNotFoundException() {
        super(ErrorCode.JOB_NOT_FOUND);
    }
}
