package Codify.grading.exception.analysisexception;

import Codify.grading.exception.ErrorCode;
import Codify.grading.exception.baseException.BaseException;
import lombok.Getter;

@Getter
public class SourceParseException extends BaseException {
    private final int line;
    private final String reason;

    public SourceParseException(int line, String reason) {
        super(ErrorCode.SOURCE_PARSE_ERROR, "Syntax error at line " + line + ": " + reason);
        this.line = line;
        this.reason = reason;
    }
}
