package Codify.grading.web.dto;

import Codify.grading.exception.ErrorCode;

public record ErrorResponseDto(String code, String message) {
    public static ErrorResponseDto of(ErrorCode errorCode, String message) {
        return new ErrorResponseDto(errorCode.getCode(), message);
    }
}
