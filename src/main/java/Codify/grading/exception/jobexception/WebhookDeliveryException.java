package Codify.grading.exception.jobexception;

import Codify.grading.exception.ErrorCode;
import Codify.grading.exception.baseException.BaseException;

public class WebhookDeliveryException extends BaseException {
    public WebhookDeliveryException(String detail) {
        super(ErrorCode.WEBHOOK_DELIVERY_FAILED, detail);
    }
}
