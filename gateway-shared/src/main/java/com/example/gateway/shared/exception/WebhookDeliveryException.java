package com.example.gateway.shared.exception;

/** Logged by the dispatcher only; never reaches a publisher or an HTTP caller. */
public class WebhookDeliveryException extends GatewayException {

    public WebhookDeliveryException(String message) {
        super(ErrorCode.WEBHOOK_DELIVERY_FAILED, message);
    }

    public WebhookDeliveryException(String message, Throwable cause) {
        super(ErrorCode.WEBHOOK_DELIVERY_FAILED, message, cause);
    }
}
