package com.example.gateway.shared.exception;

public class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
