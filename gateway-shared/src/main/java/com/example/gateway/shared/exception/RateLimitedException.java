package com.example.gateway.shared.exception;

public class RateLimitedException extends GatewayException {

    public RateLimitedException(String message) {
        super(ErrorCode.RATE_LIMITED, message);
    }
}
