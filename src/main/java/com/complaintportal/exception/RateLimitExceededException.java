package com.complaintportal.exception;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends BusinessException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(ErrorMessage errorMessage, long retryAfterSeconds) {
        super(errorMessage);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
