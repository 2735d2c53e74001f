package com.complaintportal.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorMessage {
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "Validation failed"),
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST, "Malformed JSON request"),
    INVALID_ADMIN_PASSWORD(HttpStatus.UNAUTHORIZED, "Invalid admin password"),
    MISSING_TOKEN(HttpStatus.UNAUTHORIZED, "Missing token"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid token"),
    ADMIN_ROLE_REQUIRED(HttpStatus.FORBIDDEN, "Admin role required"),
    COMPLAINT_NOT_FOUND(HttpStatus.NOT_FOUND, "Complaint not found"),
    PAYLOAD_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE, "Request body too large"),
    TOO_MANY_COMPLAINTS(HttpStatus.TOO_MANY_REQUESTS,
            "Too many complaints created from this IP, please try again later."),
    TOO_MANY_UPVOTES(HttpStatus.TOO_MANY_REQUESTS, "Too many upvotes from this IP, please slow down."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String message;

    ErrorMessage(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }
}
