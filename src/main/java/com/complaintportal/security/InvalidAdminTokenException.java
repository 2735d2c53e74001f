package com.complaintportal.security;

/** Token is malformed, expired, or signed with another key. */
public class InvalidAdminTokenException extends RuntimeException {

    public InvalidAdminTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
