package com.linlay.toolseek.upstream;

public class UpstreamException extends RuntimeException {

    private final int statusCode;

    public UpstreamException(String message) {
        this(message, -1, null);
    }

    public UpstreamException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
