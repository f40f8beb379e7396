package com.baykanat.musicstream.domain.exception;

/** Skorlama modeline ulaşılamadı veya timeout; geçici, caller backoff ile tekrar deneyebilir. Default skorla ikame edilmez. */
public class ModelUnavailableException extends PipelineException {

    private final int retryAfterSeconds;

    public ModelUnavailableException(String message, String context, int retryAfterSeconds, Throwable cause) {
        super(message, context, cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
