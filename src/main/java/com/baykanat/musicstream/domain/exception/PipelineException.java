package com.baykanat.musicstream.domain.exception;

/** Pipeline hatalarının ortak tabanı; hata veren entity/key bağlamını taşır. */
public abstract class PipelineException extends RuntimeException {

    private final String context;

    protected PipelineException(String message, String context) {
        super(message);
        this.context = context;
    }

    protected PipelineException(String message, String context, Throwable cause) {
        super(message, cause);
        this.context = context;
    }

    public String getContext() {
        return context;
    }
}
