package com.baykanat.musicstream.domain.exception;

/** Lookback aralığında finalize edilmiş bucket yok; otomatik retry yapılmaz. */
public class InsufficientDataException extends PipelineException {

    public InsufficientDataException(String message, String context) {
        super(message, context);
    }
}
