package com.baykanat.musicstream.domain.exception;

/** Roll denemesi başarısız (ör. storage yazımı); bekleyen bucket'lar bir sonraki roll'da tekrar yazılır. */
public class WindowRollException extends PipelineException {

    public WindowRollException(String message, String context, Throwable cause) {
        super(message, context, cause);
    }
}
