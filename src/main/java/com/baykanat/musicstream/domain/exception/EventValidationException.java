package com.baykanat.musicstream.domain.exception;

/** Geçersiz ham event; hatalı alanı isimlendirir. Event düşürülür, loglanır ve sayılır. */
public class EventValidationException extends PipelineException {

    private final String field;

    public EventValidationException(String field, String message, String context) {
        super(field + ": " + message, context);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
