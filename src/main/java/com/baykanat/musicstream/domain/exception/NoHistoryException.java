package com.baykanat.musicstream.domain.exception;

/** Kullanıcının aggregate profili yok; istek için terminal. */
public class NoHistoryException extends PipelineException {

    public NoHistoryException(String userId) {
        super("No listening history for user " + userId, "user_id=" + userId);
    }
}
