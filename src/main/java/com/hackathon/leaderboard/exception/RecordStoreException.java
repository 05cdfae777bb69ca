package com.hackathon.leaderboard.exception;

/**
 * A query against the external record store failed, timed out or returned
 * a body that could not be decoded. Never retried by the caller's own code path.
 */
public class RecordStoreException extends LeaderboardException {
    private static final String ERROR_CODE = "RECORD_STORE_ERROR";

    public RecordStoreException(String message) {
        super(message, ERROR_CODE);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
