package com.hackathon.leaderboard.exception;

public class MalformedEventException extends LeaderboardException {
    public MalformedEventException(String message) {
        super(message, "MALFORMED_EVENT");
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, "MALFORMED_EVENT", cause);
    }
}
