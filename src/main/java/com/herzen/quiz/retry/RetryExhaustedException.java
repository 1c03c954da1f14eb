package com.herzen.quiz.retry;

public class RetryExhaustedException extends RuntimeException {
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(operation + " failed after " + attempts + " attempt(s)", lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
