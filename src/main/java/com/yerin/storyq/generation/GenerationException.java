package com.yerin.storyq.generation;

public abstract class GenerationException extends Exception {

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * true 이면 nack 시 남은 시도 횟수 안에서 재시도한다.
     */
    public abstract boolean isRetryable();
}
