package com.yerin.storyq.generation;

/**
 * 잘못된 요청, 인증 실패, 쿼터 소진 등 재시도해도 결과가 같은 실패.
 */
public class TerminalGenerationException extends GenerationException {

    public TerminalGenerationException(String message) {
        super(message);
    }

    public TerminalGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
