package com.yerin.storyq.generation;

/**
 * 레이트 리밋, 네트워크 오류, 5xx 등 다시 시도하면 성공할 수 있는 실패.
 */
public class TransientGenerationException extends GenerationException {

    public TransientGenerationException(String message) {
        super(message);
    }

    public TransientGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
