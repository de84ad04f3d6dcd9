package com.yerin.storyq.generation;

public class GenerationTimeoutException extends TransientGenerationException {

    public GenerationTimeoutException(String message) {
        super(message);
    }
}
