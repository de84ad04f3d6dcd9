package com.yerin.storyq.generation;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * 생성 호출 1회에 대한 실행 컨텍스트.
 */
public class GenerationContext {

    @Getter
    private final String jobId;
    @Getter
    private final int attempt;
    private final BooleanSupplier cancelRequested;
    private final AtomicBoolean abandoned = new AtomicBoolean(false);

    public GenerationContext(String jobId, int attempt, BooleanSupplier cancelRequested) {
        this.jobId = jobId;
        this.attempt = attempt;
        this.cancelRequested = cancelRequested;
    }

    /**
     * 워커가 결과를 더 이상 기다리지 않을 때(타임아웃) 호출한다.
     */
    public void abandon() {
        abandoned.set(true);
    }

    public boolean isAbandoned() {
        return abandoned.get();
    }

    public void checkpoint() throws GenerationException {
        if (abandoned.get() || Thread.currentThread().isInterrupted()) {
            throw new GenerationTimeoutException("generation abandoned by worker, jobId=" + jobId);
        }
        if (cancelRequested.getAsBoolean()) {
            throw new JobCancelledException(jobId);
        }
    }
}
