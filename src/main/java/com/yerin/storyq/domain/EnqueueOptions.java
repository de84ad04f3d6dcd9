package com.yerin.storyq.domain;

import java.time.Duration;

/**
 * 잡 등록 시 스케줄링 힌트. null 필드는 설정 기본값을 따른다.
 */
public record EnqueueOptions(
        Integer priority,
        Duration delay,
        Integer maxAttempts,
        String idempotencyKey
) {
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 1000;
    public static final long MAX_DELAY_MILLIS = 30L * 24 * 60 * 60 * 1000;

    public static EnqueueOptions defaults() {
        return new EnqueueOptions(null, null, null, null);
    }

    public static EnqueueOptions withPriority(int priority) {
        return new EnqueueOptions(priority, null, null, null);
    }
}
