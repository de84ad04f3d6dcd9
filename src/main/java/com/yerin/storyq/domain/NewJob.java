package com.yerin.storyq.domain;

import java.time.Instant;

/**
 * 저장소에 넘기는 등록 요청. 검증과 기본값 적용이 끝난 상태여야 한다.
 */
public record NewJob(
        String id,
        String payload,
        int priority,
        int maxAttempts,
        Instant createdAt,
        Instant delayUntil,
        String idempotencyKey
) {
    public boolean isDelayed() {
        return delayUntil != null && delayUntil.isAfter(createdAt);
    }
}
