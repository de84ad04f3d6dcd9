package com.yerin.storyq.infra;

import com.yerin.storyq.config.StoryqProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private Backoff() {}

    public static Duration expJitter(int retryCount, long baseMillis, long capMillis, double jitterRatio) {
        long exp = (long)(baseMillis * Math.pow(2, Math.max(0, retryCount)));
        long capped = Math.min(exp, capMillis);
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterRatio; // 1±r
        long withJitter = Math.max(0, Math.min(capMillis, (long)(capped * jitter)));
        return Duration.ofMillis(withJitter);
    }

    /**
     * attempts 번째 시도가 실패한 뒤 다음 시도까지의 대기 시간. 첫 실패(attempts=1)는 base 부터 시작한다.
     */
    public static Duration afterAttempt(int attempts, StoryqProperties.RetryConfig retry) {
        return expJitter(
                attempts - 1,
                retry.getBaseBackoff().toMillis(),
                retry.getBackoffCap().toMillis(),
                retry.getJitterRatio()
        );
    }
}
