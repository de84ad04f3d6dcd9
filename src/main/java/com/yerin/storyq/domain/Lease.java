package com.yerin.storyq.domain;

import java.time.Instant;

/**
 * 만료된 ACTIVE 잡의 점유 정보. 리퍼가 대신 nack 할 때 사용한다.
 */
public record Lease(String jobId, String lockToken, String workerId, int attempts, Instant leaseUntil) {
}
