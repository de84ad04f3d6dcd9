package com.yerin.storyq.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 큐 저장소에 보관되는 잡 레코드의 스냅샷.
 * 상태 전이는 저장소({@link JobStore})만 수행하고, 이 객체는 조회 결과로만 쓰인다.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString(exclude = {"payload", "result"})
public class Job {

    private final String id;
    private final String payload;
    private final JobStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final int priority;
    private final String result;
    private final String error;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Instant delayUntil;
    private final String workerId;
    private final String lockToken;
    private final boolean cancelRequested;
    private final String idempotencyKey;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
