package com.yerin.storyq.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 잡 레코드의 단일 진실 공급원.
 * 점유(claim)/ack/nack/cancel 은 저장소 수준에서 원자적으로 수행되어야 하며,
 * 같은 잡을 두 워커가 동시에 ACTIVE 로 가져가는 일이 없어야 한다.
 */
public interface JobStore {

    EnqueueResult enqueue(NewJob job);

    /**
     * 기한이 된 지연 잡을 승격한 뒤, 우선순위가 가장 높고 가장 먼저 대기열에 들어온 잡을 점유한다.
     */
    Optional<Job> claimNext(String workerId, String lockToken, Instant now, Instant leaseUntil);

    AckResult complete(String jobId, String lockToken, String result, Instant now);

    /**
     * @param retryable false 이면 남은 시도 횟수와 관계없이 FAILED
     * @param retryAt   재시도 시 delayUntil
     */
    NackResult fail(String jobId, String lockToken, String error, boolean retryable, Instant now, Instant retryAt);

    CancelResult cancel(String jobId, String reason, Instant now);

    boolean isCancelRequested(String jobId);

    ReplayResult replay(String jobId, Instant now);

    Optional<Job> find(String jobId);

    List<Lease> expiredLeases(Instant now, int limit);

    int promoteDue(Instant now, int limit);

    /**
     * 종료 상태 잡 중 finishedAt 이 olderThan 이전이거나, 최신 keepMax 개를 넘는 잡을 제거한다.
     */
    int evict(JobStatus terminalStatus, Instant olderThan, int keepMax);

    QueueCounts counts();

    void subscribe(JobEventListener listener);
}
