package com.yerin.storyq.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.*;
import com.yerin.storyq.global.exception.AppException;
import com.yerin.storyq.global.exception.code.JobErrorCode;
import com.yerin.storyq.infra.Backoff;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 큐 연산(enqueue/dequeue/ack/nack/cancel)과 리퍼, 승격, 보존 정리.
 * 원자성이 필요한 판단은 모두 JobStore 가 하고, 여기서는 입력 검증, 백오프 계산, 메트릭/이력만 다룬다.
 */
@Slf4j
@Service
public class JobQueueService {

    public static final String CANCEL_REASON = "cancelled";
    public static final String REAPED_REASON = "visibility timeout exceeded";

    private final JobStore store;
    private final JobAuditLog auditLog;
    private final QueueMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final StoryqProperties properties;
    private final Clock clock;

    public JobQueueService(JobStore store,
                           JobAuditLog auditLog,
                           QueueMetrics metrics,
                           ObjectMapper objectMapper,
                           Validator validator,
                           StoryqProperties properties,
                           Clock clock) {
        this.store = store;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }

    public String enqueue(StoryPayload payload, EnqueueOptions options) {
        validate(payload);
        EnqueueOptions opts = options == null ? EnqueueOptions.defaults() : options;

        int priority = resolvePriority(opts);
        int maxAttempts = resolveMaxAttempts(opts);
        Duration delay = resolveDelay(opts);
        String idempotencyKey = opts.idempotencyKey() == null || opts.idempotencyKey().isBlank()
                ? null : opts.idempotencyKey().trim();

        Instant now = clock.instant();
        NewJob job = new NewJob(
                UUID.randomUUID().toString(),
                serialize(payload),
                priority,
                maxAttempts,
                now,
                now.plus(delay),
                idempotencyKey
        );

        EnqueueResult result = store.enqueue(job);
        if (result.duplicate()) {
            return result.jobId();
        }

        metrics.incCreated();
        auditLog.append(result.jobId(), "QUEUED", 0,
                delay.isZero() ? null : "delayUntil=" + job.delayUntil());
        log.info("[Queue] enqueued jobId={}, priority={}, maxAttempts={}, delayMs={}",
                result.jobId(), priority, maxAttempts, delay.toMillis());
        return result.jobId();
    }

    public Optional<Job> dequeue(String workerId) {
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(properties.getQueue().getVisibilityTimeout());
        Optional<Job> claimed = store.claimNext(workerId, UUID.randomUUID().toString(), now, leaseUntil);
        claimed.ifPresent(job -> {
            auditLog.append(job.getId(), "ACTIVE", job.getAttempts(), "worker=" + workerId);
            log.info("[Queue] claimed jobId={}, attempt={}/{}, worker={}",
                    job.getId(), job.getAttempts(), job.getMaxAttempts(), workerId);
        });
        return claimed;
    }

    public AckResult ack(Job claimed, String result) {
        return ack(claimed.getId(), claimed.getLockToken(), claimed.getAttempts(), result);
    }

    public AckResult ack(String jobId, String lockToken, int attempt, String result) {
        AckResult outcome = store.complete(jobId, lockToken, result, clock.instant());
        switch (outcome) {
            case COMPLETED -> {
                metrics.incCompleted();
                auditLog.append(jobId, "COMPLETED", attempt, null);
                log.info("[Queue] completed jobId={}, attempt={}", jobId, attempt);
            }
            case DUPLICATE -> log.debug("[Queue] duplicate ack ignored jobId={}", jobId);
            case STALE -> log.warn("[Queue] stale ack ignored jobId={}, attempt={}", jobId, attempt);
            case NOT_FOUND -> log.warn("[Queue] ack for unknown jobId={}", jobId);
        }
        return outcome;
    }

    public NackResult nack(Job claimed, String error, boolean retryable) {
        return nack(claimed.getId(), claimed.getLockToken(), claimed.getAttempts(), error, retryable);
    }

    public NackResult nack(String jobId, String lockToken, int attempts, String error, boolean retryable) {
        Instant now = clock.instant();
        Instant retryAt = now.plus(Backoff.afterAttempt(attempts, properties.getRetry()));
        NackResult outcome = store.fail(jobId, lockToken, error, retryable, now, retryAt);
        switch (outcome) {
            case RETRYING -> {
                metrics.incRetried();
                auditLog.append(jobId, "RETRYING", attempts, error + " (nextAttemptAt=" + retryAt + ")");
                log.info("[Queue] retry scheduled jobId={}, attempt={}, after {} ms, err={}",
                        jobId, attempts, Duration.between(now, retryAt).toMillis(), error);
            }
            case FAILED -> {
                metrics.incFailed();
                auditLog.append(jobId, "FAILED", attempts, error);
                log.warn("[Queue] failed jobId={}, attempt={}, retryable={}, err={}", jobId, attempts, retryable, error);
            }
            case DUPLICATE -> log.debug("[Queue] nack on terminal job ignored jobId={}", jobId);
            case STALE -> log.warn("[Queue] stale nack ignored jobId={}, attempt={}", jobId, attempts);
            case NOT_FOUND -> log.warn("[Queue] nack for unknown jobId={}", jobId);
        }
        return outcome;
    }

    public CancelResult cancel(String jobId) {
        CancelResult outcome = store.cancel(jobId, CANCEL_REASON, clock.instant());
        switch (outcome) {
            case NOT_FOUND -> throw new AppException(JobErrorCode.JOB_NOT_FOUND);
            case CANCELLED -> {
                metrics.incCancelled();
                metrics.incFailed();
                auditLog.append(jobId, "CANCELLED", null, null);
                log.info("[Queue] cancelled jobId={}", jobId);
            }
            case REQUESTED -> {
                auditLog.append(jobId, "CANCEL_REQUESTED", null, null);
                log.info("[Queue] cancel requested for active jobId={}", jobId);
            }
            case ALREADY_TERMINAL -> log.debug("[Queue] cancel on terminal job ignored jobId={}", jobId);
        }
        return outcome;
    }

    public boolean isCancelRequested(String jobId) {
        return store.isCancelRequested(jobId);
    }

    /**
     * lease 가 만료된 ACTIVE 잡을 워커 대신 nack 한다.
     */
    public int reapExpired() {
        List<Lease> expired = store.expiredLeases(clock.instant(), properties.getReaper().getBatchSize());
        int handled = 0;
        for (Lease lease : expired) {
            try {
                NackResult r = nack(lease.jobId(), lease.lockToken(), lease.attempts(),
                        REAPED_REASON + " (worker=" + lease.workerId() + ")", true);
                if (r == NackResult.RETRYING || r == NackResult.FAILED) {
                    metrics.incReaped();
                    handled++;
                }
            } catch (RuntimeException e) {
                log.warn("[Queue] failed to reap jobId={}, err={}", lease.jobId(), e.toString());
            }
        }
        return handled;
    }

    public int promoteDue() {
        return store.promoteDue(clock.instant(), properties.getReaper().getBatchSize());
    }

    public int evictExpired() {
        StoryqProperties.RetentionConfig retention = properties.getRetention();
        Instant now = clock.instant();
        int removed = store.evict(JobStatus.COMPLETED,
                now.minus(retention.getCompletedMaxAge()), retention.getCompletedMaxCount());
        removed += store.evict(JobStatus.FAILED,
                now.minus(retention.getFailedMaxAge()), retention.getFailedMaxCount());
        if (removed > 0) {
            metrics.incEvicted(removed);
        }
        return removed;
    }

    private void validate(StoryPayload payload) {
        if (payload == null) {
            throw new AppException(JobErrorCode.INVALID_JOB_REQUEST.withDetail("payload 는 필수입니다."));
        }
        Set<ConstraintViolation<StoryPayload>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            ConstraintViolation<StoryPayload> v = violations.iterator().next();
            throw new AppException(JobErrorCode.INVALID_JOB_REQUEST.withDetail(v.getMessage()));
        }
    }

    private int resolvePriority(EnqueueOptions opts) {
        if (opts.priority() == null) {
            return EnqueueOptions.MIN_PRIORITY;
        }
        int p = opts.priority();
        if (p < EnqueueOptions.MIN_PRIORITY || p > EnqueueOptions.MAX_PRIORITY) {
            throw new AppException(JobErrorCode.INVALID_JOB_REQUEST.withDetail(
                    "priority 는 " + EnqueueOptions.MIN_PRIORITY + "~" + EnqueueOptions.MAX_PRIORITY + " 범위여야 합니다."));
        }
        return p;
    }

    private int resolveMaxAttempts(EnqueueOptions opts) {
        if (opts.maxAttempts() == null) {
            return properties.getQueue().getMaxAttempts();
        }
        int ceiling = properties.getQueue().getMaxAttemptsCeiling();
        int m = opts.maxAttempts();
        if (m < 1 || m > ceiling) {
            throw new AppException(JobErrorCode.INVALID_JOB_REQUEST.withDetail(
                    "maxAttempts 는 1~" + ceiling + " 범위여야 합니다."));
        }
        return m;
    }

    private Duration resolveDelay(EnqueueOptions opts) {
        if (opts.delay() == null) {
            return Duration.ZERO;
        }
        if (opts.delay().isNegative()) {
            throw new AppException(JobErrorCode.INVALID_JOB_REQUEST.withDetail("delay 는 0 이상이어야 합니다."));
        }
        Duration max = properties.getQueue().getMaxDelay();
        if (opts.delay().compareTo(max) > 0) {
            throw new AppException(JobErrorCode.INVALID_JOB_REQUEST.withDetail(
                    "delay 는 " + max.toMillis() + "ms 를 넘을 수 없습니다."));
        }
        return opts.delay();
    }

    private String serialize(StoryPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AppException(JobErrorCode.PAYLOAD_SERIALIZATION_FAILED, e);
        }
    }
}
