package com.yerin.storyq.infra;

import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 단일 프로세스용 잡 저장소. 모든 전이는 이 객체의 모니터로 직렬화된다.
 * Redis 스크립트와 같은 규칙(우선순위 내림차순, 대기열 진입 순번 오름차순)을 따른다.
 */
@Slf4j
@Component
@Profile("inmem")
public class InMemoryJobStore implements JobStore {

    private record Waiting(String jobId, int priority, long seq) {}

    private static final Comparator<Waiting> ORDER = Comparator
            .comparingInt(Waiting::priority).reversed()
            .thenComparingLong(Waiting::seq);

    private record Idempotency(String jobId, Instant expiresAt) {}

    private final Duration idempotencyTtl;

    private final Map<String, Job> jobs = new HashMap<>();
    private final TreeSet<Waiting> waiting = new TreeSet<>(ORDER);
    private final Map<String, Waiting> waitingIndex = new HashMap<>();
    private final Map<String, Instant> delayed = new HashMap<>();
    private final Map<String, Instant> active = new HashMap<>();
    private final Map<String, Instant> completed = new HashMap<>();
    private final Map<String, Instant> failed = new HashMap<>();
    private final Map<String, Idempotency> idempotency = new HashMap<>();
    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();
    private long seq = 0;

    @Autowired
    public InMemoryJobStore(StoryqProperties properties) {
        this(properties.getRetention().getIdempotencyTtl());
    }

    public InMemoryJobStore(Duration idempotencyTtl) {
        this.idempotencyTtl = idempotencyTtl;
    }

    @Override
    public synchronized EnqueueResult enqueue(NewJob job) {
        String key = job.idempotencyKey();
        if (key != null) {
            Idempotency hit = idempotency.get(key);
            if (hit != null && hit.expiresAt().isAfter(job.createdAt()) && jobs.containsKey(hit.jobId())) {
                return new EnqueueResult(hit.jobId(), true);
            }
        }

        Job.JobBuilder record = Job.builder()
                .id(job.id())
                .payload(job.payload())
                .status(JobStatus.QUEUED)
                .attempts(0)
                .maxAttempts(job.maxAttempts())
                .priority(job.priority())
                .createdAt(job.createdAt())
                .idempotencyKey(key);

        if (job.isDelayed()) {
            record.delayUntil(job.delayUntil());
            delayed.put(job.id(), job.delayUntil());
        } else {
            pushWaiting(job.id(), job.priority());
        }
        jobs.put(job.id(), record.build());

        if (key != null) {
            idempotency.put(key, new Idempotency(job.id(), job.createdAt().plus(idempotencyTtl)));
        }
        return new EnqueueResult(job.id(), false);
    }

    @Override
    public Optional<Job> claimNext(String workerId, String lockToken, Instant now, Instant leaseUntil) {
        Job claimed;
        synchronized (this) {
            promote(now, Integer.MAX_VALUE);
            Waiting next = waiting.pollFirst();
            if (next == null) {
                return Optional.empty();
            }
            waitingIndex.remove(next.jobId());
            Job job = jobs.get(next.jobId());
            claimed = job.toBuilder()
                    .status(JobStatus.ACTIVE)
                    .attempts(job.getAttempts() + 1)
                    .startedAt(now)
                    .workerId(workerId)
                    .lockToken(lockToken)
                    .build();
            jobs.put(claimed.getId(), claimed);
            active.put(claimed.getId(), leaseUntil);
        }
        return Optional.of(claimed);
    }

    @Override
    public AckResult complete(String jobId, String lockToken, String result, Instant now) {
        synchronized (this) {
            Job job = jobs.get(jobId);
            if (job == null) {
                return AckResult.NOT_FOUND;
            }
            if (job.getStatus() == JobStatus.COMPLETED) {
                return AckResult.DUPLICATE;
            }
            if (job.getStatus() != JobStatus.ACTIVE || !Objects.equals(job.getLockToken(), lockToken)) {
                return AckResult.STALE;
            }
            jobs.put(jobId, job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .result(result)
                    .error(null)
                    .lockToken(null)
                    .finishedAt(now)
                    .build());
            active.remove(jobId);
            completed.put(jobId, now);
        }
        notifyTerminal(jobId, JobStatus.COMPLETED);
        return AckResult.COMPLETED;
    }

    @Override
    public NackResult fail(String jobId, String lockToken, String error, boolean retryable, Instant now, Instant retryAt) {
        synchronized (this) {
            Job job = jobs.get(jobId);
            if (job == null) {
                return NackResult.NOT_FOUND;
            }
            if (job.isTerminal()) {
                return NackResult.DUPLICATE;
            }
            if (job.getStatus() != JobStatus.ACTIVE || !Objects.equals(job.getLockToken(), lockToken)) {
                return NackResult.STALE;
            }
            active.remove(jobId);
            if (retryable && !job.isCancelRequested() && job.getAttempts() < job.getMaxAttempts()) {
                jobs.put(jobId, job.toBuilder()
                        .status(JobStatus.RETRYING)
                        .error(error)
                        .lockToken(null)
                        .delayUntil(retryAt)
                        .build());
                delayed.put(jobId, retryAt);
                return NackResult.RETRYING;
            }
            jobs.put(jobId, job.toBuilder()
                    .status(JobStatus.FAILED)
                    .error(job.isCancelRequested() ? "cancelled" : error)
                    .lockToken(null)
                    .finishedAt(now)
                    .build());
            failed.put(jobId, now);
        }
        notifyTerminal(jobId, JobStatus.FAILED);
        return NackResult.FAILED;
    }

    @Override
    public CancelResult cancel(String jobId, String reason, Instant now) {
        synchronized (this) {
            Job job = jobs.get(jobId);
            if (job == null) {
                return CancelResult.NOT_FOUND;
            }
            if (job.isTerminal()) {
                return CancelResult.ALREADY_TERMINAL;
            }
            if (job.getStatus() == JobStatus.ACTIVE) {
                jobs.put(jobId, job.toBuilder().cancelRequested(true).build());
                return CancelResult.REQUESTED;
            }
            Waiting w = waitingIndex.remove(jobId);
            if (w != null) {
                waiting.remove(w);
            }
            delayed.remove(jobId);
            jobs.put(jobId, job.toBuilder()
                    .status(JobStatus.FAILED)
                    .error(reason)
                    .finishedAt(now)
                    .cancelRequested(true)
                    .build());
            failed.put(jobId, now);
        }
        notifyTerminal(jobId, JobStatus.FAILED);
        return CancelResult.CANCELLED;
    }

    @Override
    public synchronized boolean isCancelRequested(String jobId) {
        Job job = jobs.get(jobId);
        return job != null && job.isCancelRequested();
    }

    @Override
    public synchronized ReplayResult replay(String jobId, Instant now) {
        Job job = jobs.get(jobId);
        if (job == null) {
            return ReplayResult.NOT_FOUND;
        }
        if (job.getStatus() != JobStatus.FAILED) {
            return ReplayResult.NOT_FAILED;
        }
        failed.remove(jobId);
        jobs.put(jobId, job.toBuilder()
                .status(JobStatus.QUEUED)
                .attempts(0)
                .error(null)
                .result(null)
                .finishedAt(null)
                .startedAt(null)
                .workerId(null)
                .delayUntil(null)
                .cancelRequested(false)
                .build());
        pushWaiting(jobId, job.getPriority());
        return ReplayResult.REQUEUED;
    }

    @Override
    public synchronized Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<Lease> expiredLeases(Instant now, int limit) {
        return active.entrySet().stream()
                .filter(e -> !e.getValue().isAfter(now))
                .sorted(Map.Entry.comparingByValue())
                .limit(limit)
                .map(e -> {
                    Job job = jobs.get(e.getKey());
                    return new Lease(job.getId(), job.getLockToken(), job.getWorkerId(), job.getAttempts(), e.getValue());
                })
                .toList();
    }

    @Override
    public synchronized int promoteDue(Instant now, int limit) {
        return promote(now, limit);
    }

    @Override
    public synchronized int evict(JobStatus terminalStatus, Instant olderThan, int keepMax) {
        Map<String, Instant> set = switch (terminalStatus) {
            case COMPLETED -> completed;
            case FAILED -> failed;
            default -> throw new IllegalArgumentException("only terminal jobs can be evicted: " + terminalStatus);
        };

        List<String> byAge = set.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .toList();

        int removed = 0;
        int remaining = byAge.size();
        for (String id : byAge) {
            boolean expired = set.get(id).isBefore(olderThan);
            boolean overflow = remaining > keepMax;
            if (!expired && !overflow) {
                break;
            }
            set.remove(id);
            Job gone = jobs.remove(id);
            if (gone != null && gone.getIdempotencyKey() != null) {
                idempotency.computeIfPresent(gone.getIdempotencyKey(),
                        (key, entry) -> entry.jobId().equals(id) ? null : entry);
            }
            remaining--;
            removed++;
        }
        return removed;
    }

    @Override
    public synchronized QueueCounts counts() {
        return new QueueCounts(waiting.size(), delayed.size(), active.size(), completed.size(), failed.size());
    }

    @Override
    public void subscribe(JobEventListener listener) {
        listeners.add(listener);
    }

    private int promote(Instant now, int limit) {
        List<Map.Entry<String, Instant>> due = delayed.entrySet().stream()
                .filter(e -> !e.getValue().isAfter(now))
                .sorted(Map.Entry.comparingByValue())
                .limit(limit)
                .toList();
        for (Map.Entry<String, Instant> e : due) {
            String id = e.getKey();
            delayed.remove(id);
            Job job = jobs.get(id);
            jobs.put(id, job.toBuilder().status(JobStatus.QUEUED).build());
            pushWaiting(id, job.getPriority());
        }
        return due.size();
    }

    private void pushWaiting(String jobId, int priority) {
        Waiting w = new Waiting(jobId, priority, ++seq);
        waiting.add(w);
        waitingIndex.put(jobId, w);
    }

    private void notifyTerminal(String jobId, JobStatus status) {
        for (JobEventListener l : listeners) {
            try {
                l.onTerminal(jobId, status);
            } catch (RuntimeException e) {
                log.warn("[InMemoryStore] listener failed jobId={}, err={}", jobId, e.toString());
            }
        }
    }
}
