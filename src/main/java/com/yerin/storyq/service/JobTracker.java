package com.yerin.storyq.service;

import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.Job;
import com.yerin.storyq.domain.JobEventListener;
import com.yerin.storyq.domain.JobEventLog;
import com.yerin.storyq.domain.JobStatus;
import com.yerin.storyq.domain.JobStore;
import com.yerin.storyq.global.exception.AppException;
import com.yerin.storyq.global.exception.code.JobErrorCode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * 잡 상태 조회와 종료 대기.
 * 종료 알림은 JobStore 구독으로 받고, 대기자가 없으면 버린다.
 */
@Slf4j
@Service
public class JobTracker implements JobEventListener {

    private final JobStore store;
    private final JobAuditLog auditLog;
    private final Duration maxWait;
    private final ConcurrentMap<String, List<CompletableFuture<Job>>> waiters = new ConcurrentHashMap<>();

    public JobTracker(JobStore store, JobAuditLog auditLog, StoryqProperties properties) {
        this.store = store;
        this.auditLog = auditLog;
        this.maxWait = properties.getTracker().getMaxWait();
    }

    @PostConstruct
    void subscribe() {
        store.subscribe(this);
    }

    public Job getStatus(String jobId) {
        return store.find(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }

    /**
     * 잡이 종료 상태가 되거나 timeout 이 지나면 완료되는 future.
     * timeout 시에는 그 시점의 상태를 돌려준다. timeout 은 tracker.max-wait 로 잘린다.
     */
    public CompletableFuture<Job> awaitTerminal(String jobId, Duration timeout) {
        Job current = getStatus(jobId);
        if (current.isTerminal() || timeout == null || timeout.isZero() || timeout.isNegative()) {
            return CompletableFuture.completedFuture(current);
        }
        Duration wait = timeout.compareTo(maxWait) > 0 ? maxWait : timeout;

        CompletableFuture<Job> signal = new CompletableFuture<>();
        waiters.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(signal);

        // 등록 직전에 종료됐을 수 있다
        store.find(jobId).filter(Job::isTerminal).ifPresent(signal::complete);

        return signal
                .completeOnTimeout(null, wait.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(done -> {
                    removeWaiter(jobId, signal);
                    return done != null ? done : store.find(jobId).orElse(current);
                });
    }

    public List<JobEventLog> history(String jobId) {
        List<JobEventLog> events = auditLog.history(jobId);
        if (events.isEmpty() && store.find(jobId).isEmpty()) {
            throw new AppException(JobErrorCode.JOB_NOT_FOUND);
        }
        return events;
    }

    @Override
    public void onTerminal(String jobId, JobStatus status) {
        List<CompletableFuture<Job>> pending = waiters.remove(jobId);
        if (pending == null || pending.isEmpty()) {
            return;
        }
        Optional<Job> job = store.find(jobId);
        log.debug("[Tracker] jobId={} reached {}, waking {} waiter(s)", jobId, status, pending.size());
        pending.forEach(f -> f.complete(job.orElse(null)));
    }

    int waiterCount() {
        return waiters.values().stream().mapToInt(List::size).sum();
    }

    private void removeWaiter(String jobId, CompletableFuture<Job> signal) {
        waiters.computeIfPresent(jobId, (k, list) -> {
            list.remove(signal);
            return list.isEmpty() ? null : list;
        });
    }
}
