package com.yerin.storyq.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.Job;
import com.yerin.storyq.domain.QueueMetrics;
import com.yerin.storyq.domain.StoryPayload;
import com.yerin.storyq.generation.GenerationContext;
import com.yerin.storyq.generation.GenerationException;
import com.yerin.storyq.generation.JobCancelledException;
import com.yerin.storyq.generation.StoryGenerator;
import com.yerin.storyq.global.exception.BrokerUnavailableException;
import com.yerin.storyq.service.JobQueueService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * N 개의 워커 스레드가 큐에서 잡을 가져와 생성기를 호출하고 ack/nack 한다.
 * 생성 호출은 별도 executor 에서 돌리고 execution-timeout 이 지나면 포기한다.
 */
@Slf4j
@Component
public class WorkerPool {
    private final JobQueueService queue;
    private final StoryGenerator generator;
    private final ObjectMapper objectMapper;
    private final QueueMetrics metrics;
    private final StoryqProperties.WorkerConfig config;
    private final Duration visibilityTimeout;

    private final String hostPrefix = WorkerId.hostPrefix();
    private final ExecutorService generationExecutor =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("storyq-gen-"));

    private ExecutorService workers;
    private volatile boolean running = false;

    public WorkerPool(JobQueueService queue,
                      StoryGenerator generator,
                      ObjectMapper objectMapper,
                      QueueMetrics metrics,
                      StoryqProperties properties) {
        this.queue = queue;
        this.generator = generator;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.config = properties.getWorker();
        this.visibilityTimeout = properties.getQueue().getVisibilityTimeout();
    }

    @PostConstruct
    void autoStart() {
        if (config.getExecutionTimeout().compareTo(visibilityTimeout) >= 0) {
            log.warn("[Worker] execution-timeout({}) >= visibility-timeout({}); running jobs may be reaped",
                    config.getExecutionTimeout(), visibilityTimeout);
        }
        if (config.isAutoStart()) {
            start();
        } else {
            log.info("[Worker] auto-start disabled");
        }
    }

    public synchronized void start() {
        if (running) return;
        running = true;

        int concurrency = Math.max(1, config.getConcurrency());
        workers = Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("storyq-worker-"));
        for (int i = 0; i < concurrency; i++) {
            final String workerId = WorkerId.of(hostPrefix, i);
            workers.submit(() -> loop(workerId));
        }
        log.info("[Worker] started {} workers prefix={}", concurrency, hostPrefix);
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        if (workers != null) {
            workers.shutdownNow();
            workers = null;
        }
        generationExecutor.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    private void loop(String workerId) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                if (!processNext(workerId)) {
                    Thread.sleep(config.getPollInterval().toMillis());
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (BrokerUnavailableException e) {
                log.warn("[Worker] broker unavailable worker={}, err={}", workerId, e.getMessage());
                pause(config.getPollInterval().toMillis());
            } catch (Exception e) {
                log.warn("[Worker] poll loop error worker={}, err={}", workerId, e.toString());
                pause(100);
            }
        }
        log.info("[Worker] stopped worker={}", workerId);
    }

    /**
     * 잡 하나를 가져와 처리한다. 대기 중인 잡이 없으면 false.
     */
    public boolean processNext(String workerId) {
        Optional<Job> claimed = queue.dequeue(workerId);
        if (claimed.isEmpty()) {
            return false;
        }
        run(claimed.get());
        return true;
    }

    private void run(Job job) {
        StoryPayload payload;
        try {
            payload = objectMapper.readValue(job.getPayload(), StoryPayload.class);
        } catch (JsonProcessingException e) {
            metrics.incAttemptFailed();
            queue.nack(job, "unreadable payload: " + e.getOriginalMessage(), false);
            return;
        }

        GenerationContext context = new GenerationContext(
                job.getId(), job.getAttempts(), () -> queue.isCancelRequested(job.getId()));
        Duration timeout = config.getExecutionTimeout();

        long start = System.nanoTime();
        String outcome = "completed";
        Future<String> call = generationExecutor.submit(() -> generator.generate(payload, context));
        try {
            String story = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            queue.ack(job, story);
        } catch (TimeoutException e) {
            call.cancel(true);
            context.abandon();
            outcome = "timeout";
            metrics.incAttemptFailed();
            queue.nack(job, "generation timed out after " + timeout.toMillis() + " ms", true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            metrics.incAttemptFailed();
            if (cause instanceof JobCancelledException) {
                outcome = "cancelled";
                metrics.incCancelled();
                queue.nack(job, JobCancelledException.REASON, false);
            } else if (cause instanceof GenerationException ge) {
                outcome = ge.isRetryable() ? "transient" : "terminal";
                queue.nack(job, describe(ge), ge.isRetryable());
            } else {
                outcome = "transient";
                log.warn("[Worker] unexpected generator error jobId={}", job.getId(), cause);
                queue.nack(job, describe(cause), true);
            }
        } catch (InterruptedException e) {
            // 종료 중: lease 만료 후 리퍼가 회수한다
            call.cancel(true);
            context.abandon();
            outcome = "interrupted";
            Thread.currentThread().interrupt();
            log.info("[Worker] interrupted while running jobId={}", job.getId());
        } finally {
            metrics.generationTimer(outcome).record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
