package com.yerin.storyq.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class QueueMetrics {

    private final MeterRegistry registry;

    private final Counter jobCreated;
    private final Counter jobCompleted;
    private final Counter jobAttemptFailed;
    private final Counter jobRetried;
    private final Counter jobFailed;
    private final Counter jobReaped;
    private final Counter jobCancelled;
    private final Counter jobEvicted;

    public QueueMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobCreated       = Counter.builder("storyq_jobs_created_total")
                .description("jobs created").register(registry);
        this.jobCompleted     = Counter.builder("storyq_jobs_completed_total")
                .description("jobs completed").register(registry);
        this.jobAttemptFailed = Counter.builder("storyq_job_attempts_failed_total")
                .description("attempts that ended with a generation error or timeout").register(registry);
        this.jobRetried       = Counter.builder("storyq_jobs_retried_total")
                .description("jobs scheduled for retry").register(registry);
        this.jobFailed        = Counter.builder("storyq_jobs_failed_total")
                .description("jobs moved to terminal failed state").register(registry);
        this.jobReaped        = Counter.builder("storyq_jobs_reaped_total")
                .description("active jobs reclaimed after visibility timeout").register(registry);
        this.jobCancelled     = Counter.builder("storyq_jobs_cancelled_total")
                .description("jobs cancelled").register(registry);
        this.jobEvicted       = Counter.builder("storyq_jobs_evicted_total")
                .description("terminal jobs removed by retention").register(registry);
    }

    public void incCreated()        { jobCreated.increment(); }
    public void incCompleted()      { jobCompleted.increment(); }
    public void incAttemptFailed()  { jobAttemptFailed.increment(); }
    public void incRetried()        { jobRetried.increment(); }
    public void incFailed()         { jobFailed.increment(); }
    public void incReaped()         { jobReaped.increment(); }
    public void incCancelled()      { jobCancelled.increment(); }
    public void incEvicted(int n)   { jobEvicted.increment(n); }

    // outcome 태그: completed / transient / terminal / timeout
    public Timer generationTimer(String outcome) {
        return Timer.builder("storyq_generation_duration_seconds")
                .description("story generation call duration by outcome")
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
