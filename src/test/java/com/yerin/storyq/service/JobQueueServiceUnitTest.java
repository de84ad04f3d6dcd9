package com.yerin.storyq.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.*;
import com.yerin.storyq.global.exception.AppException;
import com.yerin.storyq.infra.InMemoryJobStore;
import com.yerin.storyq.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("JobQueueService 단위 테스트")
class JobQueueServiceUnitTest {

    static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    StoryqProperties properties = new StoryqProperties();
    InMemoryJobStore store = new InMemoryJobStore(Duration.ofHours(1));
    JobAuditLog auditLog = mock(JobAuditLog.class);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    QueueMetrics metrics = new QueueMetrics(registry);

    JobQueueService sut;

    @BeforeEach
    void setUp() {
        properties.getRetry().setJitterRatio(0.0);
        properties.getRetry().setBaseBackoff(Duration.ofSeconds(1));
        properties.getQueue().setVisibilityTimeout(Duration.ofSeconds(30));
        sut = new JobQueueService(store, auditLog, metrics, new ObjectMapper(), VALIDATOR, properties, clock);
    }

    private double count(String name) {
        return registry.find(name).counter().count();
    }

    @Test
    @DisplayName("등록 시 QUEUED 로 저장되고 payload 는 JSON 으로 보관된다")
    void enqueue_persists_queued_job() {
        String id = sut.enqueue(StoryPayload.ofPrompt("a dragon"), null);

        Job job = store.find(id).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getAttempts()).isZero();
        assertThat(job.getMaxAttempts()).isEqualTo(properties.getQueue().getMaxAttempts());
        assertThat(job.getPayload()).contains("\"prompt\":\"a dragon\"");
        assertThat(job.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(count("storyq_jobs_created_total")).isEqualTo(1.0);
        verify(auditLog).append(eq(id), eq("QUEUED"), eq(0), isNull());
    }

    @Test
    @DisplayName("빈 prompt 는 INVALID_JOB_REQUEST 로 거절되고 저장되지 않는다")
    void enqueue_rejects_blank_prompt() {
        assertThatThrownBy(() -> sut.enqueue(StoryPayload.ofPrompt(" "), null))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(((AppException) e).getErrorCode().getCode()).isEqualTo("JOB-003"))
                .hasMessageContaining("prompt");

        assertThat(store.counts().waiting()).isZero();
        verifyNoInteractions(auditLog);
    }

    @Test
    @DisplayName("범위를 벗어난 priority, maxAttempts, delay 는 거절")
    void enqueue_rejects_bad_options() {
        StoryPayload p = StoryPayload.ofPrompt("x");

        assertThatThrownBy(() -> sut.enqueue(p, new EnqueueOptions(1001, null, null, null)))
                .isInstanceOf(AppException.class);
        assertThatThrownBy(() -> sut.enqueue(p, new EnqueueOptions(null, null, 0, null)))
                .isInstanceOf(AppException.class);
        assertThatThrownBy(() -> sut.enqueue(p, new EnqueueOptions(null, null, 26, null)))
                .isInstanceOf(AppException.class);
        assertThatThrownBy(() -> sut.enqueue(p, new EnqueueOptions(null, Duration.ofMillis(-1), null, null)))
                .isInstanceOf(AppException.class);
        assertThatThrownBy(() -> sut.enqueue(p, new EnqueueOptions(null, Duration.ofMillis(Long.MAX_VALUE), null, null)))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(((AppException) e).getErrorCode().getCode()).isEqualTo("JOB-003"))
                .hasMessageContaining("delay");
        assertThatThrownBy(() -> sut.enqueue(p, new EnqueueOptions(null, Duration.ofDays(31), null, null)))
                .isInstanceOf(AppException.class);
        assertThatThrownBy(() -> sut.enqueue(null, null))
                .isInstanceOf(AppException.class);
    }

    @Test
    @DisplayName("멱등키가 같으면 같은 jobId 를 돌려주고 메트릭을 올리지 않는다")
    void enqueue_idempotent() {
        var opts = new EnqueueOptions(null, null, null, "client-key");
        String first = sut.enqueue(StoryPayload.ofPrompt("x"), opts);
        String second = sut.enqueue(StoryPayload.ofPrompt("x"), opts);

        assertThat(second).isEqualTo(first);
        assertThat(count("storyq_jobs_created_total")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("지연 등록은 delay 가 지나야 dequeue 된다")
    void delayed_enqueue() {
        String id = sut.enqueue(StoryPayload.ofPrompt("x"), new EnqueueOptions(null, Duration.ofSeconds(5), null, null));

        assertThat(sut.dequeue("w1")).isEmpty();
        clock.advance(Duration.ofSeconds(5));
        assertThat(sut.dequeue("w1")).get().extracting(Job::getId).isEqualTo(id);
    }

    @Test
    @DisplayName("dequeue 는 lease 를 visibilityTimeout 만큼 잡는다")
    void dequeue_sets_lease() {
        String id = sut.enqueue(StoryPayload.ofPrompt("x"), null);

        Job active = sut.dequeue("w1").orElseThrow();

        assertThat(active.getId()).isEqualTo(id);
        assertThat(active.getLockToken()).isNotBlank();
        assertThat(store.expiredLeases(clock.instant().plusSeconds(29), 10)).isEmpty();
        assertThat(store.expiredLeases(clock.instant().plusSeconds(30), 10)).hasSize(1);
    }

    @Test
    @DisplayName("nack 는 attempts 기반 백오프로 재시도를 예약한다")
    void nack_schedules_backoff() {
        sut.enqueue(StoryPayload.ofPrompt("x"), null);
        Job active = sut.dequeue("w1").orElseThrow();

        assertThat(sut.nack(active, "upstream 503", true)).isEqualTo(NackResult.RETRYING);

        Job retrying = store.find(active.getId()).orElseThrow();
        assertThat(retrying.getStatus()).isEqualTo(JobStatus.RETRYING);
        assertThat(retrying.getDelayUntil()).isEqualTo(clock.instant().plusSeconds(1));
        assertThat(count("storyq_jobs_retried_total")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("ack 두 번은 한 번만 완료로 집계된다")
    void ack_twice_counts_once() {
        sut.enqueue(StoryPayload.ofPrompt("x"), null);
        Job active = sut.dequeue("w1").orElseThrow();

        assertThat(sut.ack(active, "the end")).isEqualTo(AckResult.COMPLETED);
        assertThat(sut.ack(active, "the end")).isEqualTo(AckResult.DUPLICATE);
        assertThat(count("storyq_jobs_completed_total")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("리퍼: lease 가 지난 잡을 재시도로 돌리고, 원래 워커의 늦은 ack 는 무시된다")
    void reaper_recovers_expired_lease() {
        sut.enqueue(StoryPayload.ofPrompt("x"), null);
        Job crashed = sut.dequeue("w1").orElseThrow();

        assertThat(sut.reapExpired()).isZero();
        clock.advance(Duration.ofSeconds(31));
        assertThat(sut.reapExpired()).isEqualTo(1);

        Job reaped = store.find(crashed.getId()).orElseThrow();
        assertThat(reaped.getStatus()).isEqualTo(JobStatus.RETRYING);
        assertThat(reaped.getError()).startsWith(JobQueueService.REAPED_REASON);
        assertThat(count("storyq_jobs_reaped_total")).isEqualTo(1.0);

        clock.advance(Duration.ofSeconds(1));
        Job second = sut.dequeue("w2").orElseThrow();
        assertThat(second.getAttempts()).isEqualTo(2);

        assertThat(sut.ack(crashed, "late")).isEqualTo(AckResult.STALE);
        assertThat(sut.ack(second, "fresh")).isEqualTo(AckResult.COMPLETED);
        assertThat(store.find(crashed.getId()).orElseThrow().getResult()).isEqualTo("fresh");
    }

    @Test
    @DisplayName("취소: 대기 잡은 FAILED, 없는 잡은 JOB_NOT_FOUND")
    void cancel() {
        String id = sut.enqueue(StoryPayload.ofPrompt("x"), null);

        assertThat(sut.cancel(id)).isEqualTo(CancelResult.CANCELLED);
        assertThat(store.find(id).orElseThrow().getError()).isEqualTo(JobQueueService.CANCEL_REASON);
        assertThat(count("storyq_jobs_cancelled_total")).isEqualTo(1.0);
        assertThat(count("storyq_jobs_failed_total")).isEqualTo(1.0);

        assertThatThrownBy(() -> sut.cancel("missing"))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(((AppException) e).getErrorCode().getCode()).isEqualTo("JOB-001"));
    }

    @Test
    @DisplayName("보존 정리: 완료 잡이 나이 기준을 넘으면 제거")
    void evict_expired() {
        properties.getRetention().setCompletedMaxAge(Duration.ofMinutes(10));
        sut.enqueue(StoryPayload.ofPrompt("x"), null);
        Job active = sut.dequeue("w1").orElseThrow();
        sut.ack(active, "done");

        assertThat(sut.evictExpired()).isZero();
        clock.advance(Duration.ofMinutes(11));
        assertThat(sut.evictExpired()).isEqualTo(1);
        assertThat(store.find(active.getId())).isEmpty();
        assertThat(count("storyq_jobs_evicted_total")).isEqualTo(1.0);
    }
}
