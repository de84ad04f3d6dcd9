package com.yerin.storyq.service;

import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.Job;
import com.yerin.storyq.domain.JobEventLog;
import com.yerin.storyq.domain.JobStatus;
import com.yerin.storyq.domain.NewJob;
import com.yerin.storyq.global.exception.AppException;
import com.yerin.storyq.infra.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("JobTracker 상태 조회/완료 대기 테스트")
class JobTrackerTest {

    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    InMemoryJobStore store = new InMemoryJobStore(Duration.ofHours(1));
    JobAuditLog auditLog = mock(JobAuditLog.class);
    StoryqProperties properties = new StoryqProperties();
    JobTracker sut;

    @BeforeEach
    void setUp() {
        properties.getTracker().setMaxWait(Duration.ofSeconds(2));
        sut = new JobTracker(store, auditLog, properties);
        sut.subscribe();
        store.enqueue(new NewJob("job-1", "{}", 0, 3, NOW, NOW, null));
    }

    private Job claim() {
        return store.claimNext("w1", "tok", NOW, NOW.plusSeconds(60)).orElseThrow();
    }

    @Test
    @DisplayName("없는 잡은 JOB_NOT_FOUND")
    void getStatus_not_found() {
        assertThatThrownBy(() -> sut.getStatus("missing"))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(((AppException) e).getErrorCode().getCode()).isEqualTo("JOB-001"));
        assertThatThrownBy(() -> sut.awaitTerminal("missing", Duration.ofSeconds(1)))
                .isInstanceOf(AppException.class);
    }

    @Test
    @DisplayName("timeout 0 이면 현재 상태를 바로 돌려준다")
    void zero_timeout_returns_current() {
        CompletableFuture<Job> f = sut.awaitTerminal("job-1", Duration.ZERO);

        assertThat(f).isDone();
        assertThat(f.join().getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    @DisplayName("완료 알림이 오면 대기가 즉시 풀린다")
    void completes_on_terminal_event() {
        Job active = claim();
        CompletableFuture<Job> f = sut.awaitTerminal("job-1", Duration.ofSeconds(2));
        assertThat(f).isNotDone();

        store.complete("job-1", active.getLockToken(), "the end", NOW);

        Job done = f.orTimeout(1, TimeUnit.SECONDS).join();
        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.getResult()).isEqualTo("the end");
        assertThat(sut.waiterCount()).isZero();
    }

    @Test
    @DisplayName("종료되지 않으면 timeout 시점의 상태를 돌려준다")
    void times_out_with_current_view() {
        claim();
        long start = System.nanoTime();

        Job seen = sut.awaitTerminal("job-1", Duration.ofMillis(200)).join();

        assertThat(seen.getStatus()).isEqualTo(JobStatus.ACTIVE);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(150));
        assertThat(sut.waiterCount()).isZero();
    }

    @Test
    @DisplayName("timeout 은 max-wait 로 잘린다")
    void timeout_is_capped() {
        properties.getTracker().setMaxWait(Duration.ofMillis(100));
        sut = new JobTracker(store, auditLog, properties);

        Job seen = sut.awaitTerminal("job-1", Duration.ofMinutes(10)).orTimeout(2, TimeUnit.SECONDS).join();

        assertThat(seen.getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    @DisplayName("이미 종료된 잡은 기다리지 않는다")
    void already_terminal() {
        store.cancel("job-1", "cancelled", NOW);

        CompletableFuture<Job> f = sut.awaitTerminal("job-1", Duration.ofSeconds(5));

        assertThat(f).isDone();
        assertThat(f.join().getError()).isEqualTo("cancelled");
    }

    @Test
    @DisplayName("이력이 없고 잡도 없으면 JOB_NOT_FOUND, 잡이 있으면 빈 목록")
    void history() {
        when(auditLog.history(anyString())).thenReturn(List.of());

        assertThat(sut.history("job-1")).isEmpty();
        assertThatThrownBy(() -> sut.history("missing")).isInstanceOf(AppException.class);

        JobEventLog event = JobEventLog.builder().jobId("gone").eventType("COMPLETED").build();
        when(auditLog.history("gone")).thenReturn(List.of(event));
        assertThat(sut.history("gone")).containsExactly(event);
    }
}
