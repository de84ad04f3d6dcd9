package com.yerin.storyq.infra;

import com.yerin.storyq.config.StoryqProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("백오프/지터 계산 테스트")
public class BackoffTest {

    @Test
    @DisplayName("지터 0과 상한 경계값 검증")
    void noJitter_and_cap() {
        Duration d0 = Backoff.expJitter(0, 1000, 60000, 0.0);
        Duration d3 = Backoff.expJitter(3, 1000, 60000, 0.0);
        Duration dc = Backoff.expJitter(10, 1000, 60000, 0.0);

        assertThat(d0.toMillis()).isEqualTo(1000);
        assertThat(d3.toMillis()).isEqualTo(8000);
        assertThat(dc.toMillis()).isEqualTo(60000); // cap
    }

    @RepeatedTest(20)
    @DisplayName("지터를 적용해도 상한을 넘지 않는다")
    void jitter_never_exceeds_cap() {
        Duration d = Backoff.expJitter(10, 1000, 60000, 0.5);
        assertThat(d.toMillis()).isBetween(30000L, 60000L);
    }

    @Test
    @DisplayName("첫 실패 후 대기는 base 부터 시작한다")
    void afterAttempt_starts_from_base() {
        var retry = new StoryqProperties.RetryConfig();
        retry.setBaseBackoff(Duration.ofMillis(200));
        retry.setBackoffCap(Duration.ofSeconds(5));
        retry.setJitterRatio(0.0);

        assertThat(Backoff.afterAttempt(1, retry)).isEqualTo(Duration.ofMillis(200));
        assertThat(Backoff.afterAttempt(2, retry)).isEqualTo(Duration.ofMillis(400));
        assertThat(Backoff.afterAttempt(3, retry)).isEqualTo(Duration.ofMillis(800));
    }
}
