package com.yerin.storyq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * storyq 설정 (application.yml 의 {@code storyq.*}).
 */
@Configuration
@ConfigurationProperties(prefix = "storyq")
@Data
public class StoryqProperties {

    private QueueConfig queue = new QueueConfig();
    private RetryConfig retry = new RetryConfig();
    private WorkerConfig worker = new WorkerConfig();
    private ReaperConfig reaper = new ReaperConfig();
    private RetentionConfig retention = new RetentionConfig();
    private BrokerConfig broker = new BrokerConfig();
    private TrackerConfig tracker = new TrackerConfig();
    private GeneratorConfig generator = new GeneratorConfig();

    @Data
    public static class QueueConfig {
        /**
         * 큐 이름. Redis 키 네임스페이스에 포함된다.
         */
        private String name = "story-generation";

        /**
         * Redis 키 접두사.
         */
        private String keyPrefix = "storyq";

        /**
         * 잡별 지정이 없을 때 적용되는 최대 실행 횟수.
         */
        private int maxAttempts = 3;

        /**
         * 잡별로 요청할 수 있는 maxAttempts 상한.
         */
        private int maxAttemptsCeiling = 25;

        /**
         * ACTIVE 상태로 머물 수 있는 최대 시간. 넘기면 리퍼가 회수한다.
         */
        private Duration visibilityTimeout = Duration.ofMinutes(2);

        /**
         * 잡별로 요청할 수 있는 delay 상한.
         */
        private Duration maxDelay = Duration.ofDays(30);
    }

    @Data
    public static class RetryConfig {
        private Duration baseBackoff = Duration.ofSeconds(1);
        private Duration backoffCap = Duration.ofMinutes(1);
        private double jitterRatio = 0.2;
    }

    @Data
    public static class WorkerConfig {
        private boolean autoStart = true;
        private int concurrency = 2;
        private Duration pollInterval = Duration.ofMillis(500);

        /**
         * 생성 호출 1회의 타임아웃. visibilityTimeout 보다 짧아야 한다.
         */
        private Duration executionTimeout = Duration.ofSeconds(90);
    }

    @Data
    public static class ReaperConfig {
        private int batchSize = 100;
    }

    @Data
    public static class RetentionConfig {
        private Duration completedMaxAge = Duration.ofHours(24);
        private Duration failedMaxAge = Duration.ofDays(7);
        private int completedMaxCount = 1000;
        private int failedMaxCount = 5000;

        /**
         * 멱등키 보존 기간.
         */
        private Duration idempotencyTtl = Duration.ofHours(24);
    }

    @Data
    public static class BrokerConfig {
        /**
         * 연결이 끊긴 동안 클라이언트에 쌓아둘 수 있는 명령 수.
         */
        private int requestQueueSize = 1000;
        private Duration reconnectMinDelay = Duration.ofMillis(100);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private Duration commandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class TrackerConfig {
        /**
         * 완료 대기(long-poll) 최대 시간.
         */
        private Duration maxWait = Duration.ofSeconds(30);
    }

    @Data
    public static class GeneratorConfig {
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private int maxTokens = 4096;
        private double temperature = 0.8;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(120);
    }
}
