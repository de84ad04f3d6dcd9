package com.yerin.storyq.infra;

/**
 * 큐 하나의 Redis 키 레이아웃. 큐 이름을 해시태그로 감싸 한 클러스터 슬롯에 모은다.
 * <pre>
 * {prefix}job:{id}     HASH  잡 레코드
 * {prefix}waiting      ZSET  점유 대기 (score = 우선순위 + 진입 순번)
 * {prefix}delayed      ZSET  지연/재시도 대기 (score = delayUntil ms)
 * {prefix}active       ZSET  점유 중 (score = lease 만료 ms)
 * {prefix}completed    ZSET  (score = finishedAt ms)
 * {prefix}failed       ZSET  (score = finishedAt ms)
 * {prefix}seq          STRING 진입 순번 카운터
 * {prefix}idem:{key}   STRING 멱등키 → jobId
 * {prefix}events       PUBSUB "jobId|status" 종료 알림
 * </pre>
 */
public record RedisKeys(String prefix) {

    public static RedisKeys of(String keyPrefix, String queueName) {
        return new RedisKeys(keyPrefix + ":{" + queueName + "}:");
    }

    public String job(String jobId) {
        return prefix + "job:" + jobId;
    }

    public String waiting() {
        return prefix + "waiting";
    }

    public String delayed() {
        return prefix + "delayed";
    }

    public String active() {
        return prefix + "active";
    }

    public String completed() {
        return prefix + "completed";
    }

    public String failed() {
        return prefix + "failed";
    }

    public String events() {
        return prefix + "events";
    }
}
