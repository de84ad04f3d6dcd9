package com.yerin.storyq.infra;

import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;

/**
 * Redis 기반 잡 저장소. 상태 전이는 모두 Lua 스크립트 하나로 원자 실행된다.
 */
@Slf4j
@Component
@Profile("!inmem")
public class RedisJobStore implements JobStore {

    private static final RedisScript<String> ENQUEUE = script("enqueue", String.class);
    private static final RedisScript<String> CLAIM = script("claim", String.class);
    private static final RedisScript<String> ACK = script("ack", String.class);
    private static final RedisScript<String> NACK = script("nack", String.class);
    private static final RedisScript<String> CANCEL = script("cancel", String.class);
    private static final RedisScript<String> REPLAY = script("replay", String.class);
    private static final RedisScript<Long> PROMOTE = script("promote", Long.class);
    private static final RedisScript<Long> EVICT = script("evict", Long.class);

    private static final int PROMOTE_BATCH = 100;
    private static final int EVICT_BATCH = 500;

    private final BrokerClient broker;
    private final RedisMessageListenerContainer listenerContainer;
    private final RedisKeys keys;
    private final List<String> routingKeys;
    private final String maxPriority = String.valueOf(EnqueueOptions.MAX_PRIORITY);
    private final long idempotencyTtlMillis;

    public RedisJobStore(BrokerClient broker,
                         RedisMessageListenerContainer listenerContainer,
                         StoryqProperties properties) {
        this.broker = broker;
        this.listenerContainer = listenerContainer;
        this.keys = RedisKeys.of(properties.getQueue().getKeyPrefix(), properties.getQueue().getName());
        this.routingKeys = List.of(keys.waiting());
        this.idempotencyTtlMillis = properties.getRetention().getIdempotencyTtl().toMillis();
    }

    private static <T> RedisScript<T> script(String name, Class<T> resultType) {
        return RedisScript.of(new ClassPathResource("scripts/" + name + ".lua"), resultType);
    }

    @Override
    public EnqueueResult enqueue(NewJob job) {
        Instant delayUntil = job.isDelayed() ? job.delayUntil() : job.createdAt();
        String out = broker.execute(ENQUEUE, routingKeys,
                keys.prefix(),
                job.id(),
                job.payload(),
                String.valueOf(job.priority()),
                String.valueOf(job.maxAttempts()),
                millis(job.createdAt()),
                millis(delayUntil),
                job.idempotencyKey() == null ? "" : job.idempotencyKey(),
                String.valueOf(idempotencyTtlMillis),
                maxPriority);
        int sep = out.lastIndexOf('|');
        String jobId = out.substring(0, sep);
        boolean duplicate = "1".equals(out.substring(sep + 1));
        if (duplicate) {
            log.info("[RedisStore] duplicate idempotencyKey={}, jobId={}", job.idempotencyKey(), jobId);
        }
        return new EnqueueResult(jobId, duplicate);
    }

    @Override
    public Optional<Job> claimNext(String workerId, String lockToken, Instant now, Instant leaseUntil) {
        String claimedId = broker.execute(CLAIM, routingKeys,
                keys.prefix(),
                millis(now),
                millis(leaseUntil),
                workerId,
                lockToken,
                maxPriority,
                String.valueOf(PROMOTE_BATCH));
        if (claimedId == null || claimedId.isEmpty()) {
            return Optional.empty();
        }
        // lease 를 쥔 상태라 이후 읽기는 claim 결과와 같다
        return find(claimedId);
    }

    @Override
    public AckResult complete(String jobId, String lockToken, String result, Instant now) {
        String out = broker.execute(ACK, routingKeys, keys.prefix(), jobId, lockToken, result, millis(now));
        return AckResult.valueOf(out.toUpperCase(Locale.ROOT));
    }

    @Override
    public NackResult fail(String jobId, String lockToken, String error, boolean retryable, Instant now, Instant retryAt) {
        String out = broker.execute(NACK, routingKeys,
                keys.prefix(), jobId, lockToken, error, retryable ? "1" : "0", millis(now), millis(retryAt));
        return NackResult.valueOf(out.toUpperCase(Locale.ROOT));
    }

    @Override
    public CancelResult cancel(String jobId, String reason, Instant now) {
        String out = broker.execute(CANCEL, routingKeys, keys.prefix(), jobId, reason, millis(now));
        return CancelResult.valueOf(out.toUpperCase(Locale.ROOT));
    }

    @Override
    public boolean isCancelRequested(String jobId) {
        Object flag = broker.call(r -> r.opsForHash().get(keys.job(jobId), "cancelRequested"));
        return "1".equals(flag);
    }

    @Override
    public ReplayResult replay(String jobId, Instant now) {
        String out = broker.execute(REPLAY, routingKeys, keys.prefix(), jobId, millis(now), maxPriority);
        return ReplayResult.valueOf(out.toUpperCase(Locale.ROOT));
    }

    @Override
    public Optional<Job> find(String jobId) {
        Map<Object, Object> raw = broker.call(r -> r.opsForHash().entries(keys.job(jobId)));
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> fields = new HashMap<>();
        raw.forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v)));
        return Optional.of(toJob(fields));
    }

    @Override
    public List<Lease> expiredLeases(Instant now, int limit) {
        Set<ZSetOperations.TypedTuple<String>> expired = broker.call(r -> r.opsForZSet()
                .rangeByScoreWithScores(keys.active(), Double.NEGATIVE_INFINITY, now.toEpochMilli(), 0, limit));
        if (expired == null || expired.isEmpty()) {
            return List.of();
        }
        List<Lease> leases = new ArrayList<>(expired.size());
        for (ZSetOperations.TypedTuple<String> t : expired) {
            String jobId = t.getValue();
            List<Object> v = broker.call(r -> r.opsForHash()
                    .multiGet(keys.job(jobId), List.<Object>of("lockToken", "workerId", "attempts")));
            if (v.get(0) == null) {
                // 이미 ack/nack 되었거나 제거된 잡
                continue;
            }
            leases.add(new Lease(
                    jobId,
                    (String) v.get(0),
                    (String) v.get(1),
                    v.get(2) == null ? 0 : Integer.parseInt((String) v.get(2)),
                    Instant.ofEpochMilli(t.getScore() == null ? 0L : t.getScore().longValue())
            ));
        }
        return leases;
    }

    @Override
    public int promoteDue(Instant now, int limit) {
        Long moved = broker.execute(PROMOTE, routingKeys, keys.prefix(), millis(now), maxPriority, String.valueOf(limit));
        return moved == null ? 0 : moved.intValue();
    }

    @Override
    public int evict(JobStatus terminalStatus, Instant olderThan, int keepMax) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("only terminal jobs can be evicted: " + terminalStatus);
        }
        Long removed = broker.execute(EVICT, routingKeys,
                keys.prefix(), terminalStatus.value(), millis(olderThan), String.valueOf(keepMax), String.valueOf(EVICT_BATCH));
        return removed == null ? 0 : removed.intValue();
    }

    @Override
    public QueueCounts counts() {
        return broker.call(r -> new QueueCounts(
                zcard(r.opsForZSet().zCard(keys.waiting())),
                zcard(r.opsForZSet().zCard(keys.delayed())),
                zcard(r.opsForZSet().zCard(keys.active())),
                zcard(r.opsForZSet().zCard(keys.completed())),
                zcard(r.opsForZSet().zCard(keys.failed()))
        ));
    }

    @Override
    public void subscribe(JobEventListener listener) {
        listenerContainer.addMessageListener((message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            int sep = body.lastIndexOf('|');
            if (sep < 0) {
                log.warn("[RedisStore] malformed event message={}", body);
                return;
            }
            listener.onTerminal(body.substring(0, sep), JobStatus.from(body.substring(sep + 1)));
        }, new ChannelTopic(keys.events()));
        log.info("[RedisStore] subscribed channel={}", keys.events());
    }

    private static long zcard(Long n) {
        return n == null ? 0 : n;
    }

    private static String millis(Instant t) {
        return String.valueOf(t.toEpochMilli());
    }

    private static Job toJob(Map<String, String> f) {
        return Job.builder()
                .id(f.get("id"))
                .payload(f.get("payload"))
                .status(JobStatus.from(f.get("status")))
                .attempts(intOf(f.get("attempts")))
                .maxAttempts(intOf(f.get("maxAttempts")))
                .priority(intOf(f.get("priority")))
                .result(f.get("result"))
                .error(f.get("error"))
                .createdAt(instantOf(f.get("createdAt")))
                .startedAt(instantOf(f.get("startedAt")))
                .finishedAt(instantOf(f.get("finishedAt")))
                .delayUntil(instantOf(f.get("delayUntil")))
                .workerId(f.get("workerId"))
                .lockToken(f.get("lockToken"))
                .cancelRequested("1".equals(f.get("cancelRequested")))
                .idempotencyKey(f.get("idempotencyKey"))
                .build();
    }

    private static int intOf(String v) {
        return v == null ? 0 : Integer.parseInt(v);
    }

    private static Instant instantOf(String v) {
        return v == null || v.isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(v));
    }
}
