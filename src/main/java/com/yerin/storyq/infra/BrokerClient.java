package com.yerin.storyq.infra;

import com.yerin.storyq.global.exception.BrokerConnectionException;
import com.yerin.storyq.global.exception.BrokerUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * 모든 큐 연산이 공유하는 Redis 연결 핸들.
 * 재연결과 끊긴 동안의 명령 버퍼링은 Lettuce 설정(RedisConfig)이 담당하고,
 * 여기서는 연결 실패/버퍼 초과를 {@link BrokerUnavailableException} 으로 바꿔 올린다.
 */
@Slf4j
@Component
@Profile("!inmem")
public class BrokerClient {

    private final StringRedisTemplate redis;

    public BrokerClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @PostConstruct
    public void connect() {
        try {
            String pong = redis.execute((RedisCallback<String>) connection -> connection.ping());
            log.info("[Broker] connected, ping={}", pong);
        } catch (DataAccessException e) {
            throw new BrokerConnectionException("redis ping failed: " + e.getMessage(), e);
        }
    }

    public <T> T execute(RedisScript<T> script, List<String> keys, String... args) {
        return call(r -> r.execute(script, keys, (Object[]) args));
    }

    public <T> T call(Function<StringRedisTemplate, T> operation) {
        try {
            return operation.apply(redis);
        } catch (RedisConnectionFailureException | QueryTimeoutException e) {
            log.warn("[Broker] unavailable: {}", e.getMessage());
            throw new BrokerUnavailableException(e);
        } catch (RedisSystemException e) {
            if (isRequestQueueOverflow(e)) {
                log.warn("[Broker] request buffer full: {}", e.getMessage());
                throw new BrokerUnavailableException(e);
            }
            throw e;
        }
    }

    // Lettuce: "Request queue size exceeded: n. Commands are not accepted until the queue size drops."
    static boolean isRequestQueueOverflow(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null && msg.contains("Request queue size exceeded")) {
                return true;
            }
        }
        return false;
    }
}
