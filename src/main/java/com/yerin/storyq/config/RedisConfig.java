package com.yerin.storyq.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.resource.Delay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.data.redis.ClientResourcesBuilderCustomizer;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.concurrent.TimeUnit;

/**
 * Lettuce 연결 정책.
 * 끊기면 full-jitter 지수 백오프로 재연결하고, 그동안 명령은 request-queue-size 까지만 버퍼링한다.
 */
@Slf4j
@Configuration
@Profile("!inmem")
public class RedisConfig {

    @Bean
    public LettuceClientConfigurationBuilderCustomizer storyqLettuceClientCustomizer(StoryqProperties properties) {
        StoryqProperties.BrokerConfig broker = properties.getBroker();
        return builder -> {
            builder.commandTimeout(broker.getCommandTimeout());
            builder.clientOptions(ClientOptions.builder()
                    .autoReconnect(true)
                    .requestQueueSize(broker.getRequestQueueSize())
                    .disconnectedBehavior(ClientOptions.DisconnectedBehavior.ACCEPT_COMMANDS)
                    .timeoutOptions(TimeoutOptions.enabled(broker.getCommandTimeout()))
                    .build());
            log.info("[Broker] lettuce requestQueueSize={}, commandTimeout={}",
                    broker.getRequestQueueSize(), broker.getCommandTimeout());
        };
    }

    @Bean
    public ClientResourcesBuilderCustomizer storyqReconnectDelayCustomizer(StoryqProperties properties) {
        StoryqProperties.BrokerConfig broker = properties.getBroker();
        return builder -> builder.reconnectDelay(Delay.fullJitter(
                broker.getReconnectMinDelay(),
                broker.getReconnectMaxDelay(),
                2,
                TimeUnit.MILLISECONDS));
    }

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }
}
