package com.yerin.storyq.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 생성 API 호출용 RestClient.
 */
@Slf4j
@Configuration
public class OpenAiClientConfig {

    @Bean
    public RestClient openAiRestClient(RestClient.Builder builder, StoryqProperties properties) {
        StoryqProperties.GeneratorConfig config = properties.getGenerator();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[Generator] storyq.generator.api-key is empty, generation calls will be rejected");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) config.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) config.getReadTimeout().toMillis());

        return builder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .requestFactory(requestFactory)
                .build();
    }
}
