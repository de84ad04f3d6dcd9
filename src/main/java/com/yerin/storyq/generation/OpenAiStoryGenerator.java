package com.yerin.storyq.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yerin.storyq.config.StoryqProperties;
import com.yerin.storyq.domain.StoryPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * OpenAI chat completions 로 스토리를 생성한다.
 */
@Slf4j
@Profile("!test")
@Component
public class OpenAiStoryGenerator implements StoryGenerator {

    static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final RestClient openAiRestClient;
    private final StoryqProperties.GeneratorConfig config;

    public OpenAiStoryGenerator(RestClient openAiRestClient, StoryqProperties properties) {
        this.openAiRestClient = openAiRestClient;
        this.config = properties.getGenerator();
    }

    @Override
    public String generate(StoryPayload payload, GenerationContext context) throws GenerationException {
        context.checkpoint();

        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "max_tokens", config.getMaxTokens(),
                "temperature", config.getTemperature(),
                "messages", List.of(
                        Map.of("role", "system", "content", StoryPromptBuilder.systemPrompt()),
                        Map.of("role", "user", "content", StoryPromptBuilder.userPrompt(payload))
                )
        );

        ChatCompletion completion;
        try {
            completion = openAiRestClient.post()
                    .uri(COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(ChatCompletion.class);
        } catch (HttpClientErrorException e) {
            throw classify(e);
        } catch (HttpServerErrorException e) {
            throw new TransientGenerationException("generation api error " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new TransientGenerationException("generation api unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransientGenerationException("generation api call failed: " + e.getMessage(), e);
        }

        context.checkpoint();

        if (completion == null || completion.choices() == null || completion.choices().isEmpty()) {
            throw new TransientGenerationException("generation api returned no choices");
        }
        Choice choice = completion.choices().get(0);
        if ("content_filter".equals(choice.finishReason())) {
            throw new TerminalGenerationException("generation blocked by content filter");
        }
        String content = choice.message() == null ? null : choice.message().content();
        if (content == null || content.isBlank()) {
            throw new TransientGenerationException("generation api returned empty content");
        }

        log.info("[Generator] jobId={}, attempt={}, model={}, chars={}",
                context.getJobId(), context.getAttempt(), completion.model(), content.length());
        return content.trim();
    }

    private GenerationException classify(HttpClientErrorException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            if (body.contains("insufficient_quota")) {
                return new TerminalGenerationException("generation quota exhausted", e);
            }
            return new TransientGenerationException("generation api rate limited", e);
        }
        if (status == HttpStatus.REQUEST_TIMEOUT.value() || status == HttpStatus.CONFLICT.value()) {
            return new TransientGenerationException("generation api error " + status, e);
        }
        return new TerminalGenerationException("generation request rejected " + status, e);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletion(String id, String model, List<Choice> choices) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(int index, Message message, @JsonProperty("finish_reason") String finishReason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {}
}
