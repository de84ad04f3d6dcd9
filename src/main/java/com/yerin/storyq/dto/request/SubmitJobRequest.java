package com.yerin.storyq.dto.request;

import com.yerin.storyq.domain.EnqueueOptions;
import com.yerin.storyq.domain.StoryPayload;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Duration;

public record SubmitJobRequest(
        @Valid
        @NotNull(message = "payload 는 필수입니다.")
        StoryPayload payload,

        @Schema(description = "높을수록 먼저 처리", example = "0")
        @Min(value = EnqueueOptions.MIN_PRIORITY, message = "priority 는 0 이상이어야 합니다.")
        @Max(value = EnqueueOptions.MAX_PRIORITY, message = "priority 는 1000 이하여야 합니다.")
        Integer priority,

        @Schema(description = "실행 가능 시점까지의 지연(ms)", example = "0")
        @PositiveOrZero(message = "delayMillis 는 0 이상이어야 합니다.")
        @Max(value = EnqueueOptions.MAX_DELAY_MILLIS, message = "delayMillis 는 30일을 넘을 수 없습니다.")
        Long delayMillis,

        @Min(value = 1, message = "maxAttempts 는 1 이상이어야 합니다.")
        Integer maxAttempts,

        @Size(max = 200, message = "idempotencyKey 는 200자를 넘을 수 없습니다.")
        String idempotencyKey
) {
    public EnqueueOptions toOptions() {
        return new EnqueueOptions(
                priority,
                delayMillis == null ? null : Duration.ofMillis(delayMillis),
                maxAttempts,
                idempotencyKey
        );
    }
}
