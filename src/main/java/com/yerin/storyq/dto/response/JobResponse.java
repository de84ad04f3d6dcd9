package com.yerin.storyq.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.storyq.domain.Job;
import com.yerin.storyq.domain.JobStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        String id,
        JobStatus status,
        Integer attempts,
        Integer maxAttempts,
        Integer priority,
        String result,
        String error,
        Boolean cancelRequested,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Instant delayUntil
) {
    public static JobResponse from(Job j) {
        return new JobResponse(
                j.getId(),
                j.getStatus(),
                j.getAttempts(),
                j.getMaxAttempts(),
                j.getPriority(),
                j.getResult(),
                j.getError(),
                j.isCancelRequested() ? Boolean.TRUE : null,
                j.getCreatedAt(),
                j.getStartedAt(),
                j.getFinishedAt(),
                j.getDelayUntil()
        );
    }
}
