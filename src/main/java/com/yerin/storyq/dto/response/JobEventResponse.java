package com.yerin.storyq.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.storyq.domain.JobEventLog;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEventResponse(
        String eventType,
        Integer attempt,
        String message,
        Instant ts
) {
    public static JobEventResponse from(JobEventLog e) {
        return new JobEventResponse(e.getEventType(), e.getAttempt(), e.getMessage(), e.getTs());
    }
}
