package com.yerin.storyq.dto.response;

import com.yerin.storyq.domain.QueueCounts;

import java.time.Instant;

public record QueueMetricsResponse(
        String queue,
        long waiting,
        long delayed,
        long active,
        long completed,
        long failed,
        Instant ts
) {
    public static QueueMetricsResponse of(String queue, QueueCounts c, Instant ts) {
        return new QueueMetricsResponse(queue, c.waiting(), c.delayed(), c.active(), c.completed(), c.failed(), ts);
    }
}
