package com.yerin.storyq.domain;

public record QueueCounts(long waiting, long delayed, long active, long completed, long failed) {
}
