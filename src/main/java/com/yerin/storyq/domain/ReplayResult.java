package com.yerin.storyq.domain;

public enum ReplayResult {
    REQUEUED,
    NOT_FAILED,
    NOT_FOUND
}
