package com.yerin.storyq.domain;

public enum NackResult {
    RETRYING,
    FAILED,
    DUPLICATE,
    STALE,
    NOT_FOUND
}
