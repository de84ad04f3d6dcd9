package com.yerin.storyq.domain;

/**
 * @param duplicate 같은 멱등키로 이미 등록된 잡이 있어 기존 id 를 돌려준 경우 true
 */
public record EnqueueResult(String jobId, boolean duplicate) {
}
