package com.yerin.storyq.domain;

/**
 * 잡이 종료 상태(COMPLETED/FAILED)에 도달했을 때 알림을 받는다.
 */
@FunctionalInterface
public interface JobEventListener {
    void onTerminal(String jobId, JobStatus status);
}
