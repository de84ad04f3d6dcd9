package com.yerin.storyq.domain;

public enum CancelResult {
    /** QUEUED/RETRYING 잡을 바로 FAILED 로 전이 */
    CANCELLED,
    /** ACTIVE 잡에 취소 플래그만 세움. 워커가 체크포인트에서 확인한다. */
    REQUESTED,
    ALREADY_TERMINAL,
    NOT_FOUND
}
