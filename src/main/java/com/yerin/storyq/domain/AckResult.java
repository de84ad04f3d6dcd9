package com.yerin.storyq.domain;

public enum AckResult {
    COMPLETED,
    /** 이미 COMPLETED 상태. 아무 일도 하지 않는다. */
    DUPLICATE,
    /** 점유 토큰이 다르거나 ACTIVE 가 아님. 리퍼가 회수한 뒤 늦게 도착한 ack 등. */
    STALE,
    NOT_FOUND
}
