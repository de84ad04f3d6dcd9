package com.yerin.storyq.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    ACTIVE,
    COMPLETED,
    FAILED,
    RETRYING;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    // 저장소/응답 표현은 소문자
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus from(String value) {
        return JobStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
