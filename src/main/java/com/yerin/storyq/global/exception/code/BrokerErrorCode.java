package com.yerin.storyq.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum BrokerErrorCode implements ErrorCode {
    CONNECTION_FAILED(HttpStatus.SERVICE_UNAVAILABLE, "큐 브로커에 연결할 수 없습니다.", "BROKER-001"),
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "큐 브로커를 일시적으로 사용할 수 없습니다.", "BROKER-002");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
