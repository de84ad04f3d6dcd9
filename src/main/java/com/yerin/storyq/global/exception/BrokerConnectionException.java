package com.yerin.storyq.global.exception;

import com.yerin.storyq.global.exception.code.BrokerErrorCode;

public class BrokerConnectionException extends AppException {

    public BrokerConnectionException(String detail, Throwable cause) {
        super(BrokerErrorCode.CONNECTION_FAILED.withDetail(detail), cause);
    }
}
