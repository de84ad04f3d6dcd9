package com.yerin.storyq.global.exception;

import com.yerin.storyq.global.exception.code.BrokerErrorCode;

/**
 * 브로커 연결이 끊겼고 클라이언트 버퍼도 가득 찬 경우.
 */
public class BrokerUnavailableException extends AppException {

    public BrokerUnavailableException(Throwable cause) {
        super(BrokerErrorCode.UNAVAILABLE, cause);
    }
}
