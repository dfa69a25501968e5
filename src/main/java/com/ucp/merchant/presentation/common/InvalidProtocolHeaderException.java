package com.ucp.merchant.presentation.common;

import com.ucp.merchant.common.exception.ApplicationException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 프로토콜 헤더 값이 허용 길이를 넘는 경우 (400)
 */
public class InvalidProtocolHeaderException extends ApplicationException {

    public InvalidProtocolHeaderException(String headerName, int maxLength) {
        super(ErrorCode.INVALID_HEADER_VALUE, headerName + " 최대 길이=" + maxLength);
    }
}
