package com.ucp.merchant.presentation.common;

import com.ucp.merchant.common.exception.ApplicationException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 필수 프로토콜 헤더 누락 (400)
 */
public class MissingProtocolHeaderException extends ApplicationException {

    public MissingProtocolHeaderException(String headerName) {
        super(ErrorCode.MISSING_REQUIRED_HEADER, headerName);
    }
}
