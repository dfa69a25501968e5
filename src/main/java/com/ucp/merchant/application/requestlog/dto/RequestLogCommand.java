package com.ucp.merchant.application.requestlog.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RequestLogCommand {
    private String requestId;
    private String agent;
    private String method;
    private String path;
    private String checkoutSessionId;
    private int responseStatus;
}
