package com.imperium.searchinsight.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * 依次取请求属性、请求头，都没有则生成新的并写回请求属性。
     */
    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return newRequestId();
        }
        if (request.getAttribute(ATTR_REQUEST_ID) instanceof String value && !value.isBlank()) {
            return value;
        }
        String headerValue = request.getHeader(HEADER_REQUEST_ID);
        String requestId = headerValue != null && !headerValue.isBlank() ? headerValue.trim() : newRequestId();
        request.setAttribute(ATTR_REQUEST_ID, requestId);
        return requestId;
    }
}
