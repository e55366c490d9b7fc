package com.imperium.searchinsight.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 为每个请求分配 requestId：放入 MDC 供日志使用，并在响应头回显。
 * 异步派发（Mono 返回值）也会经过本过滤器，保证完成阶段的日志同样带上 requestId。
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = RequestIdSupport.resolve(request);
        if (!response.containsHeader(RequestIdSupport.HEADER_REQUEST_ID)) {
            response.setHeader(RequestIdSupport.HEADER_REQUEST_ID, requestId);
        }
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestIdSupport.ATTR_REQUEST_ID);
        }
    }
}
