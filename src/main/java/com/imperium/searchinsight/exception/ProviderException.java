package com.imperium.searchinsight.exception;

/**
 * Provider 调用失败：超时、鉴权/配额、传输错误或空响应。只触发 fallback，不直接暴露给调用方。
 */
public class ProviderException extends RuntimeException {

    private final String providerId;

    public ProviderException(String providerId, String message) {
        super("[" + providerId + "] " + message);
        this.providerId = providerId;
    }

    public ProviderException(String providerId, String message, Throwable cause) {
        super("[" + providerId + "] " + message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
