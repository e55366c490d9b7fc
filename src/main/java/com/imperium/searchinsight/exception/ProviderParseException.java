package com.imperium.searchinsight.exception;

/**
 * Provider 返回了无法解析或结构不符合预期的响应，按 provider 失败处理。
 */
public class ProviderParseException extends ProviderException {

    public ProviderParseException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }
}
