package com.imperium.searchinsight.exception;

/**
 * 缓存不可用或条目损坏。编排层捕获后跳过缓存继续执行。
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
