package com.imperium.searchinsight.exception;

/**
 * 查询非法（空文本、未知 searchType、非法 params 等）。唯一会传递给调用方的失败类型，
 * 抛出时尚未进行任何缓存或 provider 访问。
 */
public class SearchValidationException extends RuntimeException {

    private final String field;

    public SearchValidationException(String message, String field) {
        super(message);
        this.field = field;
    }

    /** 出错字段名，可能为 null */
    public String getField() {
        return field;
    }
}
