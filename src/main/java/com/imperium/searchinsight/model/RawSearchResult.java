package com.imperium.searchinsight.model;

import java.util.List;

/**
 * 归一化后的 provider 输出：有序结果列表 + 可选的直接答案。
 */
public record RawSearchResult(List<RawItem> items, String directAnswer) {

    public RawSearchResult {
        items = items != null ? List.copyOf(items) : List.of();
        directAnswer = directAnswer != null && !directAnswer.isBlank() ? directAnswer.trim() : null;
    }

    public static RawSearchResult empty() {
        return new RawSearchResult(List.of(), null);
    }

    /** 既没有结果也没有直接答案 */
    public boolean isEmpty() {
        return items.isEmpty() && directAnswer == null;
    }
}
