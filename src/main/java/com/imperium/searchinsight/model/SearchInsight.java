package com.imperium.searchinsight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次搜索的结构化结果。成功返回时所有字段均已填充（directAnswer 除外，可为 null）。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchInsight {

    private String title;

    private String summary;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String url;

    /** provider 给出的直接答案，没有则为 null */
    private String directAnswer;

    private InsightSource source;

    /** 支撑结果，供 enhanced_search 直接投影 */
    @Builder.Default
    private List<RawItem> results = new ArrayList<>();

    /** 来自已过期（宽限期内）的缓存条目 */
    private boolean stale;

    public SearchInsight withSource(InsightSource newSource) {
        SearchInsight copy = copy();
        copy.setSource(newSource);
        return copy;
    }

    /** 深拷贝：列表字段另起一份，修改副本不影响原对象 */
    public SearchInsight copy() {
        return toBuilder()
                .keywords(keywords != null ? new ArrayList<>(keywords) : new ArrayList<>())
                .results(results != null ? new ArrayList<>(results) : new ArrayList<>())
                .build();
    }
}
