package com.imperium.searchinsight.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.imperium.searchinsight.exception.SearchValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 搜索参数。字段固定且有类型，未知字段在反序列化时直接报错，不静默忽略。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchParams {

    /** basic | advanced */
    @Builder.Default
    private SearchDepth depth = SearchDepth.BASIC;

    /** 必须 > 0，归一化时截断到 [1, 20] */
    @Builder.Default
    private int maxResults = 10;

    @Builder.Default
    private Set<String> includeDomains = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> excludeDomains = new LinkedHashSet<>();

    @Builder.Default
    private String language = "en";

    /** 新闻时效窗口（天），可选，必须 > 0 */
    private Integer days;

    /** image 类型会强制为 true */
    @Builder.Default
    private boolean includeImages = false;

    public static SearchParams defaults() {
        return SearchParams.builder().build();
    }

    @JsonAnySetter
    public void rejectUnknown(String key, Object value) {
        throw new SearchValidationException("unknown configuration key: " + key, key);
    }
}
