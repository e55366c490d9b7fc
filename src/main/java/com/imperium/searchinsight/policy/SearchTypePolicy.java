package com.imperium.searchinsight.policy;

import com.imperium.searchinsight.model.SearchDepth;
import com.imperium.searchinsight.model.SearchType;

/**
 * 按搜索类型调整检索参数：news 强制 advanced 深度，image 强制带图片，结果数上限 20。
 */
public final class SearchTypePolicy {

    public static final int MAX_RESULTS_CAP = 20;

    /** 发给 primary provider 的查询最大字符数 */
    public static final int MAX_QUERY_CHARS = 400;

    /**
     * @param type      搜索类型
     * @param requested 调用方指定的深度，null 视为 basic
     * @return 实际使用的深度
     */
    public static SearchDepth effectiveDepth(SearchType type, SearchDepth requested) {
        if (type == SearchType.NEWS) {
            return SearchDepth.ADVANCED;
        }
        return requested != null ? requested : SearchDepth.BASIC;
    }

    public static boolean includeImages(SearchType type, boolean requested) {
        return type == SearchType.IMAGE || requested;
    }

    public static int clampMaxResults(int maxResults) {
        return Math.max(1, Math.min(MAX_RESULTS_CAP, maxResults));
    }

    private SearchTypePolicy() {}
}
