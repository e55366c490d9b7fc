package com.imperium.searchinsight.policy;

import com.imperium.searchinsight.exception.SearchValidationException;
import com.imperium.searchinsight.model.SearchParams;
import com.imperium.searchinsight.model.SearchQuery;
import com.imperium.searchinsight.model.SearchType;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 请求校验与归一化。失败抛 {@link SearchValidationException}，此时还没有任何缓存或 provider 访问。
 */
public final class QueryNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final String ANONYMOUS = "anonymous";

    /**
     * 返回归一化后的新查询：文本去首尾空白并合并空白，参数按类型策略修正、域名小写排序。
     * 文本大小写保留，大小写无关性由缓存键负责。
     */
    public static SearchQuery normalize(SearchQuery query) {
        if (query == null) {
            throw new SearchValidationException("query is required", "query");
        }
        String text = collapseWhitespace(query.getText());
        if (text.isEmpty()) {
            throw new SearchValidationException("query must not be blank", "query");
        }

        SearchType type = query.getType() != null ? query.getType() : SearchType.GENERAL;
        SearchParams in = query.getParams() != null ? query.getParams() : SearchParams.defaults();

        if (in.getMaxResults() <= 0) {
            throw new SearchValidationException("maxResults must be > 0", "maxResults");
        }
        if (in.getDays() != null && in.getDays() <= 0) {
            throw new SearchValidationException("days must be > 0", "days");
        }

        String language = in.getLanguage() == null || in.getLanguage().isBlank()
                ? "en" : in.getLanguage().trim().toLowerCase(Locale.ROOT);

        SearchParams params = SearchParams.builder()
                .depth(SearchTypePolicy.effectiveDepth(type, in.getDepth()))
                .maxResults(SearchTypePolicy.clampMaxResults(in.getMaxResults()))
                .includeDomains(normalizeDomains(in.getIncludeDomains()))
                .excludeDomains(normalizeDomains(in.getExcludeDomains()))
                .language(language)
                .days(in.getDays())
                .includeImages(SearchTypePolicy.includeImages(type, in.isIncludeImages()))
                .build();

        String requesterId = query.getRequesterId() == null || query.getRequesterId().isBlank()
                ? ANONYMOUS : query.getRequesterId().trim();

        return SearchQuery.builder()
                .text(text)
                .type(type)
                .params(params)
                .requesterId(requesterId)
                .build();
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    /** 缓存键使用的文本形式：合并空白 + 小写 */
    public static String canonicalText(String text) {
        return collapseWhitespace(text).toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalizeDomains(Collection<String> domains) {
        Set<String> out = new TreeSet<>();
        if (domains == null) {
            return out;
        }
        for (String d : domains) {
            if (d == null || d.isBlank()) continue;
            out.add(d.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private QueryNormalizer() {}
}
