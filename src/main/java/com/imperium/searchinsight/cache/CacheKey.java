package com.imperium.searchinsight.cache;

import com.imperium.searchinsight.model.SearchDepth;
import com.imperium.searchinsight.model.SearchParams;
import com.imperium.searchinsight.model.SearchQuery;
import com.imperium.searchinsight.model.SearchType;
import com.imperium.searchinsight.policy.QueryNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 缓存键：由（归一化文本, 类型, 全部参数）决定。
 * <p>
 * 文本仅在空白和大小写上不同的查询得到同一个键；任一参数不同则键不同。
 * 比较基于字段值本身，不依赖哈希摘要，因此不同语义的请求不会碰撞。
 */
public record CacheKey(String text,
                       SearchType type,
                       SearchDepth depth,
                       int maxResults,
                       List<String> includeDomains,
                       List<String> excludeDomains,
                       String language,
                       Integer days,
                       boolean includeImages) {

    public CacheKey {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(depth, "depth");
        includeDomains = sortedLower(includeDomains);
        excludeDomains = sortedLower(excludeDomains);
        language = language != null ? language.toLowerCase(Locale.ROOT) : "en";
    }

    public static CacheKey of(SearchQuery query) {
        SearchParams p = query.getParams() != null ? query.getParams() : SearchParams.defaults();
        return new CacheKey(
                QueryNormalizer.canonicalText(query.getText()),
                query.getType() != null ? query.getType() : SearchType.GENERAL,
                p.getDepth() != null ? p.getDepth() : SearchDepth.BASIC,
                p.getMaxResults(),
                p.getIncludeDomains() != null ? List.copyOf(p.getIncludeDomains()) : List.of(),
                p.getExcludeDomains() != null ? List.copyOf(p.getExcludeDomains()) : List.of(),
                p.getLanguage(),
                p.getDays(),
                p.isIncludeImages());
    }

    /** SHA-256 摘要，仅用于日志与响应 metadata */
    public String digest() {
        String canonical = String.join("\u0000",
                text,
                type.value(),
                depth.value(),
                Integer.toString(maxResults),
                String.join(",", includeDomains),
                String.join(",", excludeDomains),
                language,
                days != null ? days.toString() : "",
                Boolean.toString(includeImages));
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static List<String> sortedLower(Collection<String> domains) {
        if (domains == null || domains.isEmpty()) {
            return List.of();
        }
        return domains.stream()
                .filter(d -> d != null && !d.isBlank())
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .sorted()
                .toList();
    }
}
