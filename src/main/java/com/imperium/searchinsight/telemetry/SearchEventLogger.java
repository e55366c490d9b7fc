package com.imperium.searchinsight.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 搜索事件日志：每个事件一行 key=value。调用方标识只保留后 4 位，查询文本最多 50 字符。
 */
@Component
public class SearchEventLogger {

    private static final Logger log = LoggerFactory.getLogger("search.events");

    static final int QUERY_LOG_CHARS = 50;
    private static final int VISIBLE_ID_CHARS = 4;

    public void record(SearchEvent event) {
        if (event == null) {
            return;
        }
        String line = format(event);
        switch (event.kind()) {
            case REJECTED, PROVIDER_FAILED, STALE_SERVED, DEGRADED, CACHE_ERROR -> log.warn(line);
            case JOINED -> log.debug(line);
            default -> log.info(line);
        }
    }

    String format(SearchEvent event) {
        StringBuilder sb = new StringBuilder("event=").append(event.kind().name().toLowerCase(Locale.ROOT));
        sb.append(" requester=").append(maskRequester(event.requesterId()));
        sb.append(" query=\"").append(truncateQuery(event.query())).append('"');
        if (event.type() != null) sb.append(" type=").append(event.type().value());
        if (event.cacheKey() != null) sb.append(" key=").append(shortKey(event.cacheKey()));
        if (event.source() != null) sb.append(" source=").append(event.source().value());
        if (event.elapsedMs() > 0) sb.append(" elapsedMs=").append(event.elapsedMs());
        if (event.detail() != null && !event.detail().isBlank()) sb.append(" detail=\"").append(event.detail()).append('"');
        return sb.toString();
    }

    static String maskRequester(String requesterId) {
        if (requesterId == null || requesterId.isBlank()) {
            return "****";
        }
        String id = requesterId.trim();
        if (id.length() <= VISIBLE_ID_CHARS) {
            return "****" + id;
        }
        return "*".repeat(id.length() - VISIBLE_ID_CHARS) + id.substring(id.length() - VISIBLE_ID_CHARS);
    }

    static String truncateQuery(String query) {
        if (query == null) {
            return "";
        }
        String q = query.replace('"', '\'').replaceAll("\\s+", " ").trim();
        return q.length() <= QUERY_LOG_CHARS ? q : q.substring(0, QUERY_LOG_CHARS) + "...";
    }

    private static String shortKey(String digest) {
        return digest.length() > 12 ? digest.substring(0, 12) : digest;
    }
}
