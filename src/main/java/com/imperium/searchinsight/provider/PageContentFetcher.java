package com.imperium.searchinsight.provider;

import com.imperium.searchinsight.content.TextCleaner;
import com.imperium.searchinsight.model.RawItem;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 可选：抓取前 N 条结果的网页正文并追加到 snippet，提升摘要质量。
 * 抓取失败返回空文本，不会抛错。默认关闭。
 */
@Component
public class PageContentFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageContentFetcher.class);

    private static final String USER_AGENT = "SearchInsight/1.0";

    private final boolean enabled;
    private final int limit;
    private final int timeoutMs;
    private final int maxChars;

    public PageContentFetcher(
            @Value("${app.search.content.fetch-page-content:false}") boolean enabled,
            @Value("${app.search.content.page-fetch-limit:3}") int limit,
            @Value("${app.search.content.page-fetch-timeout-ms:5000}") int timeoutMs,
            @Value("${app.search.content.page-max-chars:2000}") int maxChars) {
        this.enabled = enabled;
        this.limit = Math.max(0, limit);
        this.timeoutMs = Math.max(500, timeoutMs);
        this.maxChars = Math.max(200, maxChars);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 阻塞调用，需在工作线程上执行。
     */
    public List<RawItem> enrich(List<RawItem> items) {
        if (!enabled || items == null || items.isEmpty() || limit == 0) {
            return items;
        }
        List<RawItem> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            RawItem item = items.get(i);
            if (i < limit && item.url().startsWith("http")) {
                String page = fetchText(item.url());
                if (!page.isBlank()) {
                    item = item.withSnippet((item.snippet() + " " + page).trim());
                }
            }
            out.add(item);
        }
        return out;
    }

    String fetchText(String url) {
        try {
            Document doc = Jsoup.connect(url)
                    .userAgent(USER_AGENT)
                    .timeout(timeoutMs)
                    .get();
            doc.select("script, style, header, footer, nav").remove();
            String text = TextCleaner.clean(doc.text());
            return text.length() > maxChars ? text.substring(0, maxChars) : text;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Skip page content {}: {}", url, e.getMessage());
            return "";
        }
    }
}
