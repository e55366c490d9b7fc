package com.imperium.searchinsight.assembler;

import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.ProcessedContent;
import com.imperium.searchinsight.model.RawItem;
import com.imperium.searchinsight.model.RawSearchResult;
import com.imperium.searchinsight.model.SearchInsight;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * 组装最终结果：有直接答案时用作摘要；否则用抽取式摘要和第一条结果的标题、链接；
 * 两者都没有时返回显式的“无结果”，字段不缺省。
 */
@Component
public class ResultAssembler {

    public static final String NO_RESULTS_TITLE = "No results found";
    public static final String NO_RESULTS_SUMMARY = "No good answer found.";
    public static final String DIRECT_ANSWER_TITLE = "Direct answer";
    public static final String DEGRADED_TITLE = "Search unavailable";

    public SearchInsight assemble(RawSearchResult raw, ProcessedContent processed, InsightSource source) {
        RawSearchResult result = raw != null ? raw : RawSearchResult.empty();
        ProcessedContent content = processed != null ? processed : ProcessedContent.empty();
        RawItem first = result.items().isEmpty() ? null : result.items().get(0);

        if (result.directAnswer() != null) {
            return SearchInsight.builder()
                    .title(first != null && !first.title().isEmpty() ? first.title() : DIRECT_ANSWER_TITLE)
                    .summary(result.directAnswer())
                    .keywords(new ArrayList<>(content.keywords()))
                    .url(first != null ? first.url() : "")
                    .directAnswer(result.directAnswer())
                    .source(source)
                    .results(new ArrayList<>(result.items()))
                    .build();
        }

        if (first != null) {
            String summary = !content.summary().isEmpty() ? content.summary() : first.snippet();
            return SearchInsight.builder()
                    .title(first.title())
                    .summary(summary.isEmpty() ? NO_RESULTS_SUMMARY : summary)
                    .keywords(new ArrayList<>(content.keywords()))
                    .url(first.url())
                    .source(source)
                    .results(new ArrayList<>(result.items()))
                    .build();
        }

        return SearchInsight.builder()
                .title(NO_RESULTS_TITLE)
                .summary(NO_RESULTS_SUMMARY)
                .keywords(new ArrayList<>())
                .url("")
                .source(source)
                .results(new ArrayList<>())
                .build();
    }

    /**
     * 所有数据源都失败且没有可用缓存时的最小结果：摘要与关键词为空。
     */
    public SearchInsight degraded() {
        return SearchInsight.builder()
                .title(DEGRADED_TITLE)
                .summary("")
                .keywords(new ArrayList<>())
                .url("")
                .source(InsightSource.DEGRADED)
                .results(new ArrayList<>())
                .build();
    }
}
