package com.imperium.searchinsight.model;

import java.util.List;

/**
 * ContentProcessor 输出：清洗后的全文、抽取式摘要、关键词（有序、去重）。
 */
public record ProcessedContent(String cleanedText, String summary, List<String> keywords) {

    public ProcessedContent {
        cleanedText = cleanedText != null ? cleanedText : "";
        summary = summary != null ? summary : "";
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    public static ProcessedContent empty() {
        return new ProcessedContent("", "", List.of());
    }
}
