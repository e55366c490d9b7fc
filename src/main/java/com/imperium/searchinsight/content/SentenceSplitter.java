package com.imperium.searchinsight.content;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 句子切分与按词边界截断，供抽取式摘要使用。
 */
public final class SentenceSplitter {

    /** 句子结束符（中英文）：句号、问号、感叹号等后的空白或换行作为切分点 */
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[。！？.!?])\\s+|\\n+");

    private static final String ELLIPSIS = "...";

    /**
     * 按句末标点和换行切分，保留尾部标点；没有句末标点时整段作为一句。
     */
    public static List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> list = new ArrayList<>();
        for (String s : SENTENCE_END.split(text.replace("\r\n", "\n").replace("\r", "\n").trim())) {
            String t = s.replace("\n", " ").trim();
            if (!t.isEmpty()) {
                list.add(t);
            }
        }
        return list;
    }

    /**
     * 超过 maxChars 时在最近的空格处截断并追加省略号，结果长度不超过 maxChars。
     */
    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        int limit = Math.max(0, maxChars - ELLIPSIS.length());
        int end = limit;
        int lastSpace = text.lastIndexOf(' ', limit);
        if (lastSpace > 0) {
            end = lastSpace;
        }
        return text.substring(0, end).trim() + ELLIPSIS;
    }

    private SentenceSplitter() {}
}
