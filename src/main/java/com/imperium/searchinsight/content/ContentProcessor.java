package com.imperium.searchinsight.content;

import com.imperium.searchinsight.model.ProcessedContent;
import com.imperium.searchinsight.model.RawItem;
import com.imperium.searchinsight.model.RawSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 清洗、抽取式摘要与关键词提取。
 * <p>
 * 摘要：按全文词频给候选句打分（有增强能力时再乘以其显著性权重），在长度预算内选取得分最高的句子，
 * 按原文顺序输出。关键词：词频最高的前 K 个词项，按频次、首次出现顺序排序并去重。
 * 没有结果条目时返回空内容而不是报错。
 */
@Component
public class ContentProcessor {

    private static final Logger log = LoggerFactory.getLogger(ContentProcessor.class);

    private static final Pattern NAIVE_SPLIT = Pattern.compile("\\s+");
    private static final Pattern TOKEN_EDGES = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");
    private static final int NAIVE_MIN_TOKEN_LENGTH = 3;

    @Nullable
    private final EnhancedSummarizer enhanced;

    private final int summaryMaxChars;
    private final int maxKeywords;

    public ContentProcessor(@Nullable EnhancedSummarizer enhanced,
                            @Value("${app.search.content.summary-max-chars:300}") int summaryMaxChars,
                            @Value("${app.search.content.max-keywords:5}") int maxKeywords) {
        this.enhanced = enhanced;
        this.summaryMaxChars = Math.max(40, summaryMaxChars);
        this.maxKeywords = Math.max(1, maxKeywords);
    }

    public boolean isEnhanced() {
        return enhanced != null;
    }

    public ProcessedContent process(RawSearchResult raw) {
        if (raw == null) {
            return ProcessedContent.empty();
        }
        List<String> snippets = new ArrayList<>();
        for (RawItem item : raw.items()) {
            String cleaned = TextCleaner.clean(item.snippet());
            if (!cleaned.isEmpty()) {
                snippets.add(cleaned);
            }
        }
        // 没有条目但有直接答案时，关键词从答案里取
        if (snippets.isEmpty() && raw.directAnswer() != null) {
            String cleaned = TextCleaner.clean(raw.directAnswer());
            if (!cleaned.isEmpty()) {
                snippets.add(cleaned);
            }
        }
        if (snippets.isEmpty()) {
            return ProcessedContent.empty();
        }

        String cleanedText = String.join(" ", snippets);
        Set<String> sentences = new LinkedHashSet<>();
        for (String s : snippets) {
            sentences.addAll(SentenceSplitter.split(s));
        }

        if (enhanced != null) {
            try {
                return build(cleanedText, new ArrayList<>(sentences), true);
            } catch (RuntimeException e) {
                log.warn("Enhanced NLP failed, using naive scoring: {}", e.getMessage());
            }
        }
        return build(cleanedText, new ArrayList<>(sentences), false);
    }

    private ProcessedContent build(String cleanedText, List<String> sentences, boolean useEnhanced) {
        Map<String, Integer> tf = termFrequencies(tokens(cleanedText, useEnhanced));
        String summary = summarize(sentences, tf, useEnhanced);
        return new ProcessedContent(cleanedText, summary, topKeywords(tf));
    }

    private List<String> tokens(String text, boolean useEnhanced) {
        if (useEnhanced && enhanced != null) {
            return enhanced.terms(text);
        }
        return naiveTokens(text);
    }

    static List<String> naiveTokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String raw : NAIVE_SPLIT.split(text.trim())) {
            String t = TOKEN_EDGES.matcher(raw).replaceAll("").toLowerCase(Locale.ROOT);
            if (t.length() >= NAIVE_MIN_TOKEN_LENGTH) {
                out.add(t);
            }
        }
        return out;
    }

    private static Map<String, Integer> termFrequencies(List<String> tokens) {
        Map<String, Integer> tf = new LinkedHashMap<>();
        for (String t : tokens) {
            tf.merge(t, 1, Integer::sum);
        }
        return tf;
    }

    private String summarize(List<String> sentences, Map<String, Integer> tf, boolean useEnhanced) {
        if (sentences.isEmpty()) {
            return "";
        }
        List<ScoredSentence> scored = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++) {
            String sentence = sentences.get(i);
            List<String> terms = tokens(sentence, useEnhanced);
            double score = 0;
            if (!terms.isEmpty()) {
                for (String t : terms) {
                    score += tf.getOrDefault(t, 0);
                }
                score /= Math.sqrt(terms.size());
                if (useEnhanced && enhanced != null) {
                    score *= 0.5 + enhanced.score(sentence);
                }
            }
            scored.add(new ScoredSentence(i, sentence, score));
        }

        List<ScoredSentence> ranked = new ArrayList<>(scored);
        ranked.sort(Comparator.comparingDouble(ScoredSentence::score).reversed()
                .thenComparingInt(ScoredSentence::index));

        List<ScoredSentence> selected = new ArrayList<>();
        int used = 0;
        for (ScoredSentence s : ranked) {
            int len = s.sentence().length() + (selected.isEmpty() ? 0 : 1);
            if (used + len <= summaryMaxChars) {
                selected.add(s);
                used += len;
            }
        }
        if (selected.isEmpty()) {
            return SentenceSplitter.truncate(ranked.get(0).sentence(), summaryMaxChars);
        }
        selected.sort(Comparator.comparingInt(ScoredSentence::index));
        StringBuilder sb = new StringBuilder();
        for (ScoredSentence s : selected) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(s.sentence());
        }
        return sb.toString();
    }

    private List<String> topKeywords(Map<String, Integer> tf) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(tf.entrySet());
        // 稳定排序：同频次保持首次出现顺序
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        List<String> keywords = new ArrayList<>(maxKeywords);
        for (Map.Entry<String, Integer> e : entries) {
            if (keywords.size() >= maxKeywords) break;
            keywords.add(e.getKey());
        }
        return keywords;
    }

    private record ScoredSentence(int index, String sentence, double score) {
    }
}
