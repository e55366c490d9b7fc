package com.imperium.searchinsight.content;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Lucene Analyzer 的增强实现：Unicode 分词、小写化、去英文停用词。
 * score 为词汇密度（实词数 / 原始词数），功能词越多的句子权重越低。
 */
public class LuceneEnhancedSummarizer implements EnhancedSummarizer, AutoCloseable {

    private static final String FIELD = "content";

    private final Analyzer analyzer;

    public LuceneEnhancedSummarizer(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public List<String> terms(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        try (TokenStream ts = analyzer.tokenStream(FIELD, text)) {
            CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                String t = term.toString();
                if (t.length() >= 2) {
                    out.add(t);
                }
            }
            ts.end();
        } catch (IOException e) {
            throw new UncheckedIOException("token analysis failed", e);
        }
        return out;
    }

    @Override
    public float score(String text) {
        if (text == null || text.isBlank()) {
            return 0f;
        }
        int raw = text.trim().split("\\s+").length;
        int content = terms(text).size();
        return Math.min(1f, content / (float) raw);
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
