package com.imperium.searchinsight.content;

import java.util.List;

/**
 * 可插拔的增强 NLP 能力。缺失或出错时 {@link ContentProcessor} 退回朴素的空白分词与词频打分，
 * 输出结构不变，只是质量较低。
 */
public interface EnhancedSummarizer {

    /**
     * 分析后的词项（小写、去停用词），用于词频统计与关键词。
     */
    List<String> terms(String text);

    /**
     * 句子显著性权重，取值 [0, 1]。
     */
    float score(String text);
}
