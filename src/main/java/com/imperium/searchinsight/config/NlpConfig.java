package com.imperium.searchinsight.config;

import com.imperium.searchinsight.content.EnhancedSummarizer;
import com.imperium.searchinsight.content.LuceneEnhancedSummarizer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 增强 NLP 能力。关闭时不注册 bean，ContentProcessor 使用朴素分词。
 */
@Configuration
public class NlpConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.search.nlp", name = "enhanced-enabled", havingValue = "true", matchIfMissing = true)
    public EnhancedSummarizer enhancedSummarizer() {
        return new LuceneEnhancedSummarizer(new StandardAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET));
    }
}
