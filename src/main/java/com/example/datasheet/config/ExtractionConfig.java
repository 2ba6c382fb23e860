package com.example.datasheet.config;

import com.example.datasheet.util.identify.TokenClassifier;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 抽取词表与标识符判定器
 */
@Slf4j
@Configuration
public class ExtractionConfig {

    @Value("${datasheet.vocabulary-path:}")
    private String vocabularyPath;

    @Bean
    public ExtractionVocabulary extractionVocabulary() {
        ExtractionVocabulary vocabulary = vocabularyPath == null || vocabularyPath.trim().isEmpty()
                ? ExtractionVocabulary.loadDefault()
                : ExtractionVocabulary.loadFromJson(vocabularyPath.trim());
        log.info("抽取词表已加载: {}", vocabulary);
        return vocabulary;
    }

    @Bean
    public TokenClassifier tokenClassifier(ExtractionVocabulary extractionVocabulary) {
        return new TokenClassifier(extractionVocabulary);
    }
}
