package com.example.datasheet;

import com.example.datasheet.service.PinTableService;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DatasheetServerApplicationTest {

    @Autowired
    private ExtractionVocabulary vocabulary;

    @Autowired
    private PinTableService pinTableService;

    @Test
    void contextLoads() {
        assertThat(vocabulary.getHeaderRules()).isNotEmpty();
        assertThat(pinTableService).isNotNull();
    }
}
