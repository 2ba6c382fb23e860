package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.RawTable;
import com.example.datasheet.util.table.feature.HeaderCountBonus;
import com.example.datasheet.util.table.feature.TableFeature;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PinTableScorerTest {

    private final ExtractionVocabulary vocabulary = ExtractionVocabulary.loadDefault();
    private final PinTableScorer scorer = new PinTableScorer(vocabulary, HeaderCountBonus.Mode.FIRST_MATCH);

    private static RawTable table(List<String>... rows) {
        return RawTable.padded(Arrays.asList(rows));
    }

    @Test
    void breakdown_shouldSumAllFeatures() {
        RawTable pinTable = table(
                Arrays.asList("Pin", "Name", "Type", "Description"),
                Arrays.asList("1", "VDD", "Power", "Supply"),
                Arrays.asList("2", "GND", "Ground", "Ground"));

        Map<String, Integer> parts = scorer.breakdown(pinTable);

        assertThat(parts).containsEntry("strong_header_keyword", 20)
                .containsEntry("moderate_header_keyword", 30)
                .containsEntry("pin_like_first_column", 16)
                .containsEntry("electrical_header_penalty", 0)
                .containsEntry("data_row_volume", 4)
                .containsEntry("header_count_bonus", 15);
        assertThat(scorer.score(pinTable)).isEqualTo(85);
    }

    @Test
    void score_shouldBeZeroBelowThreeRows() {
        RawTable small = table(
                Arrays.asList("Pin", "Name", "Type"),
                Arrays.asList("1", "VDD", "Power"));

        assertThat(scorer.score(small)).isZero();
        assertThat(scorer.breakdown(small)).isEmpty();
    }

    @Test
    void score_shouldApplyElectricalPenaltyOnce() {
        RawTable twoHits = table(
                Arrays.asList("Parameter", "Min", "Foo"),
                Arrays.asList("a", "b", "c"),
                Arrays.asList("d", "e", "f"));
        RawTable manyHits = table(
                Arrays.asList("Parameter", "Min", "Typical", "Max", "Units"),
                Arrays.asList("a", "b", "c", "d", "e"),
                Arrays.asList("f", "g", "h", "i", "j"));

        assertThat(scorer.breakdown(twoHits)).containsEntry("electrical_header_penalty", -30);
        assertThat(scorer.breakdown(manyHits)).containsEntry("electrical_header_penalty", -30);
    }

    @Test
    void score_shouldNotPenalizeSingleElectricalHit() {
        RawTable oneHit = table(
                Arrays.asList("Parameter", "Foo", "Bar"),
                Arrays.asList("a", "b", "c"),
                Arrays.asList("d", "e", "f"));

        assertThat(scorer.breakdown(oneHit)).containsEntry("electrical_header_penalty", 0);
    }

    @Test
    void score_shouldNotDecreaseWhenPinKeywordAdded() {
        RawTable without = table(
                Arrays.asList("Number", "Label", "Notes"),
                Arrays.asList("x", "y", "z"),
                Arrays.asList("x", "y", "z"));
        RawTable with = table(
                Arrays.asList("Pin Number", "Label", "Notes"),
                Arrays.asList("x", "y", "z"),
                Arrays.asList("x", "y", "z"));

        assertThat(scorer.score(with)).isGreaterThan(scorer.score(without));
    }

    @Test
    void pinLikeFirstColumn_shouldSampleAtMostTenCells() {
        List<List<String>> rows = new ArrayList<>();
        rows.add(Arrays.asList("Ball", "Signal"));
        rows.add(Arrays.asList("", "skipped"));
        for (int i = 1; i <= 15; i++) {
            rows.add(Arrays.asList("A" + i, "S" + i));
        }

        Map<String, Integer> parts = scorer.breakdown(RawTable.padded(rows));

        assertThat(parts).containsEntry("pin_like_first_column", 80);
        assertThat(parts).containsEntry("data_row_volume", 32);
    }

    @Test
    void dataRowVolume_shouldBeCapped() {
        List<List<String>> rows = new ArrayList<>();
        rows.add(Arrays.asList("A", "B", "C"));
        for (int i = 0; i < 30; i++) {
            rows.add(Arrays.asList("x", "y", "z"));
        }

        assertThat(scorer.breakdown(RawTable.padded(rows))).containsEntry("data_row_volume", 40);
    }

    @Test
    void headerCountBonus_shouldDependOnMode() {
        RawTable wide = table(
                Arrays.asList("A", "B", "C", "D", "E", "F"),
                Arrays.asList("x", "x", "x", "x", "x", "x"),
                Arrays.asList("x", "x", "x", "x", "x", "x"));
        PinTableScorer corrected = new PinTableScorer(vocabulary, HeaderCountBonus.Mode.CORRECTED);

        assertThat(scorer.breakdown(wide)).containsEntry("header_count_bonus", 15);
        assertThat(corrected.breakdown(wide)).containsEntry("header_count_bonus", 25);
    }

    @Test
    void moderateKeywords_shouldCountEachHeaderKeywordPair() {
        RawTable table = table(
                Arrays.asList("Signal Name", "Type"),
                Arrays.asList("x", "y"),
                Arrays.asList("x", "y"));

        // "signal name" 命中 signal 和 name 两次
        assertThat(scorer.breakdown(table)).containsEntry("moderate_header_keyword", 30);
    }

    @Test
    void getFeatures_shouldKeepRegistrationOrder() {
        assertThat(scorer.getFeatures()).extracting(TableFeature::name).containsExactly(
                "strong_header_keyword",
                "moderate_header_keyword",
                "pin_like_first_column",
                "electrical_header_penalty",
                "data_row_volume",
                "header_count_bonus");
    }
}
