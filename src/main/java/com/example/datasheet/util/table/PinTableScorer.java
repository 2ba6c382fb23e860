package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.RawTable;
import com.example.datasheet.util.table.feature.DataRowVolume;
import com.example.datasheet.util.table.feature.ElectricalHeaderPenalty;
import com.example.datasheet.util.table.feature.HeaderCountBonus;
import com.example.datasheet.util.table.feature.HeaderKeywordFeature;
import com.example.datasheet.util.table.feature.PinLikeFirstColumn;
import com.example.datasheet.util.table.feature.TableFeature;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 引脚表可能性打分器
 *
 * score = Σ feature_i(table)，分越高越像引脚表。
 * 少于 3 行（表头 + 2 行数据）的表直接记 0 分。
 */
public class PinTableScorer {

    public static final int MIN_ROWS = 3;

    private final List<TableFeature> features;

    public PinTableScorer(ExtractionVocabulary vocabulary, HeaderCountBonus.Mode bonusMode) {
        List<TableFeature> list = new ArrayList<>();

        // 注册所有特征
        list.add(HeaderKeywordFeature.strong(vocabulary.getStrongHeaderKeywords()));
        list.add(HeaderKeywordFeature.moderate(vocabulary.getModerateHeaderKeywords()));
        list.add(new PinLikeFirstColumn(vocabulary.getSupplyMnemonics()));
        list.add(new ElectricalHeaderPenalty(vocabulary.getElectricalHeaderKeywords()));
        list.add(new DataRowVolume());
        list.add(new HeaderCountBonus(bonusMode));

        this.features = Collections.unmodifiableList(list);
    }

    public int score(RawTable table) {
        int total = 0;
        for (int value : breakdown(table).values()) {
            total += value;
        }
        return total;
    }

    /**
     * 分项得分（按特征注册顺序）；少于 3 行时为空
     */
    public Map<String, Integer> breakdown(RawTable table) {
        Map<String, Integer> parts = new LinkedHashMap<>();
        if (table == null || table.getRowCount() < MIN_ROWS) {
            return parts;
        }

        List<String> headers = new ArrayList<>();
        for (String header : table.getHeader()) {
            headers.add(header.toLowerCase(Locale.ROOT));
        }

        for (TableFeature feature : features) {
            parts.merge(feature.name(), feature.score(table, headers), Integer::sum);
        }
        return parts;
    }

    public List<TableFeature> getFeatures() {
        return features;
    }
}
