package com.example.datasheet.util.table.feature;

import com.example.datasheet.util.table.dto.RawTable;

import java.util.List;

/**
 * 电气特性表惩罚：表头中 min/max/typical/units/conditions/parameter 命中 ≥ 2 次时扣 30 分（每表最多一次）
 */
public class ElectricalHeaderPenalty implements TableFeature {

    public static final int PENALTY = -30;
    public static final int THRESHOLD = 2;

    private final List<String> keywords;

    public ElectricalHeaderPenalty(List<String> keywords) {
        this.keywords = keywords;
    }

    @Override
    public String name() {
        return "electrical_header_penalty";
    }

    @Override
    public int score(RawTable table, List<String> headers) {
        return HeaderKeywordFeature.countMatches(headers, keywords) >= THRESHOLD ? PENALTY : 0;
    }
}
