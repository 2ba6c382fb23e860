package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.RawTable;
import com.example.datasheet.util.vocabulary.HeaderRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 表头归一化
 *
 * 每个表头单元格独立按规则顺序匹配，第一条命中的规则给出规范列名；
 * 都不命中时保留原文。数据行原样保留。
 */
public class HeaderNormalizer {

    private final List<HeaderRule> rules;

    public HeaderNormalizer(List<HeaderRule> rules) {
        this.rules = rules;
    }

    public String normalizeHeader(String header) {
        String lower = header.toLowerCase(Locale.ROOT).trim();
        for (HeaderRule rule : rules) {
            if (rule.matches(lower)) {
                return rule.getLabel();
            }
        }
        return header;
    }

    public List<List<String>> normalize(RawTable table) {
        if (table == null || table.getRowCount() == 0) {
            return CanonicalHeaders.sentinelTable();
        }

        List<List<String>> result = new ArrayList<>(table.getRowCount());
        List<String> headers = new ArrayList<>();
        for (String header : table.getHeader()) {
            headers.add(normalizeHeader(header));
        }
        result.add(headers);
        for (List<String> row : table.getDataRows()) {
            result.add(new ArrayList<>(row));
        }
        return result;
    }
}
