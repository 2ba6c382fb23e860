package com.example.datasheet.util.table.feature;

import com.example.datasheet.util.table.dto.RawTable;

import java.util.List;

/**
 * 表头关键词加分：每个（表头单元格, 关键词）命中加 points
 */
public class HeaderKeywordFeature implements TableFeature {

    public static final int STRONG_POINTS = 20;
    public static final int MODERATE_POINTS = 10;

    private final String name;
    private final List<String> keywords;
    private final int points;

    public HeaderKeywordFeature(String name, List<String> keywords, int points) {
        this.name = name;
        this.keywords = keywords;
        this.points = points;
    }

    /** pin / ball / terminal */
    public static HeaderKeywordFeature strong(List<String> keywords) {
        return new HeaderKeywordFeature("strong_header_keyword", keywords, STRONG_POINTS);
    }

    /** signal / function / description / type / direction / name */
    public static HeaderKeywordFeature moderate(List<String> keywords) {
        return new HeaderKeywordFeature("moderate_header_keyword", keywords, MODERATE_POINTS);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int score(RawTable table, List<String> headers) {
        return points * countMatches(headers, keywords);
    }

    static int countMatches(List<String> headers, List<String> keywords) {
        int count = 0;
        for (String header : headers) {
            for (String keyword : keywords) {
                if (header.contains(keyword)) {
                    count++;
                }
            }
        }
        return count;
    }
}
