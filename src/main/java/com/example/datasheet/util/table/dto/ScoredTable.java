package com.example.datasheet.util.table.dto;

/**
 * 打过分的表格
 */
public class ScoredTable {

    private final int score;
    private final RawTable table;

    public ScoredTable(int score, RawTable table) {
        this.score = score;
        this.table = table;
    }

    public int getScore() { return score; }
    public RawTable getTable() { return table; }

    @Override
    public String toString() {
        return "ScoredTable{score=" + score + ", table=" + table + "}";
    }
}
