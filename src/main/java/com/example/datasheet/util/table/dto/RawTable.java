package com.example.datasheet.util.table.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 行列补齐后的表格
 *
 * 第 0 行是表头；所有行补空串或截断到同一列数（各行最大列数）。
 */
public class RawTable {

    private final List<List<String>> rows;
    private final int columnCount;

    private RawTable(List<List<String>> rows, int columnCount) {
        this.rows = rows;
        this.columnCount = columnCount;
    }

    /**
     * 以各行最大列数补齐
     */
    public static RawTable padded(List<List<String>> rows) {
        int maxCols = 0;
        for (List<String> row : rows) {
            maxCols = Math.max(maxCols, row.size());
        }
        List<List<String>> normalized = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(maxCols);
            for (int c = 0; c < maxCols; c++) {
                cells.add(c < row.size() && row.get(c) != null ? row.get(c) : "");
            }
            normalized.add(Collections.unmodifiableList(cells));
        }
        return new RawTable(Collections.unmodifiableList(normalized), maxCols);
    }

    public List<List<String>> getRows() { return rows; }

    public int getRowCount() { return rows.size(); }

    public int getColumnCount() { return columnCount; }

    /** 表头行；空表返回空列表 */
    public List<String> getHeader() {
        return rows.isEmpty() ? Collections.<String>emptyList() : rows.get(0);
    }

    /** 数据行（不含表头） */
    public List<List<String>> getDataRows() {
        return rows.size() <= 1 ? Collections.<List<String>>emptyList() : rows.subList(1, rows.size());
    }

    @Override
    public String toString() {
        return "RawTable{" + rows.size() + " 行 × " + columnCount + " 列}";
    }
}
