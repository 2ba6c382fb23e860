package com.example.datasheet.util.table.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PDF 页面上检测到的原始表格（未补齐、未清洗）
 */
public class DetectedTable {

    /** 页码（从 1 开始） */
    private final int pageNumber;

    /** 检测算法：lattice / stream */
    private final String algorithm;

    private final List<List<String>> rows;

    public DetectedTable(int pageNumber, String algorithm, List<List<String>> rows) {
        this.pageNumber = pageNumber;
        this.algorithm = algorithm;
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public int getPageNumber() { return pageNumber; }
    public String getAlgorithm() { return algorithm; }
    public List<List<String>> getRows() { return rows; }

    @Override
    public String toString() {
        return "DetectedTable{page=" + pageNumber + ", algorithm=" + algorithm + ", rows=" + rows.size() + "}";
    }
}
