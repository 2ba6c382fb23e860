package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.DetectedTable;
import com.example.datasheet.util.table.dto.RawTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * PDF 表格清洗与过滤
 *
 * 规则：
 * 1. 原始行数 < 3 的表直接丢弃
 * 2. 单元格空白归一化（连续空白合并为一个空格）
 * 3. 非空单元格 ≥ 2 的行才保留
 * 4. 保留行数 ≥ 3 且最大列数 ≥ 3 的表按最大列数补齐
 */
@Slf4j
public class PdfTableDiscovery {

    public static final int MIN_ROWS = 3;
    public static final int MIN_COLUMNS = 3;
    public static final int MIN_FILLED_CELLS = 2;

    /** 含 NBSP 等 Unicode 空白 */
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public List<RawTable> discover(List<DetectedTable> detected) {
        List<RawTable> tables = new ArrayList<>();
        for (DetectedTable table : detected) {
            try {
                RawTable cleaned = clean(table);
                if (cleaned != null) {
                    tables.add(cleaned);
                }
            } catch (Exception e) {
                log.warn("第 {} 页表格清洗失败，已跳过: {}", table.getPageNumber(), e.getMessage());
            }
        }
        return tables;
    }

    RawTable clean(DetectedTable table) {
        if (table.getRows().size() < MIN_ROWS) {
            return null;
        }

        List<List<String>> rows = new ArrayList<>();
        for (List<String> row : table.getRows()) {
            if (row == null || row.isEmpty()) {
                continue;
            }
            List<String> cleanRow = new ArrayList<>(row.size());
            int filled = 0;
            for (String cell : row) {
                String text = normalizeWhitespace(cell);
                cleanRow.add(text);
                if (!text.isEmpty()) {
                    filled++;
                }
            }
            if (filled >= MIN_FILLED_CELLS) {
                rows.add(cleanRow);
            }
        }

        if (rows.size() < MIN_ROWS) {
            return null;
        }
        RawTable padded = RawTable.padded(rows);
        return padded.getColumnCount() >= MIN_COLUMNS ? padded : null;
    }

    static String normalizeWhitespace(String cell) {
        if (cell == null) {
            return "";
        }
        return WHITESPACE.matcher(cell).replaceAll(" ").trim();
    }
}
