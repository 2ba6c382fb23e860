package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.DetectedTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;

// Tabula imports
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.BasicExtractionAlgorithm;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Tabula 的 PDF 表格检测
 *
 * 两种策略：
 * - LATTICE_THEN_STREAM：先 lattice（有线框），无结果再 stream（无线框兜底）
 * - LATTICE_AND_STREAM：两种算法都跑，结果依次追加
 *
 * 单页/单表失败只记录日志并跳过，不中断整份文档。
 * PDDocument 的生命周期由调用方负责。
 */
@Slf4j
public class PdfTableDetector {

    public enum Mode {
        LATTICE_THEN_STREAM,
        LATTICE_AND_STREAM
    }

    private final Mode mode;

    public PdfTableDetector(Mode mode) {
        this.mode = mode;
    }

    /**
     * 检测前 maxPages 页上的所有表格
     */
    public List<DetectedTable> detect(PDDocument doc, int maxPages) {
        int pageCount = Math.min(doc.getNumberOfPages(), maxPages);
        return detect(new ObjectExtractor(doc), pageCount);
    }

    /**
     * 检测第 1..pageCount 页上的所有表格
     */
    List<DetectedTable> detect(ObjectExtractor oe, int pageCount) {
        List<DetectedTable> tables = new ArrayList<>();
        for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
            tables.addAll(detectPage(oe, pageNumber));
        }

        log.debug("[Tabula] 共检测到 {} 个表格（{} 页，mode={}）", tables.size(), pageCount, mode);
        return tables;
    }

    private List<DetectedTable> detectPage(ObjectExtractor oe, int pageNumber) {
        List<DetectedTable> tables = new ArrayList<>();

        Page page;
        try {
            page = oe.extract(pageNumber);
        } catch (Exception e) {
            log.warn("[Tabula] 第 {} 页解析失败，已跳过: {}", pageNumber, e.getMessage());
            return tables;
        }

        // 1. lattice
        List<Table> lattice = runAlgorithm("lattice", page, pageNumber);
        convertAll(lattice, pageNumber, "lattice", tables);

        // 2. stream：兜底或追加
        if (mode == Mode.LATTICE_AND_STREAM || lattice.isEmpty()) {
            List<Table> stream = runAlgorithm("stream", page, pageNumber);
            convertAll(stream, pageNumber, "stream", tables);
        }
        return tables;
    }

    private List<Table> runAlgorithm(String algorithm, Page page, int pageNumber) {
        try {
            List<Table> result = "lattice".equals(algorithm)
                    ? new SpreadsheetExtractionAlgorithm().extract(page)
                    : new BasicExtractionAlgorithm().extract(page);
            log.debug("[Tabula] 第 {} 页 {} 提取到 {} 个表格", pageNumber, algorithm, result.size());
            return result;
        } catch (Exception e) {
            log.warn("[Tabula] 第 {} 页 {} 提取失败: {}", pageNumber, algorithm, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void convertAll(List<Table> source, int pageNumber, String algorithm, List<DetectedTable> out) {
        for (Table tabulaTable : source) {
            try {
                out.add(convert(tabulaTable, pageNumber, algorithm));
            } catch (Exception e) {
                log.warn("[Tabula] 第 {} 页表格转换失败，已跳过: {}", pageNumber, e.getMessage());
            }
        }
    }

    /**
     * 将 Tabula 的 Table 转换为字符串行
     */
    @SuppressWarnings("rawtypes")
    private static DetectedTable convert(Table tabulaTable, int pageNumber, String algorithm) {
        List<List<String>> rows = new ArrayList<>();
        for (List<RectangularTextContainer> tabulaRow : tabulaTable.getRows()) {
            List<String> row = new ArrayList<>(tabulaRow.size());
            for (RectangularTextContainer cell : tabulaRow) {
                String text = cell.getText();
                row.add(text == null ? "" : text);
            }
            rows.add(row);
        }
        return new DetectedTable(pageNumber, algorithm, rows);
    }
}
