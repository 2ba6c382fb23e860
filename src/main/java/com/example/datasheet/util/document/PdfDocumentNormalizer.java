package com.example.datasheet.util.document;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * PDF 文档归一化
 *
 * 文本来源：
 * 1. 文档信息字典中所有字符串值 → metadata
 * 2. 前 maxPages 页逐页提取文本：
 *    - 第 1 页前 200 个字符作为 title
 *    - 每页前 10 行中长度在 (0, 120) 的行作为 headings
 *    - 各页文本以空格拼接作为 body
 *
 * 单页提取失败只记录日志并按空文本处理，不影响其他页。
 * PDDocument 的生命周期由调用方负责。
 */
@Slf4j
public class PdfDocumentNormalizer {

    private static final int TITLE_LENGTH = 200;
    private static final int HEADING_LINES_PER_PAGE = 10;
    private static final int HEADING_MAX_LENGTH = 120;

    /** 首尾的 Unicode 空白（含 NBSP） */
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    public DocumentBits normalize(PDDocument doc, int maxPages) {
        List<String> metadata = readMetadata(doc);

        String title = "";
        List<String> headings = new ArrayList<>();
        List<String> bodyParts = new ArrayList<>();

        int pageCount = Math.min(doc.getNumberOfPages(), maxPages);
        for (int i = 0; i < pageCount; i++) {
            String text = extractPageText(doc, i);

            if (i == 0 && title.isEmpty()) {
                title = strip(text.substring(0, Math.min(TITLE_LENGTH, text.length())));
            }

            String[] lines = text.split("\\R");
            for (int j = 0; j < lines.length && j < HEADING_LINES_PER_PAGE; j++) {
                String line = strip(lines[j]);
                if (!line.isEmpty() && line.length() < HEADING_MAX_LENGTH) {
                    headings.add(line);
                }
            }
            bodyParts.add(text);
        }

        DocumentBits bits = new DocumentBits(title, headings, metadata, String.join(" ", bodyParts), null);
        log.debug("PDF 归一化完成: pages={}, {}", pageCount, bits);
        return bits;
    }

    static String strip(String text) {
        return EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    private List<String> readMetadata(PDDocument doc) {
        List<String> metadata = new ArrayList<>();
        try {
            PDDocumentInformation info = doc.getDocumentInformation();
            if (info == null) {
                return metadata;
            }
            for (String key : info.getMetadataKeys()) {
                // 非字符串值（数字、布尔）返回 null
                String value = info.getCustomMetadataValue(key);
                if (value != null && !value.isEmpty()) {
                    metadata.add(value.trim());
                }
            }
        } catch (Exception e) {
            log.warn("读取 PDF 文档信息失败: {}", e.getMessage());
        }
        return metadata;
    }

    /**
     * @param pageIndex 从 0 开始的页索引
     */
    private String extractPageText(PDDocument doc, int pageIndex) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            String text = stripper.getText(doc);
            return text == null ? "" : text;
        } catch (Exception e) {
            log.warn("第 {} 页文本提取失败，已跳过: {}", pageIndex + 1, e.getMessage());
            return "";
        }
    }
}
