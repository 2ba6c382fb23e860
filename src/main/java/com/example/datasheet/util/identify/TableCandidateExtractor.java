package com.example.datasheet.util.identify;

import com.example.datasheet.util.document.DocumentOrder;
import com.example.datasheet.util.document.HtmlDocumentNormalizer;
import com.example.datasheet.util.table.dto.DetectedTable;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 表格来源的候选抽取
 *
 * 每张表都会被扫描（不以相关性为前提）：
 * - 有表头单元格匹配订购信息模式时，只扫描这些列
 * - 否则扫描所有列
 * 标题/前置标题的相关性信号只用于日志。
 */
@Slf4j
public class TableCandidateExtractor {

    /**
     * 相关性信号，按判断顺序排列
     */
    public enum RelevanceSignal {
        /** 表头单元格匹配 */
        HEADER,
        /** caption 匹配 */
        CAPTION,
        /** 最近的前置 h1-h4 匹配 */
        PRECEDING_HEADING
    }

    private final TokenClassifier classifier;
    private final Pattern orderingPattern;

    public TableCandidateExtractor(TokenClassifier classifier, Pattern orderingPattern) {
        this.classifier = classifier;
        this.orderingPattern = orderingPattern;
    }

    // ========== HTML ==========

    public List<String> extractFromHtml(Document doc) {
        Set<String> parts = new LinkedHashSet<>();

        for (Element table : doc.getElementsByTag("table")) {
            List<String> headers = headerCells(table);
            boolean[] headerFlags = flagHeaders(headers);

            // 相关性只用于日志，前置标题查找要回溯整个文档
            if (log.isDebugEnabled()) {
                log.debug("表格相关性: headers={}, signals={}", headers, relevanceSignals(table, headerFlags));
            }

            Elements rows = table.select("tr");
            for (int r = 1; r < rows.size(); r++) {
                List<String> cells = new ArrayList<>();
                for (Element cell : rows.get(r).select("td, th")) {
                    cells.add(cell.text());
                }
                scanRow(cells, headerFlags, parts);
            }
        }
        return new ArrayList<>(parts);
    }

    /**
     * 表头：优先 thead 的第一行，否则表格第一行
     */
    private static List<String> headerCells(Element table) {
        List<String> headers = new ArrayList<>();
        Element thead = table.selectFirst("thead");
        if (thead != null) {
            Element first = thead.selectFirst("tr");
            if (first != null) {
                for (Element cell : first.select("th, td")) {
                    headers.add(cell.text());
                }
            }
        }
        if (headers.isEmpty()) {
            Element first = table.selectFirst("tr");
            if (first != null) {
                for (Element cell : first.select("th, td")) {
                    headers.add(cell.text());
                }
            }
        }
        return headers;
    }

    private Set<RelevanceSignal> relevanceSignals(Element table, boolean[] headerFlags) {
        Set<RelevanceSignal> signals = EnumSet.noneOf(RelevanceSignal.class);
        for (RelevanceSignal signal : RelevanceSignal.values()) {
            if (fires(signal, table, headerFlags)) {
                signals.add(signal);
            }
        }
        return signals;
    }

    private boolean fires(RelevanceSignal signal, Element table, boolean[] headerFlags) {
        switch (signal) {
            case HEADER:
                return anyFlag(headerFlags);
            case CAPTION:
                Element caption = table.selectFirst("caption");
                return caption != null && orderingPattern.matcher(caption.text()).find();
            case PRECEDING_HEADING:
                Element heading = DocumentOrder.findPrevious(table, HtmlDocumentNormalizer.HEADING_TAGS);
                return heading != null && orderingPattern.matcher(heading.text()).find();
            default:
                return false;
        }
    }

    // ========== PDF ==========

    /**
     * 对检测到的每张 PDF 表，以第一行为表头做同样的扫描
     */
    public List<String> extractFromPdf(List<DetectedTable> tables) {
        Set<String> parts = new LinkedHashSet<>();
        for (DetectedTable table : tables) {
            List<List<String>> rows = table.getRows();
            if (rows.isEmpty()) {
                continue;
            }
            boolean[] headerFlags = flagHeaders(rows.get(0));
            for (int r = 1; r < rows.size(); r++) {
                scanRow(rows.get(r), headerFlags, parts);
            }
        }
        return new ArrayList<>(parts);
    }

    // ========== 公共 ==========

    private boolean[] flagHeaders(List<String> headers) {
        boolean[] flags = new boolean[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            flags[i] = header != null && orderingPattern.matcher(header).find();
        }
        return flags;
    }

    private void scanRow(List<String> cells, boolean[] headerFlags, Set<String> parts) {
        boolean restricted = anyFlag(headerFlags);
        int limit = restricted ? headerFlags.length : cells.size();
        for (int idx = 0; idx < limit; idx++) {
            if (restricted && !headerFlags[idx]) {
                continue;
            }
            if (idx >= cells.size()) {
                continue;
            }
            parts.addAll(classifier.acceptedTokens(cells.get(idx)));
        }
    }

    private static boolean anyFlag(boolean[] flags) {
        for (boolean flag : flags) {
            if (flag) {
                return true;
            }
        }
        return false;
    }
}
