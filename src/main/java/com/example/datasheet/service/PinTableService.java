package com.example.datasheet.service;

import com.example.datasheet.exception.DocumentNotFoundException;
import com.example.datasheet.util.document.DocumentFormat;
import com.example.datasheet.util.document.HtmlDocumentNormalizer;
import com.example.datasheet.util.table.CanonicalHeaders;
import com.example.datasheet.util.table.HeaderNormalizer;
import com.example.datasheet.util.table.HtmlTableDiscovery;
import com.example.datasheet.util.table.PdfTableDetector;
import com.example.datasheet.util.table.PdfTableDiscovery;
import com.example.datasheet.util.table.PinTableScorer;
import com.example.datasheet.util.table.TableSelector;
import com.example.datasheet.util.table.dto.RawTable;
import com.example.datasheet.util.table.feature.HeaderCountBonus;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 引脚表抽取服务
 *
 * 流程：表格发现 → 打分 → 选最高分 → 表头归一化。
 * 没有合格表格、最高分 ≤ 0 或格式不支持时返回只有规范表头的占位表。
 */
@Slf4j
@Service
public class PinTableService {

    private final HtmlDocumentNormalizer htmlNormalizer = new HtmlDocumentNormalizer();
    private final HtmlTableDiscovery htmlDiscovery = new HtmlTableDiscovery();
    private final PdfTableDetector tableDetector = new PdfTableDetector(PdfTableDetector.Mode.LATTICE_THEN_STREAM);
    private final PdfTableDiscovery pdfDiscovery = new PdfTableDiscovery();

    private final TableSelector selector;
    private final HeaderNormalizer headerNormalizer;
    private final int maxPages;

    @Autowired
    public PinTableService(ExtractionVocabulary vocabulary,
                           @Value("${datasheet.table.header-bonus-mode:FIRST_MATCH}") HeaderCountBonus.Mode bonusMode,
                           @Value("${datasheet.pdf.pin-table-max-pages:100}") int maxPages) {
        this.selector = new TableSelector(new PinTableScorer(vocabulary, bonusMode));
        this.headerNormalizer = new HeaderNormalizer(vocabulary.getHeaderRules());
        this.maxPages = maxPages;
    }

    /**
     * 抽取文档的引脚表
     *
     * @param path HTML 或 PDF 文件路径
     * @return 封装标签 → 归一化引脚表（目前只有 DEFAULT_PACKAGE 一项）
     * @throws DocumentNotFoundException 文件不存在
     * @throws IOException HTML 文件读取失败
     */
    public Map<String, List<List<String>>> extractPinTable(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new DocumentNotFoundException(path);
        }

        Map<String, List<List<String>>> result = new LinkedHashMap<>();
        DocumentFormat format = DocumentFormat.of(path);

        List<RawTable> tables;
        switch (format) {
            case HTML: {
                Document doc = htmlNormalizer.normalize(path).getTree().orElseThrow(IllegalStateException::new);
                tables = htmlDiscovery.discover(doc);
                break;
            }
            case PDF:
                tables = discoverPdf(path);
                break;
            default:
                log.info("不支持的格式，返回占位引脚表: {}", path);
                result.put(CanonicalHeaders.DEFAULT_PACKAGE, CanonicalHeaders.sentinelTable());
                return result;
        }

        log.info("发现 {} 张候选表格: {}", tables.size(), path);
        Optional<RawTable> best = selector.selectBest(tables);
        List<List<String>> pinTable = best.isPresent()
                ? headerNormalizer.normalize(best.get())
                : CanonicalHeaders.sentinelTable();
        if (!best.isPresent()) {
            log.info("未找到引脚表，返回占位表: {}", path);
        }

        result.put(CanonicalHeaders.DEFAULT_PACKAGE, pinTable);
        return result;
    }

    private List<RawTable> discoverPdf(Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            return pdfDiscovery.discover(tableDetector.detect(pdf, maxPages));
        } catch (IOException e) {
            log.warn("PDF 打开失败，按无表格处理: {} ({})", path, e.getMessage());
            return new ArrayList<>();
        }
    }
}
