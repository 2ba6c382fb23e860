package com.example.datasheet.service;

import com.example.datasheet.exception.DocumentNotFoundException;
import com.example.datasheet.exception.UnsupportedFormatException;
import com.example.datasheet.util.document.DocumentBits;
import com.example.datasheet.util.document.DocumentFormat;
import com.example.datasheet.util.document.HtmlDocumentNormalizer;
import com.example.datasheet.util.document.PdfDocumentNormalizer;
import com.example.datasheet.util.identify.CandidateMerger;
import com.example.datasheet.util.identify.CandidateScorer;
import com.example.datasheet.util.identify.OrderingSectionExtractor;
import com.example.datasheet.util.identify.PackageExtractor;
import com.example.datasheet.util.identify.PathCandidateExtractor;
import com.example.datasheet.util.identify.TableCandidateExtractor;
import com.example.datasheet.util.identify.TokenClassifier;
import com.example.datasheet.util.identify.VendorCodeExtractor;
import com.example.datasheet.util.identify.dto.IdentifyResult;
import com.example.datasheet.util.table.PdfTableDetector;
import com.example.datasheet.util.table.dto.DetectedTable;
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
import java.util.List;

/**
 * 器件识别服务
 *
 * 识别流程：
 * 1. 文档归一化（HTML / PDF → DocumentBits）
 * 2. 各来源独立抽取候选：
 *    - 路径（父目录名、文件名）
 *    - 表格（订购信息列优先）
 *    - 订购信息章节（仅 HTML）
 *    - 厂商代码
 *    - 词频打分
 * 3. 按上述优先级合并去重，第一个为主标识符
 * 4. 封装代码独立抽取
 *
 * 无状态，可多线程并发调用。
 */
@Slf4j
@Service
public class DatasheetIdentifyService {

    private final HtmlDocumentNormalizer htmlNormalizer = new HtmlDocumentNormalizer();
    private final PdfDocumentNormalizer pdfNormalizer = new PdfDocumentNormalizer();
    private final PdfTableDetector tableDetector = new PdfTableDetector(PdfTableDetector.Mode.LATTICE_AND_STREAM);

    private final PathCandidateExtractor pathExtractor;
    private final TableCandidateExtractor tableExtractor;
    private final OrderingSectionExtractor orderingExtractor;
    private final VendorCodeExtractor vendorExtractor;
    private final CandidateScorer scorer;
    private final PackageExtractor packageExtractor;

    private final int maxPages;

    @Autowired
    public DatasheetIdentifyService(ExtractionVocabulary vocabulary,
                                    TokenClassifier classifier,
                                    @Value("${datasheet.pdf.identify-max-pages:10}") int maxPages,
                                    @Value("${datasheet.ordering.max-steps:50}") int maxSteps) {
        this.pathExtractor = new PathCandidateExtractor(vocabulary.getFormatReject());
        this.tableExtractor = new TableCandidateExtractor(classifier, vocabulary.getOrderingHeaderPattern());
        this.orderingExtractor = new OrderingSectionExtractor(classifier, vocabulary.getOrderingHeaderPattern(), maxSteps);
        this.vendorExtractor = new VendorCodeExtractor(vocabulary.getVendorLiteralPattern());
        this.scorer = new CandidateScorer(classifier);
        this.packageExtractor = new PackageExtractor(vocabulary);
        this.maxPages = maxPages;
    }

    /**
     * 识别文档的器件标识符、候选列表和封装代码
     *
     * @param path HTML 或 PDF 文件路径
     * @return 识别结果；没有候选时 primaryIdentifier 为 null
     * @throws DocumentNotFoundException 文件不存在
     * @throws UnsupportedFormatException 扩展名不是 .html/.htm/.pdf
     * @throws IOException HTML 文件读取失败
     */
    public IdentifyResult identify(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new DocumentNotFoundException(path);
        }

        DocumentFormat format = DocumentFormat.of(path);
        log.info("开始识别: {} (format={})", path, format);

        DocumentBits bits;
        List<String> sourceParts = new ArrayList<>();

        switch (format) {
            case HTML: {
                bits = htmlNormalizer.normalize(path);
                Document doc = bits.getTree().orElseThrow(IllegalStateException::new);
                sourceParts.addAll(tableExtractor.extractFromHtml(doc));
                sourceParts.addAll(orderingExtractor.extract(doc));
                sourceParts.addAll(vendorExtractor.extract(bits.contentText()));
                break;
            }
            case PDF: {
                List<DetectedTable> detected = new ArrayList<>();
                bits = readPdf(path, detected);
                sourceParts.addAll(tableExtractor.extractFromPdf(detected));
                sourceParts.addAll(vendorExtractor.extract(bits.contentText()));
                break;
            }
            default:
                throw new UnsupportedFormatException(path);
        }

        CandidateMerger merger = new CandidateMerger()
                .append(pathExtractor.extract(path))
                .append(sourceParts)
                .append(scorer.rank(bits));

        IdentifyResult result = new IdentifyResult(
                path.toString(), merger.primary(), merger.candidates(), packageExtractor.extract(bits));
        log.info("识别完成: {}", result);
        return result;
    }

    /**
     * 打开 PDF，提取文本块并检测表格；文档无法打开时按空文档处理
     *
     * @param detected 输出参数，接收检测到的表格
     */
    private DocumentBits readPdf(Path path, List<DetectedTable> detected) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            DocumentBits bits = pdfNormalizer.normalize(pdf, maxPages);
            detected.addAll(tableDetector.detect(pdf, maxPages));
            return bits;
        } catch (IOException e) {
            log.warn("PDF 打开失败，按空文档处理: {} ({})", path, e.getMessage());
            return DocumentBits.empty();
        }
    }
}
