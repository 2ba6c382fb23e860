package com.example.datasheet.util.identify;

import com.example.datasheet.util.document.ForwardElementWalker;
import com.example.datasheet.util.document.HtmlDocumentNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 订购信息章节候选抽取（仅 HTML）
 *
 * 对每个文本匹配订购信息模式的 h1-h4，沿文档顺序向后最多走 maxSteps 个元素，
 * 按遇到顺序收集被接受的 token。
 */
@Slf4j
public class OrderingSectionExtractor {

    public static final int DEFAULT_MAX_STEPS = 50;

    private final TokenClassifier classifier;
    private final Pattern orderingPattern;
    private final int maxSteps;

    public OrderingSectionExtractor(TokenClassifier classifier, Pattern orderingPattern, int maxSteps) {
        this.classifier = classifier;
        this.orderingPattern = orderingPattern;
        this.maxSteps = maxSteps;
    }

    public List<String> extract(Document doc) {
        Set<String> parts = new LinkedHashSet<>();

        for (Element heading : doc.select(String.join(", ", HtmlDocumentNormalizer.HEADING_TAGS))) {
            if (!orderingPattern.matcher(heading.text()).find()) {
                continue;
            }
            log.debug("订购信息标题: '{}'", heading.text());

            ForwardElementWalker walker = new ForwardElementWalker(heading, maxSteps);
            while (walker.hasNext()) {
                Element element = walker.next();
                parts.addAll(classifier.acceptedTokens(element.text()));
            }
        }
        return new ArrayList<>(parts);
    }
}
