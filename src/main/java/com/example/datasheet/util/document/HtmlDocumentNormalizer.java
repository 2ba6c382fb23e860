package com.example.datasheet.util.document;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * HTML 文档归一化
 *
 * 标题行按级别分组收集（先全部 h1，再 h2 ...），每组内部保持文档顺序；
 * 正文只取前 50 个 &lt;p&gt;。
 */
@Slf4j
public class HtmlDocumentNormalizer {

    public static final String[] HEADING_TAGS = {"h1", "h2", "h3", "h4"};

    /** 正文采样的段落数上限 */
    private static final int BODY_PARAGRAPH_LIMIT = 50;

    public DocumentBits normalize(Path path) throws IOException {
        // 非法 UTF-8 字节替换为占位符，不中断解析
        String html = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return normalize(html);
    }

    public DocumentBits normalize(String html) {
        Document doc = Jsoup.parse(html);

        String title = doc.title().trim();

        List<String> headings = new ArrayList<>();
        for (String tag : HEADING_TAGS) {
            for (Element h : doc.getElementsByTag(tag)) {
                String text = h.text();
                if (!text.isEmpty()) {
                    headings.add(text);
                }
            }
        }

        List<String> metadata = new ArrayList<>();
        for (Element meta : doc.getElementsByTag("meta")) {
            String value = meta.attr("content");
            if (value.isEmpty()) {
                value = meta.attr("name");
            }
            if (!value.isEmpty()) {
                metadata.add(value.trim());
            }
        }

        Elements paragraphs = doc.getElementsByTag("p");
        List<String> bodyParts = new ArrayList<>();
        for (int i = 0; i < paragraphs.size() && i < BODY_PARAGRAPH_LIMIT; i++) {
            bodyParts.add(paragraphs.get(i).text());
        }
        String body = String.join(" ", bodyParts);

        DocumentBits bits = new DocumentBits(title, headings, metadata, body, doc);
        log.debug("HTML 归一化完成: {}", bits);
        return bits;
    }
}
