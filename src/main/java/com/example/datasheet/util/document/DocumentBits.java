package com.example.datasheet.util.document;

import org.jsoup.nodes.Document;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 统一的文档文本块
 *
 * 每个文档构建一次，所有抽取器只读使用：
 * - title：标题（HTML 的 &lt;title&gt;，PDF 首页前 200 个字符）
 * - headings：标题行（HTML 的 h1-h4，PDF 每页前 10 行短文本）
 * - metadata：元数据字符串（HTML 的 meta，PDF 的文档信息字典）
 * - body：正文
 * - tree：仅 HTML 输入有，用于表格/章节遍历
 */
public class DocumentBits {

    private final String title;
    private final List<String> headings;
    private final List<String> metadata;
    private final String body;
    private final Document tree;

    public DocumentBits(String title, List<String> headings, List<String> metadata, String body, Document tree) {
        this.title = title == null ? "" : title;
        this.headings = headings == null ? Collections.<String>emptyList() : List.copyOf(headings);
        this.metadata = metadata == null ? Collections.<String>emptyList() : List.copyOf(metadata);
        this.body = body == null ? "" : body;
        this.tree = tree;
    }

    public static DocumentBits empty() {
        return new DocumentBits("", null, null, "", null);
    }

    public String getTitle() { return title; }
    public List<String> getHeadings() { return headings; }
    public List<String> getMetadata() { return metadata; }
    public String getBody() { return body; }
    public Optional<Document> getTree() { return Optional.ofNullable(tree); }

    /** 标题行以 " \n " 拼接 */
    public String joinedHeadings() {
        return String.join(" \n ", headings);
    }

    /**
     * 候选打分使用的文本池：标题、标题行、元数据、正文
     */
    public String scoringText() {
        return String.join(" \n ", title, joinedHeadings(), String.join(" ", metadata), body);
    }

    /**
     * 封装与厂商代码使用的文本池：标题、标题行、正文（不含元数据）
     */
    public String contentText() {
        return String.join(" \n ", title, joinedHeadings(), body);
    }

    @Override
    public String toString() {
        return "DocumentBits{title='" + title + "', headings=" + headings.size()
                + ", metadata=" + metadata.size() + ", bodyLength=" + body.length()
                + ", tree=" + (tree != null) + "}";
    }
}
