package com.example.datasheet.util.document;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 支持的文档格式（按扩展名判断）
 */
public enum DocumentFormat {

    /** 标记文档：.html / .htm */
    HTML,

    /** 分页文档：.pdf */
    PDF,

    UNSUPPORTED;

    public static DocumentFormat of(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return UNSUPPORTED;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".html") || name.endsWith(".htm")) {
            return HTML;
        }
        if (name.endsWith(".pdf")) {
            return PDF;
        }
        return UNSUPPORTED;
    }
}
