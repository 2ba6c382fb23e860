package com.example.datasheet.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 文件扩展名既不是 HTML 也不是 PDF
 */
public class UnsupportedFormatException extends IOException {

    private final transient Path path;

    public UnsupportedFormatException(Path path) {
        super("不支持的文件格式: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
