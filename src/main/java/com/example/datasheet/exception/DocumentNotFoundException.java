package com.example.datasheet.exception;

import java.io.FileNotFoundException;
import java.nio.file.Path;

/**
 * 输入文档不存在
 */
public class DocumentNotFoundException extends FileNotFoundException {

    private final transient Path path;

    public DocumentNotFoundException(Path path) {
        super("文档不存在: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
