package com.example.datasheet.util.identify;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 从文件路径中取标识符形状的组成部分
 *
 * 依次检查父目录、祖父目录、曾祖父目录名，最后是去掉扩展名的文件名。
 * 形状要求：^[A-Z][A-Z0-9\-.]{3,}$ 且至少一个数字。
 */
public class PathCandidateExtractor {

    public static final int ANCESTOR_LEVELS = 3;

    private static final Pattern PATH_COMPONENT = Pattern.compile("^[A-Z][A-Z0-9\\-.]{3,}$");

    private final Set<String> formatReject;

    public PathCandidateExtractor(Set<String> formatReject) {
        this.formatReject = formatReject;
    }

    public List<String> extract(Path path) {
        List<String> parts = new ArrayList<>();

        Path ancestor = path.getParent();
        for (int level = 0; level < ANCESTOR_LEVELS && ancestor != null; level++) {
            Path name = ancestor.getFileName();
            if (name != null) {
                String component = name.toString();
                if (!formatReject.contains(component) && isIdentifierShaped(component)) {
                    parts.add(component);
                }
            }
            ancestor = ancestor.getParent();
        }

        String stem = stem(path);
        if (isIdentifierShaped(stem) && !parts.contains(stem)) {
            parts.add(stem);
        }
        return parts;
    }

    static String stem(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean isIdentifierShaped(String component) {
        return PATH_COMPONENT.matcher(component).matches()
                && component.chars().anyMatch(Character::isDigit);
    }
}
