package com.example.datasheet.util.identify;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 厂商代码抽取（不经过 TokenClassifier）
 *
 * 1. 厂商文献代码（字母前缀族 + 定长字母数字后缀）
 * 2. 长度 ≥ 10、同时含字母和数字的字母数字串
 */
public class VendorCodeExtractor {

    private static final Pattern LONG_ALNUM = Pattern.compile("\\b[A-Z0-9]{10,}\\b");

    private final Pattern literalPattern;

    public VendorCodeExtractor(Pattern literalPattern) {
        this.literalPattern = literalPattern;
    }

    public List<String> extract(String text) {
        Set<String> out = new LinkedHashSet<>();

        Matcher literal = literalPattern.matcher(text);
        while (literal.find()) {
            out.add(literal.groupCount() > 0 ? literal.group(1) : literal.group());
        }

        Matcher m = LONG_ALNUM.matcher(text);
        while (m.find()) {
            String tok = m.group();
            if (hasLetterAndDigit(tok)) {
                out.add(tok);
            }
        }
        return new ArrayList<>(out);
    }

    private static boolean hasLetterAndDigit(String tok) {
        boolean letter = false;
        boolean digit = false;
        for (int i = 0; i < tok.length(); i++) {
            char c = tok.charAt(i);
            if (Character.isLetter(c)) {
                letter = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            }
        }
        return letter && digit;
    }
}
