package com.example.datasheet.util.identify;

import com.example.datasheet.util.document.DocumentBits;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 封装代码抽取
 *
 * 两遍扫描取并集：
 * 1. 封装关键词（QFN、BGA、LQFP ...）后跟可选数字
 * 2. 通用形状 [A-Z]{2,5}[0-9]{2,4}，前缀在白名单内才接受
 * 结果去重、字典序排序，最多 20 个。
 */
public class PackageExtractor {

    public static final int MAX_PACKAGES = 20;

    private static final Pattern GENERIC_CODE = Pattern.compile("\\b([A-Z]{2,5}[0-9]{2,4})\\b");

    private final List<String> prefixes;
    private final List<Pattern> keywordPatterns;

    public PackageExtractor(ExtractionVocabulary vocabulary) {
        this.prefixes = vocabulary.getPackagePrefixes();
        this.keywordPatterns = new ArrayList<>();
        for (String keyword : vocabulary.getPackageKeywords()) {
            keywordPatterns.add(Pattern.compile("\\b" + Pattern.quote(keyword) + "[0-9]*\\b"));
        }
    }

    public List<String> extract(DocumentBits bits) {
        String text = bits.contentText();
        TreeSet<String> packages = new TreeSet<>();

        for (Pattern p : keywordPatterns) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                packages.add(m.group());
            }
        }

        Matcher m = GENERIC_CODE.matcher(text);
        while (m.find()) {
            String tok = m.group(1);
            if (hasKnownPrefix(tok)) {
                packages.add(tok);
            }
        }

        List<String> result = new ArrayList<>(packages);
        return result.size() > MAX_PACKAGES ? new ArrayList<>(result.subList(0, MAX_PACKAGES)) : result;
    }

    private boolean hasKnownPrefix(String tok) {
        for (String prefix : prefixes) {
            if (tok.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
