package com.example.datasheet.util.identify;

import com.example.datasheet.util.vocabulary.ExtractionVocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 器件标识符判定（所有候选抽取器共用的唯一入口）
 *
 * token 依次通过以下规则才算标识符，任何一条不满足即拒绝：
 * 1. not-rejected：不在格式拒绝集，大写后不在协议/信号拒绝集
 * 2. length：长度在 [4, 80]
 * 3. alpha-first：首字符是字母
 * 4. has-digit：至少一个数字
 * 5. no-decimal：不含 "数字.数字"（版本号、电压值）
 * 6. not-signal：不是 "已知前缀 + 后缀" 形状的信号名
 * 7. no-punct-run：不含长度 ≥ 4 的 . + - _ 连续串
 * 8. charset：只含 [A-Z0-9-.]（大小写不敏感）
 */
public class TokenClassifier {

    /** 最大的大写字母数字片段 */
    public static final Pattern TOKEN_PATTERN = Pattern.compile("\\b[A-Z][A-Z0-9\\-.]{3,}\\b");

    public static final int MIN_LENGTH = 4;
    public static final int MAX_LENGTH = 80;

    private static final Pattern DECIMAL = Pattern.compile("\\d+\\.\\d+");
    private static final Pattern PUNCT_RUN = Pattern.compile("[.+\\-_]{4,}");
    private static final Pattern CHARSET = Pattern.compile("^[A-Z0-9\\-.]+$", Pattern.CASE_INSENSITIVE);

    private final List<Rule> rules;

    public TokenClassifier(ExtractionVocabulary vocabulary) {
        List<Rule> list = new ArrayList<>();
        list.add(new Rule("not-rejected", tok -> !vocabulary.getFormatReject().contains(tok)
                && !vocabulary.getProtocolReject().contains(tok.toUpperCase(Locale.ROOT))));
        list.add(new Rule("length", tok -> tok.length() >= MIN_LENGTH && tok.length() <= MAX_LENGTH));
        list.add(new Rule("alpha-first", tok -> Character.isLetter(tok.charAt(0))));
        list.add(new Rule("has-digit", tok -> tok.chars().anyMatch(Character::isDigit)));
        list.add(new Rule("no-decimal", tok -> !DECIMAL.matcher(tok).find()));
        list.add(new Rule("not-signal", tok -> !vocabulary.getSignalNamePattern().matcher(tok).matches()));
        list.add(new Rule("no-punct-run", tok -> !PUNCT_RUN.matcher(tok).find()));
        list.add(new Rule("charset", tok -> CHARSET.matcher(tok).matches()));
        this.rules = Collections.unmodifiableList(list);
    }

    /**
     * 判断 token 是否可能是器件标识符
     */
    public boolean isIdentifier(String tok) {
        return !rejectionReason(tok).isPresent();
    }

    /**
     * 返回第一条未通过的规则名；全部通过时返回 empty
     */
    public Optional<String> rejectionReason(String tok) {
        if (tok == null || tok.isEmpty()) {
            return Optional.of("length");
        }
        for (Rule rule : rules) {
            if (!rule.test.test(tok)) {
                return Optional.of(rule.name);
            }
        }
        return Optional.empty();
    }

    /**
     * 按出现顺序返回文本中所有被接受的 token（含重复）
     */
    public List<String> acceptedTokens(String text) {
        List<String> accepted = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return accepted;
        }
        Matcher m = TOKEN_PATTERN.matcher(text);
        while (m.find()) {
            String tok = m.group();
            if (isIdentifier(tok)) {
                accepted.add(tok);
            }
        }
        return accepted;
    }

    private static final class Rule {
        private final String name;
        private final Predicate<String> test;

        private Rule(String name, Predicate<String> test) {
            this.name = name;
            this.test = test;
        }
    }
}
