package com.example.datasheet.util.rule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 设计规则的校验、规范化与去重
 */
public final class DesignRules {

    /** 规则正文最短长度 */
    public static final int MIN_RULE_LENGTH = 8;

    private DesignRules() {
    }

    /**
     * 校验：group 非空白、rule 去空白后至少 8 个字符、pins 与 essential 必须给出
     */
    public static boolean isValid(DesignRule rule) {
        if (rule == null) {
            return false;
        }
        if (rule.getGroup() == null || rule.getGroup().trim().isEmpty()) {
            return false;
        }
        if (rule.getRule() == null || rule.getRule().trim().length() < MIN_RULE_LENGTH) {
            return false;
        }
        return rule.getPins() != null && rule.getEssential() != null;
    }

    /**
     * 规范化：去首尾空白、正文连续空白合并、丢弃空白引脚
     */
    public static DesignRule normalize(DesignRule rule) {
        String group = rule.getGroup() == null ? "" : rule.getGroup().trim();
        String text = rule.getRule() == null ? "" : String.join(" ", rule.getRule().trim().split("\\s+")).trim();

        List<String> pins = new ArrayList<>();
        if (rule.getPins() != null) {
            for (String pin : rule.getPins()) {
                if (pin != null && !pin.trim().isEmpty()) {
                    pins.add(pin.trim());
                }
            }
        }
        return new DesignRule(group, text, pins, Boolean.TRUE.equals(rule.getEssential()));
    }

    /**
     * 去重：按 (group, rule) 忽略大小写，保留第一次出现
     */
    public static List<DesignRule> dedup(List<DesignRule> rules) {
        Set<String> seen = new HashSet<>();
        List<DesignRule> out = new ArrayList<>();
        for (DesignRule rule : rules) {
            String key = rule.getGroup().toLowerCase(Locale.ROOT) + "\u0000" + rule.getRule().toLowerCase(Locale.ROOT);
            if (seen.add(key)) {
                out.add(rule);
            }
        }
        return out;
    }
}
