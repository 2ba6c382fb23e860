package com.example.datasheet.util.vocabulary;

import java.util.Collections;
import java.util.List;

/**
 * 表头归一化规则
 *
 * 对小写、去空白后的表头文本做子串判断，四类条件同时满足才算命中：
 * - allOf：全部包含
 * - anyOf：至少包含一个（为空时不限制）
 * - noneOf：一个都不包含
 * - equalsAny：整体等于其中之一（为空时不限制）
 */
public class HeaderRule {

    private final String label;
    private final List<String> allOf;
    private final List<String> anyOf;
    private final List<String> noneOf;
    private final List<String> equalsAny;

    public HeaderRule(String label, List<String> allOf, List<String> anyOf,
                      List<String> noneOf, List<String> equalsAny) {
        this.label = label;
        this.allOf = allOf == null ? Collections.<String>emptyList() : List.copyOf(allOf);
        this.anyOf = anyOf == null ? Collections.<String>emptyList() : List.copyOf(anyOf);
        this.noneOf = noneOf == null ? Collections.<String>emptyList() : List.copyOf(noneOf);
        this.equalsAny = equalsAny == null ? Collections.<String>emptyList() : List.copyOf(equalsAny);
    }

    /**
     * @param normalizedHeader 已经 toLowerCase().trim() 的表头
     */
    public boolean matches(String normalizedHeader) {
        if (!equalsAny.isEmpty() && !equalsAny.contains(normalizedHeader)) {
            return false;
        }
        for (String word : allOf) {
            if (!normalizedHeader.contains(word)) {
                return false;
            }
        }
        if (!anyOf.isEmpty()) {
            boolean hit = false;
            for (String word : anyOf) {
                if (normalizedHeader.contains(word)) {
                    hit = true;
                    break;
                }
            }
            if (!hit) {
                return false;
            }
        }
        for (String word : noneOf) {
            if (normalizedHeader.contains(word)) {
                return false;
            }
        }
        return true;
    }

    public String getLabel() { return label; }
    public List<String> getAllOf() { return allOf; }
    public List<String> getAnyOf() { return anyOf; }
    public List<String> getNoneOf() { return noneOf; }
    public List<String> getEqualsAny() { return equalsAny; }

    @Override
    public String toString() {
        return "HeaderRule{label=" + label + ", allOf=" + allOf + ", anyOf=" + anyOf
                + ", noneOf=" + noneOf + ", equalsAny=" + equalsAny + "}";
    }
}
