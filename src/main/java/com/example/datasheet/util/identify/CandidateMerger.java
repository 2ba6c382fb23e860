package com.example.datasheet.util.identify;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 多来源候选合并
 *
 * 来源按优先级依次追加，字符串完全相同（大小写敏感）时保留第一次出现；
 * 后面的来源只能追加前面没有的字符串。结果最多 2000 个。
 */
public class CandidateMerger {

    public static final int MAX_CANDIDATES = 2000;

    private final Set<String> merged = new LinkedHashSet<>();

    /**
     * 追加下一个来源
     */
    public CandidateMerger append(List<String> source) {
        if (source != null) {
            merged.addAll(source);
        }
        return this;
    }

    public List<String> candidates() {
        List<String> list = new ArrayList<>(merged);
        return list.size() > MAX_CANDIDATES ? new ArrayList<>(list.subList(0, MAX_CANDIDATES)) : list;
    }

    /**
     * 主标识符：合并结果的第一个；没有候选时为 null
     */
    public String primary() {
        return merged.isEmpty() ? null : merged.iterator().next();
    }
}
