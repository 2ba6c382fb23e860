package com.example.datasheet.util.pin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 引脚表索引
 *
 * 第 0 列视为引脚号，第 1 列视为引脚名，第 0 行是表头。
 * 查找不区分大小写，返回值保留引脚表中的原始大小写。
 */
public class PinIndex {

    private final Set<String> pinNames = new HashSet<>();
    private final Set<String> pinNumbers = new HashSet<>();
    private final Map<String, String> numberToName = new HashMap<>();
    private final Map<String, String> canonicalNames = new HashMap<>();

    public PinIndex(List<List<String>> pinTable) {
        if (pinTable == null || pinTable.size() < 2) {
            return;
        }
        for (List<String> row : pinTable.subList(1, pinTable.size())) {
            if (row == null || row.isEmpty()) {
                continue;
            }
            String number = cell(row, 0);
            String name = cell(row, 1);
            if (!number.isEmpty()) {
                pinNumbers.add(number.toLowerCase(Locale.ROOT));
            }
            if (!name.isEmpty()) {
                String key = name.toLowerCase(Locale.ROOT);
                pinNames.add(key);
                canonicalNames.put(key, name);
            }
            if (!number.isEmpty() && !name.isEmpty()) {
                numberToName.put(number.toLowerCase(Locale.ROOT), name);
            }
        }
    }

    private static String cell(List<String> row, int index) {
        if (row.size() <= index || row.get(index) == null) {
            return "";
        }
        return row.get(index).trim();
    }

    /**
     * 把自由文本的引脚引用映射为引脚表中的引脚名
     *
     * - 命中引脚名：返回表中原始写法
     * - 命中引脚号：返回对应引脚名
     * - 其余丢弃
     * 结果按输入顺序去重。
     */
    public List<String> resolve(List<String> references) {
        Set<String> resolved = new LinkedHashSet<>();
        if (references == null) {
            return new ArrayList<>();
        }
        for (String reference : references) {
            if (reference == null) {
                continue;
            }
            String key = reference.trim().toLowerCase(Locale.ROOT);
            String canonical = null;
            if (pinNames.contains(key)) {
                canonical = canonicalNames.getOrDefault(key, reference.trim());
            } else if (pinNumbers.contains(key)) {
                canonical = numberToName.get(key);
            }
            if (canonical != null && !canonical.isEmpty()) {
                resolved.add(canonical);
            }
        }
        return new ArrayList<>(resolved);
    }

    public Set<String> getPinNames() { return Collections.unmodifiableSet(pinNames); }
    public Set<String> getPinNumbers() { return Collections.unmodifiableSet(pinNumbers); }
    public Map<String, String> getNumberToName() { return Collections.unmodifiableMap(numberToName); }

    public boolean isEmpty() {
        return pinNames.isEmpty() && pinNumbers.isEmpty();
    }
}
