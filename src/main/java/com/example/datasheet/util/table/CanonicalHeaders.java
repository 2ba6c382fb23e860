package com.example.datasheet.util.table;

import java.util.ArrayList;
import java.util.List;

/**
 * 引脚表的规范列名
 */
public final class CanonicalHeaders {

    public static final String PIN_NUMBER = "Pin Number";
    public static final String PIN_NAME = "Pin Name";
    public static final String SIGNAL_NAME = "Signal Name";
    public static final String DIRECTION = "Direction";
    public static final String TYPE = "Type";
    public static final String DESCRIPTION = "Description";

    public static final List<String> ALL = List.of(PIN_NUMBER, PIN_NAME, SIGNAL_NAME, DIRECTION, TYPE, DESCRIPTION);

    /** 结果 map 的默认封装标签 */
    public static final String DEFAULT_PACKAGE = "DEFAULT_PACKAGE";

    private CanonicalHeaders() {
    }

    /**
     * 只有规范表头、没有数据行的占位表
     */
    public static List<List<String>> sentinelTable() {
        List<List<String>> table = new ArrayList<>();
        table.add(new ArrayList<>(ALL));
        return table;
    }
}
