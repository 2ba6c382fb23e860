package com.example.datasheet.util.table.feature;

import com.example.datasheet.util.table.dto.RawTable;

import java.util.List;

/**
 * 引脚表打分特征接口
 *
 * 每个特征独立给出一个整数贡献（可为负），由 PinTableScorer 累加。
 */
public interface TableFeature {

    /**
     * 特征名称（用于日志和分项明细）
     */
    String name();

    /**
     * @param table 至少 3 行的表格
     * @param headers 小写后的表头
     * @return 该特征的得分贡献
     */
    int score(RawTable table, List<String> headers);
}
