package com.example.datasheet.util.table.feature;

import com.example.datasheet.util.table.dto.RawTable;

import java.util.List;

/**
 * 数据行数量：每行 2 分，封顶 40
 */
public class DataRowVolume implements TableFeature {

    public static final int POINTS_PER_ROW = 2;
    public static final int CAP = 40;

    @Override
    public String name() {
        return "data_row_volume";
    }

    @Override
    public int score(RawTable table, List<String> headers) {
        int dataRows = table.getRowCount() - 1;
        return Math.min(dataRows * POINTS_PER_ROW, CAP);
    }
}
