package com.example.datasheet.util.table.feature;

import com.example.datasheet.util.table.dto.RawTable;

import java.util.List;

/**
 * 表头数量加分
 *
 * FIRST_MATCH 沿用旧的判断顺序：≥4 加 15，否则 ≥6 加 25。
 * 由于 ≥4 先命中，≥6 分支永远走不到，宽表和 4 列表得分相同。
 * CORRECTED 先判断 ≥6 再判断 ≥4。
 */
public class HeaderCountBonus implements TableFeature {

    public enum Mode {
        FIRST_MATCH,
        CORRECTED
    }

    public static final int MEDIUM_THRESHOLD = 4;
    public static final int MEDIUM_BONUS = 15;
    public static final int WIDE_THRESHOLD = 6;
    public static final int WIDE_BONUS = 25;

    private final Mode mode;

    public HeaderCountBonus(Mode mode) {
        this.mode = mode;
    }

    @Override
    public String name() {
        return "header_count_bonus";
    }

    @Override
    public int score(RawTable table, List<String> headers) {
        int count = headers.size();
        if (mode == Mode.CORRECTED) {
            if (count >= WIDE_THRESHOLD) {
                return WIDE_BONUS;
            }
            return count >= MEDIUM_THRESHOLD ? MEDIUM_BONUS : 0;
        }
        if (count >= MEDIUM_THRESHOLD) {
            return MEDIUM_BONUS;
        } else if (count >= WIDE_THRESHOLD) {
            return WIDE_BONUS;
        }
        return 0;
    }

    public Mode getMode() {
        return mode;
    }
}
