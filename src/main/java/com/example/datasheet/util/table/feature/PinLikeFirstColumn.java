package com.example.datasheet.util.table.feature;

import com.example.datasheet.util.table.dto.RawTable;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 首列像引脚号：前 10 个非空首列数据单元格中，
 * 纯数字、BGA 坐标（字母 + 数字）或电源/地助记符每个加 8 分
 */
public class PinLikeFirstColumn implements TableFeature {

    public static final int POINTS = 8;
    public static final int SAMPLE_SIZE = 10;

    private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");
    private static final Pattern BALL_COORDINATE = Pattern.compile("^[A-Z]\\d+$");

    private final Set<String> supplyMnemonics;

    public PinLikeFirstColumn(Set<String> supplyMnemonics) {
        this.supplyMnemonics = supplyMnemonics;
    }

    @Override
    public String name() {
        return "pin_like_first_column";
    }

    @Override
    public int score(RawTable table, List<String> headers) {
        int sampled = 0;
        int pinLike = 0;
        for (List<String> row : table.getDataRows()) {
            if (row.isEmpty()) {
                continue;
            }
            String cell = row.get(0).trim();
            if (cell.isEmpty()) {
                continue;
            }
            if (sampled++ >= SAMPLE_SIZE) {
                break;
            }
            if (isPinLike(cell)) {
                pinLike++;
            }
        }
        return pinLike * POINTS;
    }

    boolean isPinLike(String cell) {
        return DIGITS.matcher(cell).matches()
                || BALL_COORDINATE.matcher(cell).matches()
                || supplyMnemonics.contains(cell.toUpperCase(Locale.ROOT));
    }
}
