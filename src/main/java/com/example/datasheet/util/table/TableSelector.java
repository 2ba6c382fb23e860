package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.RawTable;
import com.example.datasheet.util.table.dto.ScoredTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 选出得分最高的表格
 *
 * 同分保持发现顺序（稳定排序）；最高分 ≤ 0 或没有表格时返回 empty，由调用方使用占位表。
 */
@Slf4j
public class TableSelector {

    private final PinTableScorer scorer;

    public TableSelector(PinTableScorer scorer) {
        this.scorer = scorer;
    }

    public Optional<RawTable> selectBest(List<RawTable> tables) {
        if (tables == null || tables.isEmpty()) {
            log.debug("没有候选表格");
            return Optional.empty();
        }

        List<ScoredTable> scored = new ArrayList<>(tables.size());
        for (RawTable table : tables) {
            scored.add(new ScoredTable(scorer.score(table), table));
        }
        // List.sort 是稳定排序
        scored.sort(Comparator.comparingInt(ScoredTable::getScore).reversed());

        ScoredTable best = scored.get(0);
        log.debug("最佳表格: {} (共 {} 张)", best, scored.size());
        if (best.getScore() <= 0) {
            return Optional.empty();
        }
        return Optional.of(best.getTable());
    }
}
