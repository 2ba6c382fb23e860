package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.RawTable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * HTML 表格发现
 *
 * 每个 &lt;table&gt; 收集所有 tr（含嵌套）；至少有一个非空单元格的行才保留，
 * 保留行数 ≥ 2 的表按最大列数补齐。
 */
public class HtmlTableDiscovery {

    public static final int MIN_ROWS = 2;

    public List<RawTable> discover(Document doc) {
        List<RawTable> tables = new ArrayList<>();

        for (Element table : doc.getElementsByTag("table")) {
            List<List<String>> rows = new ArrayList<>();
            for (Element tr : table.select("tr")) {
                List<String> cells = new ArrayList<>();
                boolean hasText = false;
                for (Element cell : tr.select("td, th")) {
                    String text = cell.text();
                    cells.add(text);
                    if (!text.trim().isEmpty()) {
                        hasText = true;
                    }
                }
                if (!cells.isEmpty() && hasText) {
                    rows.add(cells);
                }
            }

            if (rows.size() >= MIN_ROWS) {
                tables.add(RawTable.padded(rows));
            }
        }
        return tables;
    }
}
