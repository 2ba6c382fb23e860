package com.example.datasheet.util.table;

import com.example.datasheet.util.table.dto.RawTable;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlTableDiscoveryTest {

    private final HtmlTableDiscovery discovery = new HtmlTableDiscovery();

    @Test
    void discover_shouldPadRaggedRowsAndDropBlankRows() {
        List<RawTable> tables = discovery.discover(Jsoup.parse("<table>"
                + "<tr><th>Pin</th><th>Name</th><th>Type</th></tr>"
                + "<tr><td>1</td><td>VDD</td></tr>"
                + "<tr><td> </td><td></td></tr>"
                + "</table>"));

        assertThat(tables).hasSize(1);
        RawTable table = tables.get(0);
        assertThat(table.getColumnCount()).isEqualTo(3);
        assertThat(table.getRows()).containsExactly(
                Arrays.asList("Pin", "Name", "Type"),
                Arrays.asList("1", "VDD", ""));
    }

    @Test
    void discover_shouldSkipSingleRowTables() {
        assertThat(discovery.discover(Jsoup.parse("<table><tr><td>only</td></tr></table>"))).isEmpty();
        assertThat(discovery.discover(Jsoup.parse("<p>no tables</p>"))).isEmpty();
    }

    @Test
    void discover_shouldKeepDocumentOrder() {
        List<RawTable> tables = discovery.discover(Jsoup.parse(
                "<table><tr><td>A</td></tr><tr><td>1</td></tr></table>"
                        + "<table><tr><td>B</td></tr><tr><td>2</td></tr></table>"));

        assertThat(tables).extracting(t -> t.getHeader().get(0)).containsExactly("A", "B");
    }
}
