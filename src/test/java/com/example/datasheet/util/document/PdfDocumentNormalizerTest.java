package com.example.datasheet.util.document;

import com.example.datasheet.util.table.TablePdfFixtures;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PdfDocumentNormalizerTest {

    @TempDir
    Path dir;

    @Test
    void strip_shouldRemoveUnicodeWhitespaceAtEdges() {
        assertThat(PdfDocumentNormalizer.strip("  Pin Configuration \r")).isEqualTo("Pin Configuration");
        assertThat(PdfDocumentNormalizer.strip("  ")).isEmpty();
        assertThat(PdfDocumentNormalizer.strip("A B")).isEqualTo("A B");
    }

    @Test
    void normalize_shouldRespectPageCap() throws Exception {
        Path file = TablePdfFixtures.write(dir, "pins.pdf", 3, TablePdfFixtures.PIN_ROWS);

        DocumentBits bits;
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            bits = new PdfDocumentNormalizer().normalize(doc, 1);
        }

        assertThat(bits.getTitle()).contains("VDD");
        assertThat(bits.getHeadings()).isNotEmpty();
        // 只读第 1 页：每个单元格文本只出现一次
        assertThat(bits.getBody().split("RESET", -1)).hasSize(2);
        assertThat(bits.getTree()).isEmpty();
    }
}
