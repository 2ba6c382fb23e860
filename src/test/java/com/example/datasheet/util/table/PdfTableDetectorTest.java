package com.example.datasheet.util.table;

import com.example.datasheet.util.identify.TableCandidateExtractor;
import com.example.datasheet.util.identify.TokenClassifier;
import com.example.datasheet.util.table.dto.DetectedTable;
import com.example.datasheet.util.table.dto.RawTable;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PdfTableDetectorTest {

    @TempDir
    Path dir;

    @Test
    void detect_shouldFindRuledTableWithLattice() throws Exception {
        Path file = TablePdfFixtures.write(dir, "pins.pdf", 1, TablePdfFixtures.PIN_ROWS);

        List<DetectedTable> detected;
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            detected = new PdfTableDetector(PdfTableDetector.Mode.LATTICE_THEN_STREAM).detect(doc, 10);
        }

        // lattice 有结果时不再跑 stream
        assertThat(detected).isNotEmpty();
        assertThat(detected).allMatch(t -> "lattice".equals(t.getAlgorithm()) && t.getPageNumber() == 1);

        List<RawTable> tables = new PdfTableDiscovery().discover(detected);
        assertThat(tables).hasSize(1);
        assertThat(tables.get(0).getRows()).isEqualTo(TablePdfFixtures.PIN_ROWS);
    }

    @Test
    void detect_shouldAlsoRunStreamWhenBothModesRequested() throws Exception {
        Path file = TablePdfFixtures.write(dir, "pins.pdf", 1, TablePdfFixtures.PIN_ROWS);

        List<DetectedTable> detected;
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            detected = new PdfTableDetector(PdfTableDetector.Mode.LATTICE_AND_STREAM).detect(doc, 10);
        }

        assertThat(detected).extracting(DetectedTable::getAlgorithm).contains("lattice", "stream");
    }

    @Test
    void detect_shouldRespectPageCap() throws Exception {
        Path file = TablePdfFixtures.write(dir, "pins.pdf", 3, TablePdfFixtures.PIN_ROWS);

        List<DetectedTable> detected;
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            detected = new PdfTableDetector(PdfTableDetector.Mode.LATTICE_THEN_STREAM).detect(doc, 2);
        }

        assertThat(detected).extracting(DetectedTable::getPageNumber).containsOnly(1, 2);
    }

    @Test
    void detect_shouldSkipPageThatFailsToParse() throws Exception {
        Path file = TablePdfFixtures.write(dir, "pins.pdf", 2, TablePdfFixtures.PIN_ROWS);

        List<DetectedTable> detected;
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            Page secondPage = new ObjectExtractor(doc).extract(2);
            ObjectExtractor extractor = mock(ObjectExtractor.class);
            when(extractor.extract(1)).thenThrow(new IllegalStateException("broken page"));
            when(extractor.extract(2)).thenReturn(secondPage);

            detected = new PdfTableDetector(PdfTableDetector.Mode.LATTICE_THEN_STREAM).detect(extractor, 2);
        }

        assertThat(detected).isNotEmpty();
        assertThat(detected).extracting(DetectedTable::getPageNumber).containsOnly(2);
    }

    @Test
    void detectedTables_shouldFeedOrderingColumnCandidates() throws Exception {
        Path file = TablePdfFixtures.write(dir, "orders.pdf", 1, TablePdfFixtures.ORDER_ROWS);
        ExtractionVocabulary vocabulary = ExtractionVocabulary.loadDefault();
        TableCandidateExtractor extractor =
                new TableCandidateExtractor(new TokenClassifier(vocabulary), vocabulary.getOrderingHeaderPattern());

        List<DetectedTable> detected;
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            detected = new PdfTableDetector(PdfTableDetector.Mode.LATTICE_THEN_STREAM).detect(doc, 10);
        }

        assertThat(extractor.extractFromPdf(detected)).containsExactly("ADS1115IDGSR", "ADS1114IDGSR");
    }
}
